package com.firewall.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Combines a base configuration with a platform overlay.
 * Each list of the result is the base list followed by the overlay list.
 */
public final class ConfigMerge {

    private ConfigMerge() {
    }

    public static FirewallConfig merge(FirewallConfig base, FirewallConfig overlay) {
        if (base == null) {
            base = FirewallConfig.empty();
        }
        if (overlay == null) {
            overlay = FirewallConfig.empty();
        }
        return new FirewallConfig(
                concat(base.genericRules(), overlay.genericRules()),
                concat(base.zeroAccessPaths(), overlay.zeroAccessPaths()),
                concat(base.readOnlyPaths(), overlay.readOnlyPaths()),
                concat(base.noDeletePaths(), overlay.noDeletePaths()));
    }

    private static <T> List<T> concat(List<T> first, List<T> second) {
        List<T> result = new ArrayList<>(first.size() + second.size());
        result.addAll(first);
        result.addAll(second);
        return result;
    }
}
