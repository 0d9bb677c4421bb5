package com.firewall.policy;

import com.firewall.config.FirewallConfig;
import com.firewall.core.Platform;
import com.firewall.path.PathExpander;
import com.firewall.path.PathMatcher;
import com.firewall.operation.CommandPatternSet;

/**
 * Factory for creating PolicyEngine instances.
 */
public final class PolicyEngineFactory {

    private PolicyEngineFactory() {
    }

    /**
     * Engine for a platform, expanding paths against the process environment.
     */
    public static PolicyEngine create(FirewallConfig config, Platform platform) {
        return new DefaultPolicyEngine(config, platform);
    }

    /**
     * Engine expanding paths with the given expander, e.g. a fixed environment in tests.
     */
    public static PolicyEngine create(FirewallConfig config, PathExpander expander) {
        return new DefaultPolicyEngine(config, new PathMatcher(expander), CommandPatternSet.defaults());
    }
}
