package com.firewall.config;

import com.firewall.path.PathPattern;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Root rule configuration. Immutable; list order is evaluation order within each tier.
 *
 * @param genericRules    Command-text rules, checked first
 * @param zeroAccessPaths Paths that may not be referenced at all
 * @param readOnlyPaths   Paths that may be read but not modified
 * @param noDeletePaths   Paths that may not be deleted
 */
public record FirewallConfig(
        List<GenericRule> genericRules,
        List<PathPattern> zeroAccessPaths,
        List<PathPattern> readOnlyPaths,
        List<PathPattern> noDeletePaths
) {
    private static final FirewallConfig EMPTY = new FirewallConfig(List.of(), List.of(), List.of(), List.of());

    public FirewallConfig {
        genericRules = genericRules == null ? List.of() : List.copyOf(genericRules);
        zeroAccessPaths = zeroAccessPaths == null ? List.of() : List.copyOf(zeroAccessPaths);
        readOnlyPaths = readOnlyPaths == null ? List.of() : List.copyOf(readOnlyPaths);
        noDeletePaths = noDeletePaths == null ? List.of() : List.copyOf(noDeletePaths);
    }

    /**
     * Configuration with no rules; every command and edit is allowed.
     */
    public static FirewallConfig empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return genericRules.isEmpty() && zeroAccessPaths.isEmpty()
                && readOnlyPaths.isEmpty() && noDeletePaths.isEmpty();
    }

    /**
     * Total number of rules across all tiers.
     */
    public int size() {
        return genericRules.size() + zeroAccessPaths.size() + readOnlyPaths.size() + noDeletePaths.size();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for in-memory configurations, mainly for tests and programmatic setup.
     */
    public static final class Builder {
        private final List<GenericRule> genericRules = new ArrayList<>();
        private final List<PathPattern> zeroAccessPaths = new ArrayList<>();
        private final List<PathPattern> readOnlyPaths = new ArrayList<>();
        private final List<PathPattern> noDeletePaths = new ArrayList<>();

        private Builder() {
        }

        public Builder genericRule(GenericRule rule) {
            genericRules.add(rule);
            return this;
        }

        public Builder zeroAccess(String... patterns) {
            Arrays.stream(patterns).map(PathPattern::of).forEach(zeroAccessPaths::add);
            return this;
        }

        public Builder readOnly(String... patterns) {
            Arrays.stream(patterns).map(PathPattern::of).forEach(readOnlyPaths::add);
            return this;
        }

        public Builder noDelete(String... patterns) {
            Arrays.stream(patterns).map(PathPattern::of).forEach(noDeletePaths::add);
            return this;
        }

        public FirewallConfig build() {
            return new FirewallConfig(genericRules, zeroAccessPaths, readOnlyPaths, noDeletePaths);
        }
    }
}
