package com.firewall.policy;

import com.firewall.config.FirewallConfig;
import com.firewall.core.Platform;

/**
 * Decides whether a shell command or a file edit may proceed.
 * Implementations hold no mutable state and may be shared between threads.
 */
public interface PolicyEngine {

    /**
     * Evaluate a shell command against generic rules and the zero-access, read-only and
     * no-delete path tiers, in that order. The first matching rule decides.
     *
     * @param command Command text as it would be run; null or blank is allowed
     * @return Decision, never null
     */
    Decision evaluateCommand(String command);

    /**
     * Evaluate a direct edit of a file against the zero-access and read-only tiers.
     *
     * @param path Path of the file to be edited; null or blank is allowed
     * @return Decision, never null
     */
    Decision evaluatePathEdit(String path);

    /**
     * Platform whose command syntax and path conventions apply.
     */
    Platform getPlatform();

    /**
     * The configuration the engine was built from.
     */
    FirewallConfig getConfig();
}
