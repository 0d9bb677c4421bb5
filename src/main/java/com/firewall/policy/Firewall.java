package com.firewall.policy;

import com.firewall.config.FirewallConfig;
import com.firewall.core.Platform;

/**
 * One-shot evaluation entry points taking the configuration and platform per call.
 * Each call compiles the rules; callers evaluating repeatedly should keep a {@link PolicyEngine}.
 */
public final class Firewall {

    private Firewall() {
    }

    public static Decision evaluateCommand(String command, FirewallConfig config, Platform platform) {
        return PolicyEngineFactory.create(config, platform).evaluateCommand(command);
    }

    public static Decision evaluatePathEdit(String path, FirewallConfig config, Platform platform) {
        return PolicyEngineFactory.create(config, platform).evaluatePathEdit(path);
    }
}
