package com.firewall.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for the command firewall.
 */
@ConfigurationProperties(prefix = "firewall")
public class FirewallProperties {

    /**
     * Whether the firewall is enabled.
     */
    private boolean enabled = true;

    /**
     * Explicit base rule file. Supports classpath: prefix for classpath resources.
     * When unset the standard locations are searched.
     */
    private String configPath;

    /**
     * Command platform: auto, posix or windows.
     */
    private String platform = "auto";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getConfigPath() {
        return configPath;
    }

    public void setConfigPath(String configPath) {
        this.configPath = configPath;
    }

    public String getPlatform() {
        return platform;
    }

    public void setPlatform(String platform) {
        this.platform = platform;
    }
}
