package com.firewall.exception;

/**
 * Exception thrown when a rule file cannot be read or is structurally invalid.
 * A missing rule file is not an error; it yields an empty configuration.
 */
public class ConfigurationException extends FirewallException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
