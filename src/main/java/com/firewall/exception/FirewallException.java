package com.firewall.exception;

/**
 * Base exception for the command firewall.
 */
public class FirewallException extends RuntimeException {

    public FirewallException(String message) {
        super(message);
    }

    public FirewallException(String message, Throwable cause) {
        super(message, cause);
    }
}
