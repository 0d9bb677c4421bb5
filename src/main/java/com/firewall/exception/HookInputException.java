package com.firewall.exception;

/**
 * Exception thrown when the hook request on standard input is not valid JSON.
 */
public class HookInputException extends FirewallException {

    public HookInputException(String message) {
        super(message);
    }

    public HookInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
