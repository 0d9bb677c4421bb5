package com.firewall.operation;

import java.util.regex.Pattern;

/**
 * An operation template bound to one protected path.
 */
public record CompiledOperationRule(String operation, Pattern pattern) {

    public boolean matches(String command) {
        return pattern.matcher(command).find();
    }

    @Override
    public String toString() {
        return operation + " /" + pattern.pattern() + "/";
    }
}
