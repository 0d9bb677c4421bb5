package com.firewall.config;

/**
 * Path-independent rule matched against the whole command text.
 *
 * @param pattern Regular expression, matched case-insensitively anywhere in the command
 * @param reason  Human-readable reason reported with the decision; defaults to naming the pattern
 * @param ask     If true the user is asked for confirmation; otherwise the command is blocked
 */
public record GenericRule(
        String pattern,
        String reason,
        boolean ask
) {
    public GenericRule {
        if (reason == null || reason.isBlank()) {
            reason = "Blocked by pattern: " + pattern;
        }
    }

    /**
     * Create a rule that blocks matching commands.
     */
    public static GenericRule block(String pattern, String reason) {
        return new GenericRule(pattern, reason, false);
    }

    /**
     * Create a rule that asks before running matching commands.
     */
    public static GenericRule ask(String pattern, String reason) {
        return new GenericRule(pattern, reason, true);
    }
}
