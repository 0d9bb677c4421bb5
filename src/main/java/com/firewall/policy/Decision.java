package com.firewall.policy;

import java.util.Objects;

/**
 * Result of evaluating a command or an edit path: allow, ask for confirmation, or block.
 * Ask and block decisions carry a reason; blocks raised by a path tier also carry the
 * protected pattern and, for commands, the operation that was recognized.
 */
public final class Decision {

    private static final Decision ALLOW = new Decision(DecisionType.ALLOW, null, null, null);

    private final DecisionType type;
    private final String reason;
    private final String operation;
    private final String pattern;

    private Decision(DecisionType type, String reason, String operation, String pattern) {
        this.type = type;
        this.reason = reason;
        this.operation = operation;
        this.pattern = pattern;
    }

    public static Decision allow() {
        return ALLOW;
    }

    public static Decision ask(String reason) {
        return new Decision(DecisionType.ASK, Objects.requireNonNull(reason, "reason"), null, null);
    }

    public static Decision block(String reason) {
        return new Decision(DecisionType.BLOCK, Objects.requireNonNull(reason, "reason"), null, null);
    }

    /**
     * Create a block raised by a path tier.
     *
     * @param reason    Human-readable reason
     * @param operation Recognized operation, or null for reference and direct-path checks
     * @param pattern   Protected pattern as written in the rules
     */
    public static Decision block(String reason, String operation, String pattern) {
        return new Decision(DecisionType.BLOCK, Objects.requireNonNull(reason, "reason"), operation, pattern);
    }

    public DecisionType getType() {
        return type;
    }

    /**
     * Reason for an ask or block; null when allowed.
     */
    public String getReason() {
        return reason;
    }

    public String getOperation() {
        return operation;
    }

    public String getPattern() {
        return pattern;
    }

    public boolean isAllowed() {
        return type == DecisionType.ALLOW;
    }

    public boolean isAsk() {
        return type == DecisionType.ASK;
    }

    public boolean isBlocked() {
        return type == DecisionType.BLOCK;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Decision other)) return false;
        return type == other.type
                && Objects.equals(reason, other.reason)
                && Objects.equals(operation, other.operation)
                && Objects.equals(pattern, other.pattern);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, reason, operation, pattern);
    }

    @Override
    public String toString() {
        if (type == DecisionType.ALLOW) {
            return "Decision{ALLOW}";
        }
        return "Decision{" + type +
                ", reason='" + reason + '\'' +
                (operation != null ? ", operation=" + operation : "") +
                (pattern != null ? ", pattern=" + pattern : "") +
                '}';
    }
}
