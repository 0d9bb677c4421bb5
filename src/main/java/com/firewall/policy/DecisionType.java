package com.firewall.policy;

/**
 * Outcome of a policy evaluation.
 */
public enum DecisionType {
    ALLOW,
    ASK,
    BLOCK
}
