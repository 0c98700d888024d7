package com.example.RagChat.model;

/**
 * A single rule hit produced by one validation call.
 *
 * @param ruleId    configured rule identifier, e.g. "pii.email"
 * @param kind      reason category shown to callers
 * @param severity  HIGH blocks the turn, MEDIUM sanitizes, LOW is informational
 * @param direction whether the rule ran on user input or model output
 * @param detail    short human-readable description, free of matched content
 */
public record GuardrailViolation(
        String ruleId,
        ViolationKind kind,
        Severity severity,
        Direction direction,
        String detail
) {
    public boolean blocking() {
        return severity == Severity.HIGH;
    }
}
