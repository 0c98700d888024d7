package com.example.RagChat.exception;

import com.example.RagChat.model.GuardrailViolation;

import java.util.List;

/**
 * A high-severity guardrail hit. User-facing, not a bug.
 */
public class ValidationBlockedException extends RagChatException {

    private final transient List<GuardrailViolation> violations;

    public ValidationBlockedException(List<GuardrailViolation> violations) {
        super("Blocked by guardrails: " + violations.stream()
                .filter(GuardrailViolation::blocking)
                .map(v -> v.kind().name())
                .distinct()
                .toList());
        this.violations = List.copyOf(violations);
    }

    public List<GuardrailViolation> getViolations() {
        return violations;
    }
}
