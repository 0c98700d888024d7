package com.example.RagChat.guardrail;

import com.example.RagChat.model.GuardrailViolation;

import java.util.List;

/**
 * Result of validating one piece of text in one direction.
 *
 * @param sanitizedText text after all medium-severity rewrites
 * @param violations    every finding, in rule order
 * @param modified      whether any rule rewrote the text
 */
public record GuardrailResult(
        String sanitizedText,
        List<GuardrailViolation> violations,
        boolean modified
) {
    public GuardrailResult {
        violations = List.copyOf(violations);
    }

    public static GuardrailResult clean(String text) {
        return new GuardrailResult(text, List.of(), false);
    }

    public boolean blocked() {
        return violations.stream().anyMatch(GuardrailViolation::blocking);
    }

    public List<GuardrailViolation> blockingViolations() {
        return violations.stream().filter(GuardrailViolation::blocking).toList();
    }
}
