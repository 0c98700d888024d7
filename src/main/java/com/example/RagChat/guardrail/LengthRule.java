package com.example.RagChat.guardrail;

import com.example.RagChat.model.Direction;
import com.example.RagChat.model.Severity;
import com.example.RagChat.model.ViolationKind;

import java.util.Optional;
import java.util.Set;

/**
 * Rejects (HIGH) or truncates (MEDIUM/LOW) text longer than {@code maxLength} characters.
 */
public class LengthRule extends AbstractGuardrailRule {

    public static final String ID = "length";
    private static final String ELLIPSIS = "...";

    private final int maxLength;

    public LengthRule(int maxLength, Severity severity, Direction direction, FailureMode failureMode) {
        super(ID, ViolationKind.LENGTH, severity, Set.of(direction), failureMode);
        if (maxLength <= 0) {
            throw new IllegalArgumentException("maxLength must be positive: " + maxLength);
        }
        this.maxLength = maxLength;
    }

    public int maxLength() {
        return maxLength;
    }

    @Override
    public Optional<RuleFinding> evaluate(String text) {
        if (text.length() <= maxLength) {
            return Optional.empty();
        }
        String detail = "length " + text.length() + " exceeds maximum of " + maxLength + " characters";
        return Optional.of(RuleFinding.sanitized(detail, text.substring(0, maxLength) + ELLIPSIS));
    }
}
