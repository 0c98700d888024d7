package com.example.RagChat.guardrail;

import com.example.RagChat.model.Direction;
import com.example.RagChat.model.Severity;
import com.example.RagChat.model.ViolationKind;

import java.util.Optional;
import java.util.Set;

public class EmptyInputRule extends AbstractGuardrailRule {

    public static final String ID = "empty-input";

    public EmptyInputRule(FailureMode failureMode) {
        super(ID, ViolationKind.EMPTY, Severity.HIGH, Set.of(Direction.INPUT), failureMode);
    }

    @Override
    public Optional<RuleFinding> evaluate(String text) {
        return text.isBlank() ? Optional.of(RuleFinding.of("input cannot be empty")) : Optional.empty();
    }
}
