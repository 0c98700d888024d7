package com.example.RagChat.guardrail;

import com.example.RagChat.model.Direction;
import com.example.RagChat.model.Severity;
import com.example.RagChat.model.ViolationKind;

import java.util.Optional;
import java.util.Set;

/**
 * A single policy check. Rules are stateless and may be evaluated concurrently.
 */
public interface GuardrailRule {

    /** Stable identifier, used in violations and in failure-mode overrides. */
    String id();

    ViolationKind kind();

    Severity severity();

    /** Directions this rule applies to. */
    Set<Direction> directions();

    /** Explicit behaviour when {@link #evaluate(String)} throws. */
    FailureMode failureMode();

    /**
     * Check the text.
     *
     * @return empty when the text passes, otherwise the finding (optionally with a sanitized rewrite)
     */
    Optional<RuleFinding> evaluate(String text);
}
