package com.example.RagChat.guardrail;

import com.example.RagChat.model.Direction;
import com.example.RagChat.model.Severity;
import com.example.RagChat.model.ViolationKind;

import java.util.Objects;
import java.util.Set;

/**
 * Holds the static description shared by all rules.
 */
public abstract class AbstractGuardrailRule implements GuardrailRule {

    private final String id;
    private final ViolationKind kind;
    private final Severity severity;
    private final Set<Direction> directions;
    private final FailureMode failureMode;

    protected AbstractGuardrailRule(String id,
                                    ViolationKind kind,
                                    Severity severity,
                                    Set<Direction> directions,
                                    FailureMode failureMode) {
        this.id = Objects.requireNonNull(id, "id");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.severity = Objects.requireNonNull(severity, "severity");
        this.directions = Set.copyOf(directions);
        this.failureMode = failureMode != null ? failureMode : defaultFailureMode(severity);
    }

    /** High-severity rules are safety-critical unless configured otherwise. */
    public static FailureMode defaultFailureMode(Severity severity) {
        return severity == Severity.HIGH ? FailureMode.FAIL_CLOSED : FailureMode.FAIL_OPEN;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public ViolationKind kind() {
        return kind;
    }

    @Override
    public Severity severity() {
        return severity;
    }

    @Override
    public Set<Direction> directions() {
        return directions;
    }

    @Override
    public FailureMode failureMode() {
        return failureMode;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + id + ", " + severity + ", " + directions + "]";
    }
}
