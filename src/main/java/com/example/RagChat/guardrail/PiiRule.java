package com.example.RagChat.guardrail;

import com.example.RagChat.model.Direction;
import com.example.RagChat.model.Severity;
import com.example.RagChat.model.ViolationKind;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * Detects one {@link PiiCategory}. The finding always carries the redacted text;
 * the engine only applies it below HIGH severity.
 */
public class PiiRule extends AbstractGuardrailRule {

    private final PiiCategory category;

    public PiiRule(PiiCategory category, Severity severity, Direction direction, FailureMode failureMode) {
        super(category.ruleId(), ViolationKind.PII, severity, Set.of(direction), failureMode);
        this.category = category;
    }

    public PiiCategory category() {
        return category;
    }

    @Override
    public Optional<RuleFinding> evaluate(String text) {
        Matcher matcher = category.pattern().matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String redacted = matcher.replaceAll(Matcher.quoteReplacement(category.redactionToken()));
        return Optional.of(RuleFinding.sanitized("PII detected: " + category.name().toLowerCase(Locale.ROOT), redacted));
    }
}
