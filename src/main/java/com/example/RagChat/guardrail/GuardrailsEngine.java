package com.example.RagChat.guardrail;

import com.example.RagChat.model.Direction;
import com.example.RagChat.model.GuardrailViolation;
import com.example.RagChat.model.Severity;
import com.example.RagChat.model.ViolationKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs the configured rule list against input or output text.
 *
 * Severity policy:
 *  - HIGH: recorded, the caller must block the turn
 *  - MEDIUM: recorded, the rule's sanitized rewrite replaces the text for the following rules
 *  - LOW: recorded only
 *
 * The engine never touches the session or the index.
 */
public class GuardrailsEngine {

    private static final Logger log = LoggerFactory.getLogger(GuardrailsEngine.class);

    private final List<GuardrailRule> rules;
    private final boolean enabled;

    public GuardrailsEngine(List<GuardrailRule> rules, boolean enabled) {
        this.rules = List.copyOf(rules);
        this.enabled = enabled;
    }

    public List<GuardrailRule> rules() {
        return rules;
    }

    public GuardrailResult validate(String text, Direction direction) {
        String current = text == null ? "" : text;
        if (!enabled) {
            return GuardrailResult.clean(current);
        }

        List<GuardrailViolation> violations = new ArrayList<>();
        boolean modified = false;

        for (GuardrailRule rule : rules) {
            if (!rule.directions().contains(direction)) {
                continue;
            }

            Optional<RuleFinding> finding;
            try {
                finding = rule.evaluate(current);
            } catch (RuntimeException e) {
                if (rule.failureMode() == FailureMode.FAIL_CLOSED) {
                    log.error("Guardrail rule '{}' failed on {} and is fail-closed; blocking", rule.id(), direction, e);
                    violations.add(new GuardrailViolation(rule.id(), ViolationKind.DETECTOR_FAILURE,
                            Severity.HIGH, direction, "detector unavailable"));
                } else {
                    log.warn("Guardrail rule '{}' failed on {} and is fail-open; skipping", rule.id(), direction, e);
                }
                continue;
            }

            if (finding.isEmpty()) {
                continue;
            }
            RuleFinding hit = finding.get();
            violations.add(new GuardrailViolation(rule.id(), rule.kind(), rule.severity(), direction, hit.detail()));

            if (rule.severity() == Severity.MEDIUM && hit.sanitizedText() != null) {
                current = hit.sanitizedText();
                modified = true;
            }
        }

        if (!violations.isEmpty()) {
            log.debug("Guardrails {}: {} violation(s) {}", direction, violations.size(),
                    violations.stream().map(GuardrailViolation::ruleId).toList());
        }
        return new GuardrailResult(current, violations, modified);
    }
}
