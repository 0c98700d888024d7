package com.example.RagChat.config;

import com.example.RagChat.guardrail.FailureMode;
import com.example.RagChat.guardrail.GuardrailResult;
import com.example.RagChat.guardrail.GuardrailRule;
import com.example.RagChat.guardrail.GuardrailsEngine;
import com.example.RagChat.guardrail.KeywordToxicityScorer;
import com.example.RagChat.guardrail.PiiCategory;
import com.example.RagChat.guardrail.ToxicityRule;
import com.example.RagChat.model.Direction;
import com.example.RagChat.model.GuardrailViolation;
import com.example.RagChat.model.ViolationKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GuardrailConfigTest {

    private static GuardrailsEngine defaultEngine(RagChatProperties.Guardrails cfg) {
        List<GuardrailRule> rules = GuardrailConfig.buildRules(cfg, new KeywordToxicityScorer(cfg.getToxicKeywords()));
        return new GuardrailsEngine(rules, cfg.isEnabled());
    }

    @Test
    void defaultsRedactContactDetailsAndBlockCardNumbers() {
        GuardrailsEngine engine = defaultEngine(new RagChatProperties().getGuardrails());

        GuardrailResult email = engine.validate("mail alice@example.com or call 555-123-4567", Direction.INPUT);
        assertFalse(email.blocked());
        assertEquals("mail [REDACTED_EMAIL] or call [REDACTED_PHONE]", email.sanitizedText());

        GuardrailResult card = engine.validate("card 4111-1111-1111-1111 please", Direction.INPUT);
        assertTrue(card.blocked());
        assertEquals(List.of("pii.credit_card"), card.blockingViolations().stream().map(GuardrailViolation::ruleId).toList());

        GuardrailResult ssn = engine.validate("my ssn is 123-45-6789", Direction.INPUT);
        assertTrue(ssn.blocked());
    }

    @Test
    void outputPiiIsRedactedNotBlocked() {
        GuardrailsEngine engine = defaultEngine(new RagChatProperties().getGuardrails());

        GuardrailResult result = engine.validate("The SSN on file is 123-45-6789.", Direction.OUTPUT);

        assertFalse(result.blocked());
        assertEquals("The SSN on file is [REDACTED_SSN].", result.sanitizedText());
    }

    @Test
    void defaultBlockedPatternsRejectInput() {
        GuardrailsEngine engine = defaultEngine(new RagChatProperties().getGuardrails());

        GuardrailResult result = engine.validate("password: hunter2", Direction.INPUT);

        assertTrue(result.blocked());
        assertEquals(ViolationKind.BLOCKED_PATTERN, result.blockingViolations().get(0).kind());
        assertFalse(engine.validate("What is machine learning?", Direction.INPUT).blocked());
    }

    @Test
    void togglesRemoveRules() {
        RagChatProperties.Guardrails cfg = new RagChatProperties().getGuardrails();
        cfg.setPiiEnabled(false);
        cfg.setToxicityEnabled(false);

        List<GuardrailRule> rules = GuardrailConfig.buildRules(cfg, text -> 0.0);

        assertTrue(rules.stream().noneMatch(r -> r.kind() == ViolationKind.PII || r.kind() == ViolationKind.TOXICITY));
    }

    @Test
    void failureModeOverrideIsApplied() {
        RagChatProperties.Guardrails cfg = new RagChatProperties().getGuardrails();
        cfg.getFailureModes().put(ToxicityRule.ID, FailureMode.FAIL_OPEN);

        GuardrailRule toxicity = GuardrailConfig.buildRules(cfg, text -> 0.0).stream()
                .filter(r -> r.id().equals(ToxicityRule.ID))
                .findFirst()
                .orElseThrow();

        assertEquals(FailureMode.FAIL_OPEN, toxicity.failureMode());
    }

    @Test
    void piiCategoriesRunLongestDigitRunsFirst() {
        List<String> order = GuardrailConfig.buildRules(new RagChatProperties().getGuardrails(), text -> 0.0).stream()
                .filter(r -> r.kind() == ViolationKind.PII && r.directions().contains(Direction.INPUT))
                .map(GuardrailRule::id)
                .toList();

        assertEquals(List.of(PiiCategory.CREDIT_CARD.ruleId(), PiiCategory.SSN.ruleId(),
                PiiCategory.EMAIL.ruleId(), PiiCategory.PHONE.ruleId()), order);
    }
}
