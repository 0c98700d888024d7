package com.example.RagChat.config;

import com.example.RagChat.guardrail.BlockedPatternRule;
import com.example.RagChat.guardrail.EmptyInputRule;
import com.example.RagChat.guardrail.FailureMode;
import com.example.RagChat.guardrail.GuardrailRule;
import com.example.RagChat.guardrail.GuardrailsEngine;
import com.example.RagChat.guardrail.KeywordToxicityScorer;
import com.example.RagChat.guardrail.LengthRule;
import com.example.RagChat.guardrail.PiiCategory;
import com.example.RagChat.guardrail.PiiRule;
import com.example.RagChat.guardrail.ToxicityRule;
import com.example.RagChat.guardrail.ToxicityScorer;
import com.example.RagChat.model.Direction;
import com.example.RagChat.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

@Configuration
public class GuardrailConfig {

    private static final Logger log = LoggerFactory.getLogger(GuardrailConfig.class);

    /**
     * Keyword heuristic by default; replace with a bean backed by a moderation API when available.
     */
    @Bean
    @ConditionalOnMissingBean(ToxicityScorer.class)
    public ToxicityScorer toxicityScorer(RagChatProperties properties) {
        return new KeywordToxicityScorer(properties.getGuardrails().getToxicKeywords());
    }

    @Bean
    public GuardrailsEngine guardrailsEngine(RagChatProperties properties, ToxicityScorer toxicityScorer) {
        RagChatProperties.Guardrails cfg = properties.getGuardrails();
        List<GuardrailRule> rules = buildRules(cfg, toxicityScorer);
        log.info("Guardrails {} with {} rule(s): {}", cfg.isEnabled() ? "enabled" : "disabled", rules.size(), rules);
        return new GuardrailsEngine(rules, cfg.isEnabled());
    }

    /**
     * Rule order matters: rewrites of MEDIUM rules are visible to the rules after them.
     * Structural checks run first, then deny-list, PII and toxicity.
     */
    public static List<GuardrailRule> buildRules(RagChatProperties.Guardrails cfg, ToxicityScorer toxicityScorer) {
        Map<String, FailureMode> modes = cfg.getFailureModes();
        List<GuardrailRule> rules = new ArrayList<>();

        if (cfg.isLengthEnabled()) {
            rules.add(new LengthRule(cfg.getMaxInputLength(), Severity.HIGH, Direction.INPUT,
                    modes.get(LengthRule.ID)));
            rules.add(new LengthRule(cfg.getMaxOutputLength(), Severity.MEDIUM, Direction.OUTPUT,
                    modes.get(LengthRule.ID)));
        }
        if (cfg.isEmptyInputEnabled()) {
            rules.add(new EmptyInputRule(modes.get(EmptyInputRule.ID)));
        }
        if (cfg.isBlockedPatternsEnabled() && !cfg.getBlockedPatterns().isEmpty()) {
            rules.add(new BlockedPatternRule(cfg.getBlockedPatterns(), cfg.getBlockedPatternSeverity(),
                    EnumSet.of(Direction.INPUT), modes.get(BlockedPatternRule.ID)));
        }
        if (cfg.isPiiEnabled()) {
            for (PiiCategory category : PiiCategory.values()) {
                Severity input = cfg.getPiiInputSeverity().get(category);
                if (input != null) {
                    rules.add(new PiiRule(category, input, Direction.INPUT, modes.get(category.ruleId())));
                }
                Severity output = cfg.getPiiOutputSeverity().get(category);
                if (output != null) {
                    rules.add(new PiiRule(category, output, Direction.OUTPUT, modes.get(category.ruleId())));
                }
            }
        }
        if (cfg.isToxicityEnabled()) {
            rules.add(new ToxicityRule(toxicityScorer, cfg.getToxicityThreshold(), Severity.HIGH,
                    EnumSet.allOf(Direction.class), modes.get(ToxicityRule.ID)));
        }
        return rules;
    }
}
