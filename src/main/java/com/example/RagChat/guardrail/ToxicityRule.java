package com.example.RagChat.guardrail;

import com.example.RagChat.model.Direction;
import com.example.RagChat.model.Severity;
import com.example.RagChat.model.ViolationKind;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

public class ToxicityRule extends AbstractGuardrailRule {

    public static final String ID = "toxicity";

    private final ToxicityScorer scorer;
    private final double threshold;

    public ToxicityRule(ToxicityScorer scorer, double threshold, Severity severity,
                        Set<Direction> directions, FailureMode failureMode) {
        super(ID, ViolationKind.TOXICITY, severity, directions, failureMode);
        this.scorer = scorer;
        this.threshold = threshold;
    }

    @Override
    public Optional<RuleFinding> evaluate(String text) {
        double score = scorer.score(text);
        if (score < threshold) {
            return Optional.empty();
        }
        return Optional.of(RuleFinding.of(String.format(Locale.US, "toxicity score %.2f >= %.2f", score, threshold)));
    }
}
