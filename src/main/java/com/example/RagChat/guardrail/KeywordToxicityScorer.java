package com.example.RagChat.guardrail;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Heuristic scorer: each distinct keyword found as a whole word adds {@link #WEIGHT_PER_HIT}, capped at 1.
 * Matching on word boundaries keeps "whatever" from counting as "hate".
 */
public class KeywordToxicityScorer implements ToxicityScorer {

    static final double WEIGHT_PER_HIT = 0.5;

    private final List<Pattern> keywords;

    public KeywordToxicityScorer(List<String> keywords) {
        this.keywords = keywords.stream()
                .map(k -> k.toLowerCase(Locale.ROOT))
                .distinct()
                .map(k -> Pattern.compile("\\b" + Pattern.quote(k) + "\\b"))
                .toList();
    }

    @Override
    public double score(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        long hits = keywords.stream().filter(p -> p.matcher(lower).find()).count();
        return Math.min(1.0, hits * WEIGHT_PER_HIT);
    }
}
