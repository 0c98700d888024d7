package com.example.RagChat.guardrail;

/**
 * Scores text for harmful content. Implementations may call an external moderation service.
 */
@FunctionalInterface
public interface ToxicityScorer {

    /**
     * @return a score in [0, 1], higher is more toxic
     */
    double score(String text);
}
