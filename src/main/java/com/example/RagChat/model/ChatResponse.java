package com.example.RagChat.model;

import java.util.List;

/**
 * Result of one turn. Every orchestrator path ends in one of these.
 *
 * @param response       answer text, or a user-facing explanation when blocked
 * @param sources        citations of the chunks the answer was grounded on
 * @param blocked        whether the turn ended in BLOCKED
 * @param violations     guardrail findings of both directions
 * @param sessionBackend whether history is durable or local-only for this turn
 * @param state          terminal state of the turn
 * @param blockReason    category of the block, null when completed
 */
public record ChatResponse(
        String response,
        List<SourceRef> sources,
        boolean blocked,
        List<GuardrailViolation> violations,
        SessionBackend sessionBackend,
        TurnState state,
        BlockReason blockReason
) {
    public static ChatResponse completed(String response,
                                         List<SourceRef> sources,
                                         List<GuardrailViolation> violations,
                                         SessionBackend backend) {
        return new ChatResponse(response, List.copyOf(sources), false, List.copyOf(violations), backend,
                TurnState.COMPLETED, null);
    }

    public static ChatResponse blocked(String response,
                                       BlockReason reason,
                                       List<GuardrailViolation> violations,
                                       SessionBackend backend) {
        return new ChatResponse(response, List.of(), true, List.copyOf(violations), backend,
                TurnState.BLOCKED, reason);
    }
}
