package com.example.RagChat.model;

/**
 * States of a single conversation turn.
 * RECEIVED -> INPUT_VALIDATING -> (BLOCKED | RETRIEVING) -> GENERATING -> OUTPUT_VALIDATING -> (BLOCKED | COMPLETED)
 */
public enum TurnState {
    RECEIVED,
    INPUT_VALIDATING,
    RETRIEVING,
    GENERATING,
    OUTPUT_VALIDATING,
    BLOCKED,
    COMPLETED;

    public boolean terminal() {
        return this == BLOCKED || this == COMPLETED;
    }
}
