package com.example.RagChat.model;

public enum BlockReason {
    INPUT_GUARDRAIL,
    OUTPUT_GUARDRAIL,
    GENERATION_FAILED,
    TIMEOUT,
    INTERNAL_ERROR
}
