package com.example.RagChat.model;

import java.util.List;

/**
 * Retrieval outcome for one question:
 * - question: the (sanitized) user question
 * - results: filtered scored chunks from the vector index
 * - context: formatted context string for LLM prompts
 */
public record RagRetrievalResult(
        String question,
        List<RetrievedResult> results,
        String context
) {
    public static RagRetrievalResult empty(String question) {
        return new RagRetrievalResult(question, List.of(), "(no results)");
    }
}
