package com.example.RagChat.exception;

/**
 * The index or the embedding provider is unavailable; the turn continues without context.
 */
public class RetrievalDegradedException extends RagChatException {

    public RetrievalDegradedException(String message, Throwable cause) {
        super(message, cause);
    }
}
