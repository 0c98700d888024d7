package com.example.RagChat.exception;

/**
 * The LLM provider could not produce an answer after the configured retries.
 */
public class GenerationFailedException extends RagChatException {

    private final int attempts;

    public GenerationFailedException(int attempts, Throwable cause) {
        super("LLM generation failed after " + attempts + " attempt(s)", cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
