package com.example.RagChat.exception;

/**
 * Base type of every failure raised inside the conversation pipeline.
 */
public abstract class RagChatException extends RuntimeException {

    protected RagChatException(String message) {
        super(message);
    }

    protected RagChatException(String message, Throwable cause) {
        super(message, cause);
    }
}
