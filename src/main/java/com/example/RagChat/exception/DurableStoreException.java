package com.example.RagChat.exception;

/**
 * The durable session backing store is unreachable or rejected an operation.
 * Always recovered inside SessionStore by switching to degraded mode.
 */
public class DurableStoreException extends RagChatException {

    public DurableStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
