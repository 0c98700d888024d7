package com.example.RagChat.exception;

import java.time.Duration;

/**
 * The turn deadline elapsed at a suspension point.
 */
public class TurnTimeoutException extends RagChatException {

    public TurnTimeoutException(String stage, Duration deadline) {
        super("Turn deadline of " + deadline.toMillis() + "ms exceeded during " + stage);
    }

    public TurnTimeoutException(String stage, Duration deadline, Throwable cause) {
        super("Turn deadline of " + deadline.toMillis() + "ms exceeded during " + stage, cause);
    }
}
