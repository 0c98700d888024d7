package com.example.RagChat.model;

import java.time.Instant;

/**
 * Observability record kept next to the messages, e.g. a blocked turn.
 */
public record SessionEvent(
        String type,
        String detail,
        Instant at
) {
}
