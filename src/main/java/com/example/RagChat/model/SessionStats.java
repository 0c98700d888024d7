package com.example.RagChat.model;

import java.time.Duration;
import java.time.Instant;

public record SessionStats(
        int messageCount,
        Instant createdAt,
        Instant lastActivityAt,
        Duration ttlRemaining,
        SessionBackend backend
) {
}
