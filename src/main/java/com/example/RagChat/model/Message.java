package com.example.RagChat.model;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * One entry of a conversation. Immutable once appended.
 *
 * @param id                unique id, used to de-duplicate when local and durable copies are merged
 * @param sources           chunk ids the message was grounded on (assistant messages only)
 * @param redactionsApplied whether guardrails rewrote the content before it was stored
 */
public record Message(
        String id,
        Role role,
        String content,
        Instant timestamp,
        List<String> sources,
        boolean redactionsApplied
) {
    public Message {
        sources = sources == null ? List.of() : List.copyOf(sources);
    }

    public static Message user(String content, Instant at, boolean redacted) {
        return new Message(UUID.randomUUID().toString(), Role.USER, content, at, List.of(), redacted);
    }

    public static Message assistant(String content, Instant at, List<String> sources, boolean redacted) {
        return new Message(UUID.randomUUID().toString(), Role.ASSISTANT, content, at, sources, redacted);
    }
}
