package com.example.RagChat.model;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Immutable snapshot of one user's conversation.
 * Every mutation returns a new instance; the message list is append-only and ordered by timestamp.
 *
 * @param version compare-and-set token of the durable record, 0 when never persisted
 */
public record Session(
        String sessionId,
        String userId,
        Instant createdAt,
        Instant lastActivityAt,
        long ttlSeconds,
        List<Message> messages,
        List<SessionEvent> events,
        long version
) {
    /** Max number of observability events kept per session. */
    public static final int MAX_EVENTS = 20;

    public Session {
        messages = messages == null ? List.of() : List.copyOf(messages);
        events = events == null ? List.of() : List.copyOf(events);
    }

    public static Session create(String userId, Instant now, Duration ttl) {
        return new Session(UUID.randomUUID().toString(), userId, now, now, ttl.toSeconds(), List.of(), List.of(), 0L);
    }

    public Instant expiresAt() {
        return lastActivityAt.plusSeconds(ttlSeconds);
    }

    public boolean expiredAt(Instant now) {
        return now.isAfter(expiresAt());
    }

    public Duration ttlRemaining(Instant now) {
        Duration remaining = Duration.between(now, expiresAt());
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    public Session touch(Instant now) {
        return new Session(sessionId, userId, createdAt, latest(lastActivityAt, now), ttlSeconds, messages, events, version);
    }

    public Session append(List<Message> appended, Instant now) {
        List<Message> next = new ArrayList<>(messages);
        next.addAll(appended);
        return new Session(sessionId, userId, createdAt, latest(lastActivityAt, now), ttlSeconds, next, events, version);
    }

    public Session withEvent(SessionEvent event, Instant now) {
        List<SessionEvent> next = new ArrayList<>(events);
        next.add(event);
        if (next.size() > MAX_EVENTS) {
            next = next.subList(next.size() - MAX_EVENTS, next.size());
        }
        return new Session(sessionId, userId, createdAt, latest(lastActivityAt, now), ttlSeconds, messages, next, version);
    }

    public Session withVersion(long newVersion) {
        return new Session(sessionId, userId, createdAt, lastActivityAt, ttlSeconds, messages, events, newVersion);
    }

    /**
     * Union of this snapshot and {@code other}: messages and events are de-duplicated
     * (by message id, by event identity) and re-ordered by timestamp, the older creation
     * time and the newer activity time win. The version is taken from {@code other},
     * which is expected to be the durable copy.
     */
    public Session mergeWith(Session other) {
        if (other == null) {
            return this;
        }
        Map<String, Message> byId = new LinkedHashMap<>();
        other.messages.forEach(m -> byId.putIfAbsent(m.id(), m));
        messages.forEach(m -> byId.putIfAbsent(m.id(), m));
        List<Message> mergedMessages = new ArrayList<>(byId.values());
        // stable sort keeps insertion order for equal timestamps
        mergedMessages.sort(Comparator.comparing(Message::timestamp));

        List<SessionEvent> mergedEvents = new ArrayList<>(other.events);
        for (SessionEvent event : events) {
            if (!mergedEvents.contains(event)) {
                mergedEvents.add(event);
            }
        }
        mergedEvents.sort(Comparator.comparing(SessionEvent::at));
        if (mergedEvents.size() > MAX_EVENTS) {
            mergedEvents = mergedEvents.subList(mergedEvents.size() - MAX_EVENTS, mergedEvents.size());
        }

        return new Session(
                other.sessionId,
                userId,
                earliest(createdAt, other.createdAt),
                latest(lastActivityAt, other.lastActivityAt),
                ttlSeconds,
                mergedMessages,
                mergedEvents,
                other.version
        );
    }

    private static Instant latest(Instant a, Instant b) {
        return a.isAfter(b) ? a : b;
    }

    private static Instant earliest(Instant a, Instant b) {
        return a.isBefore(b) ? a : b;
    }
}
