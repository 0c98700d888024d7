package com.example.RagChat.session;

import com.example.RagChat.exception.DurableStoreException;
import com.example.RagChat.model.Message;
import com.example.RagChat.model.Session;
import com.example.RagChat.model.SessionBackend;
import com.example.RagChat.model.SessionEvent;
import com.example.RagChat.model.SessionStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Per-user conversation history kept in two layers:
 *  - a process-local cache, written first and always successfully
 *  - a {@link DurableSessionStore}, written second; its failures never fail the call
 *
 * The store runs in one of two explicit modes ({@link SessionBackend}). The constructor probes the
 * durable layer; any durable failure switches to DEGRADED, where everything is local only.
 * While degraded, each operation re-probes at most once per {@code reprobeInterval} and a successful
 * probe switches back to DURABLE. Sessions written while degraded are merged into the durable copy
 * on their next operation (union by message id), so nothing buffered is lost or duplicated.
 *
 * Operations on the same user are serialized; different users never share a lock.
 */
public class SessionStore {

    private static final Logger log = LoggerFactory.getLogger(SessionStore.class);

    private final DurableSessionStore durable;
    private final Clock clock;
    private final Duration ttl;
    private final Duration reprobeInterval;
    private final int maxCasAttempts;
    private final int maxHistoryMessages;
    private final int maxHistoryChars;

    private final Map<String, Session> cache = new ConcurrentHashMap<>();
    private final UserLocks locks = new UserLocks();
    /** Users whose local copy holds writes the durable store has not seen yet. */
    private final Set<String> pendingSync = ConcurrentHashMap.newKeySet();
    /** Users expired while degraded; their durable record must go before anything is written. */
    private final Set<String> pendingDelete = ConcurrentHashMap.newKeySet();

    private final AtomicReference<SessionBackend> backend = new AtomicReference<>(SessionBackend.DEGRADED);
    private volatile Instant lastProbe;

    public SessionStore(DurableSessionStore durable,
                        Clock clock,
                        Duration ttl,
                        Duration reprobeInterval,
                        int maxCasAttempts,
                        int maxHistoryMessages,
                        int maxHistoryChars) {
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("Session TTL must be positive: " + ttl);
        }
        this.durable = durable;
        this.clock = clock;
        this.ttl = ttl;
        this.reprobeInterval = reprobeInterval;
        this.maxCasAttempts = Math.max(1, maxCasAttempts);
        this.maxHistoryMessages = maxHistoryMessages;
        this.maxHistoryChars = maxHistoryChars;
        probe();
    }

    // ------------------------------------------------------------------
    // Mode
    // ------------------------------------------------------------------

    public SessionBackend backend() {
        return backend.get();
    }

    /**
     * Check the durable store and switch mode accordingly.
     */
    public SessionBackend probe() {
        boolean reachable;
        try {
            reachable = durable.ping();
        } catch (RuntimeException e) {
            reachable = false;
        }
        lastProbe = clock.instant();
        switchTo(reachable ? SessionBackend.DURABLE : SessionBackend.DEGRADED,
                reachable ? "probe succeeded" : "probe failed");
        return backend.get();
    }

    private void maybeReprobe() {
        if (backend.get() != SessionBackend.DEGRADED) {
            return;
        }
        Instant last = lastProbe;
        if (last == null || !clock.instant().isBefore(last.plus(reprobeInterval))) {
            probe();
        }
    }

    private void degrade(DurableStoreException e) {
        log.warn("Durable session store failed, continuing with local cache only: {}", e.getMessage());
        lastProbe = clock.instant();
        switchTo(SessionBackend.DEGRADED, e.getMessage());
    }

    private void switchTo(SessionBackend target, String reason) {
        SessionBackend previous = backend.getAndSet(target);
        if (previous == target) {
            return;
        }
        if (target == SessionBackend.DURABLE) {
            log.info("Session store switched to DURABLE ({}), {} session(s) pending sync", reason, pendingSync.size());
        } else {
            log.warn("Session store switched to DEGRADED ({})", reason);
        }
    }

    // ------------------------------------------------------------------
    // Operations
    // ------------------------------------------------------------------

    /**
     * Current session of the user, created when absent or expired. Refreshes activity and TTL.
     */
    public Session get(String userId) {
        return withLock(userId, () -> {
            maybeReprobe();
            Instant now = clock.instant();
            return store(userId, loadCurrent(userId, now).touch(now));
        });
    }

    public Session append(String userId, Message message) {
        return appendAll(userId, List.of(message), null);
    }

    /**
     * Appends the user and assistant message of one turn as a single mutation.
     */
    public Session appendTurn(String userId, Message userMessage, Message assistantMessage) {
        return appendAll(userId, List.of(userMessage, assistantMessage), null);
    }

    /**
     * Same as {@link #appendTurn(String, Message, Message)}, but no durable write is started at or after
     * {@code syncDeadline}. The local copy is always written; an unsynced one is marked pending and merged
     * into the durable store by the user's next operation.
     */
    public Session appendTurn(String userId, Message userMessage, Message assistantMessage, Instant syncDeadline) {
        return appendAll(userId, List.of(userMessage, assistantMessage), syncDeadline);
    }

    private Session appendAll(String userId, List<Message> messages, Instant syncDeadline) {
        return withLock(userId, () -> {
            maybeReprobe();
            Instant now = clock.instant();
            return store(userId, loadCurrent(userId, now).append(messages, now), syncDeadline);
        });
    }

    /**
     * Records an observability event (e.g. a blocked turn) without adding a message.
     */
    public Session recordEvent(String userId, SessionEvent event) {
        return withLock(userId, () -> {
            maybeReprobe();
            Instant now = clock.instant();
            return store(userId, loadCurrent(userId, now).withEvent(event, now));
        });
    }

    /**
     * Last {@code limit} messages in order; empty when the user has no live session.
     * Does not create a session or refresh its TTL.
     */
    public List<Message> history(String userId, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive: " + limit);
        }
        return withLock(userId, () -> {
            maybeReprobe();
            List<Message> messages = peek(userId, clock.instant())
                    .map(Session::messages)
                    .orElse(List.of());
            return messages.size() <= limit ? messages : messages.subList(messages.size() - limit, messages.size());
        });
    }

    public List<Message> history(String userId) {
        return history(userId, Integer.MAX_VALUE);
    }

    /**
     * History rendered for the prompt, truncated by {@link HistoryFormatter}.
     */
    public String asPromptContext(String userId) {
        return HistoryFormatter.format(history(userId), maxHistoryMessages, maxHistoryChars);
    }

    /**
     * Logically deletes the session in both layers.
     */
    public void expire(String userId) {
        withLock(userId, () -> {
            maybeReprobe();
            cache.remove(userId);
            pendingSync.remove(userId);
            if (backend.get() == SessionBackend.DURABLE) {
                try {
                    durable.delete(userId);
                    pendingDelete.remove(userId);
                } catch (DurableStoreException e) {
                    degrade(e);
                    pendingDelete.add(userId);
                }
            } else {
                pendingDelete.add(userId);
            }
            log.debug("Session expired for user {}", userId);
            return null;
        });
    }

    public Optional<SessionStats> stats(String userId) {
        return withLock(userId, () -> {
            maybeReprobe();
            Instant now = clock.instant();
            return peek(userId, now).map(s -> new SessionStats(
                    s.messages().size(),
                    s.createdAt(),
                    s.lastActivityAt(),
                    s.ttlRemaining(now),
                    backend.get()
            ));
        });
    }

    /**
     * Drops expired entries from the local cache. The durable layer expires on its own.
     *
     * @return number of evicted sessions
     */
    public int evictExpired() {
        int evicted = 0;
        for (String userId : List.copyOf(cache.keySet())) {
            boolean removed = withLock(userId, () -> {
                Session session = cache.get(userId);
                if (session != null && session.expiredAt(clock.instant())) {
                    cache.remove(userId);
                    pendingSync.remove(userId);
                    return true;
                }
                return false;
            });
            if (removed) {
                evicted++;
            }
        }
        if (evicted > 0) {
            log.debug("Evicted {} expired session(s) from local cache", evicted);
        }
        return evicted;
    }

    /**
     * Catches the durable store up with work it missed, once it is reachable:
     *  - records of sessions expired while degraded are deleted
     *  - local sessions marked pending are merged and written
     * Without this a user who never comes back would keep its entry forever.
     *
     * @return number of users brought in sync
     */
    public int syncPending() {
        if (backend.get() != SessionBackend.DURABLE) {
            return 0;
        }
        int synced = 0;
        for (String userId : List.copyOf(pendingDelete)) {
            boolean done = withLock(userId, () -> {
                if (backend.get() != SessionBackend.DURABLE || !pendingDelete.contains(userId)) {
                    return false;
                }
                try {
                    durable.delete(userId);
                    pendingDelete.remove(userId);
                    return true;
                } catch (DurableStoreException e) {
                    degrade(e);
                    return false;
                }
            });
            if (done) {
                synced++;
            }
        }
        for (String userId : List.copyOf(pendingSync)) {
            boolean done = withLock(userId, () -> {
                if (backend.get() != SessionBackend.DURABLE || !pendingSync.contains(userId)) {
                    return false;
                }
                Session local = liveLocal(userId, clock.instant());
                if (local == null) {
                    pendingSync.remove(userId);
                    return false;
                }
                store(userId, local);
                return !pendingSync.contains(userId);
            });
            if (done) {
                synced++;
            }
        }
        if (synced > 0) {
            log.info("Synced {} pending session(s) to the durable store", synced);
        }
        return synced;
    }

    public int cachedSessionCount() {
        return cache.size();
    }

    public int pendingCount() {
        return pendingDelete.size() + pendingSync.size();
    }

    public int lockCount() {
        return locks.size();
    }

    // ------------------------------------------------------------------
    // Internals, always called with the user's lock held
    // ------------------------------------------------------------------

    /**
     * Local cache first, then the durable store, then a fresh session.
     */
    private Session loadCurrent(String userId, Instant now) {
        Session local = liveLocal(userId, now);
        if (local != null) {
            return local;
        }
        if (backend.get() == SessionBackend.DURABLE && !pendingDelete.contains(userId)) {
            try {
                Optional<Session> remote = durable.load(userId).filter(s -> !s.expiredAt(now));
                if (remote.isPresent()) {
                    cache.put(userId, remote.get());
                    return remote.get();
                }
            } catch (DurableStoreException e) {
                degrade(e);
            }
        }
        return Session.create(userId, now, ttl);
    }

    /**
     * Read-only lookup used by history and stats: no creation, no TTL refresh.
     */
    private Optional<Session> peek(String userId, Instant now) {
        Session local = liveLocal(userId, now);
        if (local != null) {
            return Optional.of(local);
        }
        if (backend.get() == SessionBackend.DURABLE && !pendingDelete.contains(userId)) {
            try {
                Optional<Session> remote = durable.load(userId).filter(s -> !s.expiredAt(now));
                remote.ifPresent(s -> cache.put(userId, s));
                return remote;
            } catch (DurableStoreException e) {
                degrade(e);
            }
        }
        return Optional.empty();
    }

    private Session liveLocal(String userId, Instant now) {
        Session local = cache.get(userId);
        if (local != null && local.expiredAt(now)) {
            cache.remove(userId);
            pendingSync.remove(userId);
            return null;
        }
        return local;
    }

    private Session store(String userId, Session session) {
        return store(userId, session, null);
    }

    /**
     * Local write, then durable write when possible and {@code syncDeadline} (if any) has not passed.
     */
    private Session store(String userId, Session session, Instant syncDeadline) {
        cache.put(userId, session);
        if (backend.get() == SessionBackend.DEGRADED) {
            pendingSync.add(userId);
            return session;
        }
        try {
            if (pendingDelete.contains(userId)) {
                durable.delete(userId);
                pendingDelete.remove(userId);
            }
            Optional<Session> persisted = writeDurable(userId, session, syncDeadline);
            if (persisted.isPresent()) {
                cache.put(userId, persisted.get());
                pendingSync.remove(userId);
                return persisted.get();
            }
            pendingSync.add(userId);
            return session;
        } catch (DurableStoreException e) {
            degrade(e);
            pendingSync.add(userId);
            return session;
        }
    }

    /**
     * Merge with the durable copy and compare-and-set, retrying on contention.
     *
     * @return the stored record, empty when every attempt lost the race or the deadline passed
     */
    private Optional<Session> writeDurable(String userId, Session local, Instant syncDeadline) {
        Instant now = clock.instant();
        for (int attempt = 1; attempt <= maxCasAttempts; attempt++) {
            if (syncDeadline != null && !clock.instant().isBefore(syncDeadline)) {
                log.debug("Deadline passed before durable write for user {}; kept locally", userId);
                return Optional.empty();
            }
            Optional<Session> stored = durable.load(userId);
            long expectedVersion = stored.map(Session::version).orElse(0L);
            Session base = stored
                    .filter(s -> !s.expiredAt(now))
                    .map(local::mergeWith)
                    .orElse(local);
            Session next = base.withVersion(expectedVersion + 1);
            if (durable.compareAndSet(userId, expectedVersion, next, Duration.ofSeconds(next.ttlSeconds()))) {
                return Optional.of(next);
            }
            log.debug("Session CAS conflict for user {} (attempt {}/{})", userId, attempt, maxCasAttempts);
        }
        log.warn("Giving up durable write for user {} after {} conflicting attempt(s); kept locally",
                userId, maxCasAttempts);
        return Optional.empty();
    }

    private <T> T withLock(String userId, Supplier<T> action) {
        return locks.withLock(userId, action);
    }
}
