package com.example.RagChat.session;

import com.example.RagChat.exception.DurableStoreException;
import com.example.RagChat.model.Session;

import java.time.Duration;
import java.util.Optional;

/**
 * Remote key-value backing of sessions, keyed by {@code session:<userId>}.
 * Every method except {@link #ping()} throws {@link DurableStoreException} when the store is unreachable.
 */
public interface DurableSessionStore {

    String KEY_PREFIX = "session:";

    /** Cheap reachability check, never throws. */
    boolean ping();

    Optional<Session> load(String userId);

    /**
     * Whole-record compare-and-set.
     *
     * @param expectedVersion version currently stored, 0 when the key must be absent
     * @param session         record to store, carrying its new version
     * @param ttl             native expiry of the key
     * @return false when another writer changed the record first
     */
    boolean compareAndSet(String userId, long expectedVersion, Session session, Duration ttl);

    void delete(String userId);

    static String keyOf(String userId) {
        return KEY_PREFIX + userId;
    }
}
