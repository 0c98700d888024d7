package com.example.RagChat.session;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One {@link ReentrantLock} per user, held in the map only while some thread owns or waits for it.
 * Entries are reference counted inside {@link ConcurrentHashMap#compute}, so an entry is never removed
 * while another thread is about to lock it.
 */
public class UserLocks {

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();

    private static final class Entry {
        final ReentrantLock lock = new ReentrantLock();
        int holders;
    }

    public <T> T withLock(String userId, Supplier<T> action) {
        Entry entry = retain(userId);
        try {
            entry.lock.lock();
            try {
                return action.get();
            } finally {
                entry.lock.unlock();
            }
        } finally {
            release(userId);
        }
    }

    /**
     * Like {@link #withLock} but gives up after {@code timeout}.
     *
     * @throws LockTimeoutException when the lock was not acquired in time
     * @throws InterruptedException when interrupted while waiting
     */
    public <T> T withLock(String userId, Duration timeout, Supplier<T> action) throws InterruptedException {
        Entry entry = retain(userId);
        try {
            if (!entry.lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new LockTimeoutException(userId, timeout);
            }
            try {
                return action.get();
            } finally {
                entry.lock.unlock();
            }
        } finally {
            release(userId);
        }
    }

    /** Number of users currently holding or waiting for a lock. */
    public int size() {
        return entries.size();
    }

    private Entry retain(String userId) {
        return entries.compute(userId, (id, current) -> {
            Entry entry = current == null ? new Entry() : current;
            entry.holders++;
            return entry;
        });
    }

    private void release(String userId) {
        entries.computeIfPresent(userId, (id, entry) -> --entry.holders == 0 ? null : entry);
    }

    public static class LockTimeoutException extends RuntimeException {
        public LockTimeoutException(String userId, Duration timeout) {
            super("Lock for user " + userId + " not acquired within " + timeout.toMillis() + " ms");
        }
    }
}
