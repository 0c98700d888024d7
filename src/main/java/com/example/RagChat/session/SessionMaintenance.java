package com.example.RagChat.session;

import com.example.RagChat.model.SessionBackend;
import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Background housekeeping, so it also happens when no traffic arrives:
 *  - evict expired local sessions
 *  - re-probe a degraded durable store
 *  - bring the durable store up to date with pending deletes and writes
 */
@Component
@RequiredArgsConstructor
public class SessionMaintenance {

    private final SessionStore sessionStore;

    @Scheduled(fixedDelayString = "${ragchat.session.eviction-interval:PT1M}")
    public void run() {
        sessionStore.evictExpired();
        if (sessionStore.backend() == SessionBackend.DEGRADED) {
            sessionStore.probe();
        }
        sessionStore.syncPending();
    }
}
