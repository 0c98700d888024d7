package com.example.RagChat.controller;

import com.example.RagChat.model.Message;
import com.example.RagChat.model.SessionBackend;
import com.example.RagChat.model.SessionStats;
import com.example.RagChat.model.TurnAudit;
import com.example.RagChat.service.TurnAuditService;
import com.example.RagChat.session.SessionStore;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/sessions")
@RequiredArgsConstructor
public class SessionController {

    private final SessionStore sessionStore;
    private final TurnAuditService turnAuditService;

    @GetMapping("/{userId}/history")
    public List<Message> history(@PathVariable String userId,
                                 @RequestParam(value = "limit", defaultValue = "50") int limit) {
        return sessionStore.history(userId, limit);
    }

    @GetMapping("/{userId}/stats")
    public ResponseEntity<SessionStats> stats(@PathVariable String userId) {
        return ResponseEntity.of(sessionStore.stats(userId));
    }

    /**
     * Audit rows of the user's latest turns, newest first. Kept independently of the session TTL.
     */
    @GetMapping("/{userId}/turns")
    public List<TurnAudit> turns(@PathVariable String userId) {
        return turnAuditService.recent(userId);
    }

    @DeleteMapping("/{userId}")
    public ResponseEntity<Void> expire(@PathVariable String userId) {
        sessionStore.expire(userId);
        return ResponseEntity.noContent().build();
    }

    /**
     * Current mode of the session store; {@code probe=true} checks the durable store first.
     */
    @GetMapping("/backend")
    public Map<String, SessionBackend> backend(@RequestParam(value = "probe", defaultValue = "false") boolean probe) {
        SessionBackend backend = probe ? sessionStore.probe() : sessionStore.backend();
        return Map.of("backend", backend);
    }
}
