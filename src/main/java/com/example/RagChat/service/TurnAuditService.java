package com.example.RagChat.service;

import com.example.RagChat.model.ChatResponse;
import com.example.RagChat.model.TurnAudit;
import com.example.RagChat.repository.TurnAuditRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;

/**
 * Writes one audit row per finished turn. Failures are logged and never reach the caller.
 */
@Service
@RequiredArgsConstructor
public class TurnAuditService {

    private static final Logger log = LoggerFactory.getLogger(TurnAuditService.class);

    private final TurnAuditRepository turnAuditRepository;
    private final ObjectMapper objectMapper;

    public void record(String userId, String question, String prompt, ChatResponse response, Duration elapsed) {
        try {
            TurnAudit audit = new TurnAudit();
            audit.setUserId(userId);
            audit.setState(response.state());
            audit.setBlockReason(response.blockReason());
            audit.setSessionBackend(response.sessionBackend());
            audit.setQuestion(question);
            audit.setPrompt(prompt);
            audit.setAnswer(response.blocked() ? null : response.response());
            audit.setSourcesJson(toJson(response.sources()));
            audit.setViolationsJson(toJson(response.violations()));
            audit.setDurationMs(elapsed.toMillis());
            turnAuditRepository.save(audit);
        } catch (RuntimeException e) {
            log.warn("Failed to write turn audit for user {}", userId, e);
        }
    }

    public List<TurnAudit> recent(String userId) {
        return turnAuditRepository.findTop20ByUserIdOrderByCreatedAtDesc(userId);
    }

    private String toJson(List<?> values) {
        if (values == null || values.isEmpty()) {
            return "[]";
        }
        try {
            return objectMapper.writeValueAsString(values);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize audit payload", e);
            return "[]";
        }
    }
}
