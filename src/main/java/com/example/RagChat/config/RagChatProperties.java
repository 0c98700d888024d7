package com.example.RagChat.config;

import com.example.RagChat.guardrail.FailureMode;
import com.example.RagChat.guardrail.PiiCategory;
import com.example.RagChat.model.Severity;
import com.example.RagChat.service.SpringAiLlmClient;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * All tunables of the pipeline, bound from the {@code ragchat.*} namespace.
 */
@Data
@ConfigurationProperties(prefix = "ragchat")
public class RagChatProperties {

    private Chunk chunk = new Chunk();
    private Retrieval retrieval = new Retrieval();
    private Generation generation = new Generation();
    private Guardrails guardrails = new Guardrails();
    private SessionSettings session = new SessionSettings();
    private Index index = new Index();
    private Ingest ingest = new Ingest();

    /** Upper bound for a whole turn, across retrieval, generation and persistence. */
    private Duration turnDeadline = Duration.ofSeconds(60);

    @Data
    public static class Chunk {
        private int size = 1000;
        private int overlap = 200;
    }

    @Data
    public static class Retrieval {
        private int topK = 5;
        /** Preferred minimum score; adapted to the actual score distribution, see RetrievalService. */
        private double minScore = 0.60;
    }

    @Data
    public static class Generation {
        /** Preferred chat client, e.g. "deepseek" or "openai"; falls back to any available one. */
        private String model = SpringAiLlmClient.DEFAULT_MODEL;
        private double temperature = 0.7;
        private int maxTokens = 1000;
        private Retry retry = new Retry();
    }

    @Data
    public static class Retry {
        /** Retries after the first failed call. */
        private int maxAttempts = 1;
        private Duration backoff = Duration.ofMillis(500);
    }

    @Data
    public static class Guardrails {
        private boolean enabled = true;
        private int maxInputLength = 2000;
        private int maxOutputLength = 2000;
        private boolean lengthEnabled = true;
        private boolean emptyInputEnabled = true;
        private boolean blockedPatternsEnabled = true;
        private Severity blockedPatternSeverity = Severity.HIGH;
        private List<String> blockedPatterns = new ArrayList<>(List.of(
                "\\b(hack|exploit|bypass|jailbreak)\\b",
                "\\b(password|secret|token)\\s*[:=]"
        ));
        private boolean piiEnabled = true;
        private Map<PiiCategory, Severity> piiInputSeverity = new EnumMap<>(Map.of(
                PiiCategory.EMAIL, Severity.MEDIUM,
                PiiCategory.PHONE, Severity.MEDIUM,
                PiiCategory.SSN, Severity.HIGH,
                PiiCategory.CREDIT_CARD, Severity.HIGH
        ));
        private Map<PiiCategory, Severity> piiOutputSeverity = new EnumMap<>(Map.of(
                PiiCategory.EMAIL, Severity.MEDIUM,
                PiiCategory.PHONE, Severity.MEDIUM,
                PiiCategory.SSN, Severity.MEDIUM,
                PiiCategory.CREDIT_CARD, Severity.MEDIUM
        ));
        private boolean toxicityEnabled = true;
        private double toxicityThreshold = 0.5;
        private List<String> toxicKeywords = new ArrayList<>(List.of(
                "hate", "violence", "harassment", "discrimination",
                "illegal", "harmful", "dangerous"
        ));
        /** Per-rule override of the fail-open/fail-closed behaviour, keyed by rule id. */
        private Map<String, FailureMode> failureModes = new HashMap<>();
    }

    @Data
    public static class SessionSettings {
        private Duration ttl = Duration.ofHours(1);
        /** Minimum delay between two probes of the durable store while degraded. */
        private Duration reprobeInterval = Duration.ofSeconds(5);
        private int maxHistoryMessages = 6;
        private int maxHistoryChars = 2000;
        private Duration evictionInterval = Duration.ofMinutes(1);
        /** Compare-and-set attempts before giving up on a contended durable write. */
        private int maxCasAttempts = 3;
    }

    @Data
    public static class Index {
        /** "memory" or "pgvector". */
        private String backend = "memory";
    }

    @Data
    public static class Ingest {
        /** Directory ingested once at startup; disabled when blank. */
        private String documentsDir;
    }
}
