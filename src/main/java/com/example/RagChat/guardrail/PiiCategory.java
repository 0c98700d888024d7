package com.example.RagChat.guardrail;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Regex families for personal data. Declaration order is evaluation order:
 * longer digit runs are claimed before shorter ones can match inside them.
 */
public enum PiiCategory {
    CREDIT_CARD("\\b\\d{4}[-\\s]?\\d{4}[-\\s]?\\d{4}[-\\s]?\\d{4}\\b"),
    SSN("\\b\\d{3}-\\d{2}-\\d{4}\\b"),
    EMAIL("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b"),
    PHONE("\\b\\d{3}[-.]?\\d{3}[-.]?\\d{4}\\b");

    private final Pattern pattern;

    PiiCategory(String regex) {
        this.pattern = Pattern.compile(regex);
    }

    public Pattern pattern() {
        return pattern;
    }

    public String ruleId() {
        return "pii." + name().toLowerCase(Locale.ROOT);
    }

    public String redactionToken() {
        return "[REDACTED_" + name() + "]";
    }
}
