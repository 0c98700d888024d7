package com.example.RagChat.guardrail;

/**
 * Outcome of a rule that matched.
 *
 * @param detail        description without the matched content
 * @param sanitizedText rewritten text, or null when the rule cannot sanitize
 */
public record RuleFinding(String detail, String sanitizedText) {

    public static RuleFinding of(String detail) {
        return new RuleFinding(detail, null);
    }

    public static RuleFinding sanitized(String detail, String sanitizedText) {
        return new RuleFinding(detail, sanitizedText);
    }
}
