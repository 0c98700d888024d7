package com.example.RagChat.guardrail;

/**
 * What the engine does when a rule's detector throws.
 */
public enum FailureMode {
    /** Skip the rule and log; the text passes unchecked by it. */
    FAIL_OPEN,
    /** Treat the failure as a high-severity violation and block the turn. */
    FAIL_CLOSED
}
