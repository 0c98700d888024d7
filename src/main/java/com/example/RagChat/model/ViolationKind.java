package com.example.RagChat.model;

public enum ViolationKind {
    LENGTH("message is too long"),
    EMPTY("message is empty"),
    BLOCKED_PATTERN("message contains blocked content"),
    PII("message contains personal information"),
    TOXICITY("message contains potentially harmful content"),
    DETECTOR_FAILURE("a safety check could not be completed");

    private final String description;

    ViolationKind(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
