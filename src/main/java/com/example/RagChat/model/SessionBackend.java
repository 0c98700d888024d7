package com.example.RagChat.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SessionBackend {
    DURABLE,
    DEGRADED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
