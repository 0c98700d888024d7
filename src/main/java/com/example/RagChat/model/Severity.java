package com.example.RagChat.model;

public enum Severity {
    LOW,
    MEDIUM,
    HIGH
}
