package com.example.RagChat.model;

public enum Role {
    USER,
    ASSISTANT
}
