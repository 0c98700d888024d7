package com.example.RagChat.model;

public record RetrievedResult(Chunk chunk, double score) {
}
