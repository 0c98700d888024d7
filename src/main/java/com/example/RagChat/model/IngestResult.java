package com.example.RagChat.model;

public record IngestResult(
        int chunks,
        int indexSize
) {
}
