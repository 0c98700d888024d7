package com.example.RagChat.model;

import java.util.Map;

/**
 * A bounded slice of a document, the unit of retrieval.
 * offset/length are character positions in the parent document's raw text.
 */
public record Chunk(
        String id,
        String documentId,
        String text,
        int offset,
        int length,
        Map<String, String> metadata
) {
    public Chunk {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public String filename() {
        return metadata.getOrDefault("filename", "");
    }
}
