package com.example.RagChat.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * A document pushed over HTTP instead of being read from disk.
 */
public record IngestDocumentRequest(
        @NotBlank String id,
        @NotNull String text,
        String sourcePath,
        String fileType
) {
    public Document toDocument() {
        return new Document(
                id,
                sourcePath == null || sourcePath.isBlank() ? id : sourcePath,
                text,
                fileType == null ? "" : fileType
        );
    }
}
