package com.example.RagChat.model;

/**
 * A source document handed over by a loader, before chunking.
 *
 * @param id         stable document identifier, used as prefix of chunk ids
 * @param sourcePath where the text came from (file path, URL, ...)
 * @param rawText    full extracted text
 * @param fileType   file extension such as ".txt" or ".md"
 */
public record Document(
        String id,
        String sourcePath,
        String rawText,
        String fileType
) {
}
