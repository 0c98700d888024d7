package com.example.RagChat.loader;

import com.example.RagChat.model.Document;

import java.nio.file.Path;
import java.util.List;

/**
 * Supplies {@link Document}s to the chunker. Format-specific parsing lives behind this seam.
 */
public interface DocumentLoader {

    /**
     * Loads every supported file below {@code directory}, recursively.
     * A missing directory yields an empty list; unreadable files are skipped.
     */
    List<Document> loadDirectory(Path directory);

    Document loadFile(Path file);

    boolean supports(Path file);
}
