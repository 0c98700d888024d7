package com.example.RagChat.index;

import com.example.RagChat.model.Chunk;
import com.example.RagChat.model.Document;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sliding character window over a document's raw text.
 *
 * Window i starts at {@code i * (chunkSize - overlap)}; adjacent windows share exactly
 * {@code overlap} characters and the last window may be shorter than {@code chunkSize}.
 * Chunk ids are {@code <documentId>#<index>}, so re-chunking the same document yields the same ids.
 */
public class Chunker {

    public List<Chunk> split(Document document, int chunkSize, int overlap) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
        }
        if (overlap < 0 || overlap >= chunkSize) {
            throw new IllegalArgumentException(
                    "overlap must satisfy 0 <= overlap < chunkSize, got overlap=" + overlap + ", chunkSize=" + chunkSize);
        }

        String text = document.rawText() == null ? "" : document.rawText();
        if (text.isEmpty()) {
            return List.of();
        }

        Map<String, String> metadata = metadataOf(document);
        int step = chunkSize - overlap;
        List<Chunk> chunks = new ArrayList<>();

        for (int start = 0, index = 0; start < text.length(); start += step, index++) {
            int end = Math.min(start + chunkSize, text.length());
            chunks.add(new Chunk(
                    document.id() + "#" + index,
                    document.id(),
                    text.substring(start, end),
                    start,
                    end - start,
                    metadata
            ));
            if (end == text.length()) {
                break;
            }
        }
        return chunks;
    }

    private static Map<String, String> metadataOf(Document document) {
        Map<String, String> metadata = new LinkedHashMap<>();
        String source = document.sourcePath() == null ? "" : document.sourcePath();
        metadata.put("source", source);
        metadata.put("filename", filenameOf(source));
        if (document.fileType() != null) {
            metadata.put("file_type", document.fileType());
        }
        return metadata;
    }

    private static String filenameOf(String source) {
        if (source.isBlank()) {
            return "";
        }
        try {
            Path name = Path.of(source).getFileName();
            return name == null ? source : name.toString();
        } catch (InvalidPathException e) {
            return source;
        }
    }
}
