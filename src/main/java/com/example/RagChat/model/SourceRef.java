package com.example.RagChat.model;

/**
 * Citation returned with an answer.
 */
public record SourceRef(
        String chunkId,
        String documentId,
        String filename,
        double score
) {
    public static SourceRef of(RetrievedResult result) {
        Chunk chunk = result.chunk();
        return new SourceRef(chunk.id(), chunk.documentId(), chunk.filename(), result.score());
    }
}
