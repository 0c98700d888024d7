package com.example.RagChat.index;

import com.example.RagChat.model.Chunk;
import com.example.RagChat.model.RetrievedResult;

import java.util.List;

/**
 * Chunk store with top-K cosine similarity search.
 * Read-mostly: many turns search concurrently, writes happen during ingestion.
 */
public interface VectorIndex {

    /**
     * Embed and store chunks. Idempotent on chunk id: a re-upsert replaces the entry
     * and keeps its original ingestion position.
     */
    void upsert(List<Chunk> chunks);

    /**
     * @return at most {@code k} results ordered by descending similarity, ties in ingestion order
     * @throws IllegalArgumentException when {@code k <= 0}
     */
    List<RetrievedResult> search(String queryText, int k);

    /** Removes every chunk of the document, returns the number removed. */
    int removeDocument(String documentId);

    /** Drops all entries (full rebuild). */
    void clear();

    int size();
}
