package com.example.RagChat.index;

import com.example.RagChat.exception.RetrievalDegradedException;
import com.example.RagChat.model.Chunk;
import com.example.RagChat.model.RetrievedResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local index with brute-force cosine search.
 *
 * Entries are immutable and swapped atomically per chunk id, so a concurrent search sees
 * either the old or the new version of a chunk and unrelated chunks are never locked.
 */
public class InMemoryVectorIndex implements VectorIndex {

    private static final Logger log = LoggerFactory.getLogger(InMemoryVectorIndex.class);

    private static final Comparator<Scored> RANKING = Comparator
            .comparingDouble(Scored::score).reversed()
            .thenComparingLong(Scored::sequence);

    private final EmbeddingModel embeddingModel;
    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    public InMemoryVectorIndex(EmbeddingModel embeddingModel) {
        this.embeddingModel = embeddingModel;
    }

    @Override
    public void upsert(List<Chunk> chunks) {
        for (Chunk chunk : chunks) {
            // embed outside of the map update, the provider call is the slow part
            float[] vector = embeddingModel.embed(chunk.text());
            entries.compute(chunk.id(), (id, previous) -> new Entry(
                    chunk,
                    vector,
                    previous != null ? previous.sequence() : sequence.getAndIncrement()
            ));
        }
        log.debug("Upserted {} chunk(s), index size={}", chunks.size(), entries.size());
    }

    @Override
    public List<RetrievedResult> search(String queryText, int k) {
        if (k <= 0) {
            throw new IllegalArgumentException("k must be positive: " + k);
        }
        if (entries.isEmpty()) {
            return List.of();
        }

        float[] query;
        try {
            query = embeddingModel.embed(queryText);
        } catch (RuntimeException e) {
            throw new RetrievalDegradedException("Embedding provider failed for query", e);
        }

        List<Scored> scored = new ArrayList<>(entries.size());
        for (Entry entry : entries.values()) {
            scored.add(new Scored(entry.chunk(), VectorMath.cosine(query, entry.vector()), entry.sequence()));
        }
        return scored.stream()
                .sorted(RANKING)
                .limit(k)
                .map(s -> new RetrievedResult(s.chunk(), s.score()))
                .toList();
    }

    @Override
    public int removeDocument(String documentId) {
        int before = entries.size();
        entries.values().removeIf(e -> e.chunk().documentId().equals(documentId));
        return before - entries.size();
    }

    @Override
    public void clear() {
        entries.clear();
        log.info("In-memory vector index cleared");
    }

    @Override
    public int size() {
        return entries.size();
    }

    private record Entry(Chunk chunk, float[] vector, long sequence) {
    }

    private record Scored(Chunk chunk, double score, long sequence) {
    }
}
