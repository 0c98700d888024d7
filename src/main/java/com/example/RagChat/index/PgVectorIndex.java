package com.example.RagChat.index;

import com.example.RagChat.exception.RetrievalDegradedException;
import com.example.RagChat.model.Chunk;
import com.example.RagChat.model.RetrievedResult;
import com.example.RagChat.repository.ChunkVectorRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.dao.DataAccessException;

import java.util.List;

/**
 * Index kept in PostgreSQL; row-level upserts give per-chunk isolation between ingestion and search.
 */
public class PgVectorIndex implements VectorIndex {

    private static final Logger log = LoggerFactory.getLogger(PgVectorIndex.class);

    private final EmbeddingModel embeddingModel;
    private final ChunkVectorRepository repository;

    public PgVectorIndex(EmbeddingModel embeddingModel, ChunkVectorRepository repository) {
        this.embeddingModel = embeddingModel;
        this.repository = repository;
    }

    public void initSchema() {
        repository.createSchema(embeddingModel.dimensions());
        log.info("pgvector index ready, {} chunk(s) stored", repository.count());
    }

    @Override
    public void upsert(List<Chunk> chunks) {
        for (Chunk chunk : chunks) {
            repository.upsert(chunk, embeddingModel.embed(chunk.text()));
        }
        log.debug("Upserted {} chunk(s) into pgvector", chunks.size());
    }

    @Override
    public List<RetrievedResult> search(String queryText, int k) {
        if (k <= 0) {
            throw new IllegalArgumentException("k must be positive: " + k);
        }
        try {
            return repository.findNearest(embeddingModel.embed(queryText), k);
        } catch (DataAccessException e) {
            throw new RetrievalDegradedException("pgvector search failed", e);
        } catch (RuntimeException e) {
            throw new RetrievalDegradedException("Embedding provider failed for query", e);
        }
    }

    @Override
    public int removeDocument(String documentId) {
        return repository.deleteByDocumentId(documentId);
    }

    @Override
    public void clear() {
        repository.deleteAll();
        log.info("pgvector index cleared");
    }

    @Override
    public int size() {
        return repository.count();
    }
}
