package com.example.RagChat.repository;

import com.example.RagChat.model.Chunk;
import com.example.RagChat.model.RetrievedResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pgvector.PGvector;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;

/**
 * JDBC access to the {@code rag_chunks} table (PostgreSQL + pgvector).
 * Similarity uses the cosine distance operator {@code <=>}: score = 1 - distance.
 */
@RequiredArgsConstructor
public class ChunkVectorRepository {

    private static final Logger log = LoggerFactory.getLogger(ChunkVectorRepository.class);

    private static final TypeReference<Map<String, String>> METADATA_TYPE = new TypeReference<>() {
    };

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public void createSchema(int dimensions) {
        jdbcTemplate.execute("CREATE EXTENSION IF NOT EXISTS vector");
        jdbcTemplate.execute("""
                CREATE TABLE IF NOT EXISTS rag_chunks (
                    id           TEXT PRIMARY KEY,
                    document_id  TEXT NOT NULL,
                    content      TEXT NOT NULL,
                    chunk_offset INT NOT NULL,
                    chunk_length INT NOT NULL,
                    metadata     JSONB,
                    seq          BIGSERIAL,
                    embedding    vector(%d)
                )
                """.formatted(dimensions));
    }

    /**
     * Insert or replace by id. {@code seq} is only assigned on first insert,
     * so a replaced chunk keeps its ingestion position.
     */
    public void upsert(Chunk chunk, float[] embedding) {
        jdbcTemplate.update("""
                        INSERT INTO rag_chunks (id, document_id, content, chunk_offset, chunk_length, metadata, embedding)
                        VALUES (?, ?, ?, ?, ?, ?::jsonb, ?)
                        ON CONFLICT (id) DO UPDATE SET
                            document_id  = EXCLUDED.document_id,
                            content      = EXCLUDED.content,
                            chunk_offset = EXCLUDED.chunk_offset,
                            chunk_length = EXCLUDED.chunk_length,
                            metadata     = EXCLUDED.metadata,
                            embedding    = EXCLUDED.embedding
                        """,
                chunk.id(),
                chunk.documentId(),
                chunk.text(),
                chunk.offset(),
                chunk.length(),
                writeMetadata(chunk.metadata()),
                new PGvector(embedding));
    }

    public List<RetrievedResult> findNearest(float[] embedding, int limit) {
        PGvector queryVector = new PGvector(embedding);

        String sql = """
                SELECT id,
                       document_id,
                       content,
                       chunk_offset,
                       chunk_length,
                       metadata,
                       1 - (embedding <=> ?) AS score
                FROM rag_chunks
                ORDER BY embedding <=> ?, seq
                LIMIT ?
                """;

        return jdbcTemplate.query(sql, ps -> {
            ps.setObject(1, queryVector);
            ps.setObject(2, queryVector);
            ps.setInt(3, limit);
        }, new RetrievedResultRowMapper());
    }

    public int deleteByDocumentId(String documentId) {
        return jdbcTemplate.update("DELETE FROM rag_chunks WHERE document_id = ?", documentId);
    }

    public void deleteAll() {
        jdbcTemplate.update("DELETE FROM rag_chunks");
    }

    public int count() {
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM rag_chunks", Integer.class);
        return count == null ? 0 : count;
    }

    private String writeMetadata(Map<String, String> metadata) {
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Chunk metadata is not serializable", e);
        }
    }

    private class RetrievedResultRowMapper implements RowMapper<RetrievedResult> {
        @Override
        public RetrievedResult mapRow(ResultSet rs, int rowNum) throws SQLException {
            Map<String, String> metadata = Map.of();
            String metadataJson = rs.getString("metadata");
            if (metadataJson != null) {
                try {
                    metadata = objectMapper.readValue(metadataJson, METADATA_TYPE);
                } catch (JsonProcessingException e) {
                    // unreadable metadata only loses the citation filename
                    log.warn("Ignoring malformed metadata of chunk {}", rs.getString("id"));
                }
            }
            Chunk chunk = new Chunk(
                    rs.getString("id"),
                    rs.getString("document_id"),
                    rs.getString("content"),
                    rs.getInt("chunk_offset"),
                    rs.getInt("chunk_length"),
                    metadata
            );
            return new RetrievedResult(chunk, rs.getDouble("score"));
        }
    }
}
