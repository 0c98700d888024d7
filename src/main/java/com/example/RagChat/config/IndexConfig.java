package com.example.RagChat.config;

import com.example.RagChat.index.Chunker;
import com.example.RagChat.index.InMemoryVectorIndex;
import com.example.RagChat.index.PgVectorIndex;
import com.example.RagChat.index.VectorIndex;
import com.example.RagChat.repository.ChunkVectorRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

@Configuration
public class IndexConfig {

    @Bean
    public Chunker chunker() {
        return new Chunker();
    }

    @Bean
    @ConditionalOnProperty(prefix = "ragchat.index", name = "backend", havingValue = "memory", matchIfMissing = true)
    public VectorIndex inMemoryVectorIndex(EmbeddingModel embeddingModel) {
        return new InMemoryVectorIndex(embeddingModel);
    }

    @Configuration
    @ConditionalOnProperty(prefix = "ragchat.index", name = "backend", havingValue = "pgvector")
    static class PgVectorConfig {

        @Bean
        ChunkVectorRepository chunkVectorRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
            return new ChunkVectorRepository(jdbcTemplate, objectMapper);
        }

        @Bean(initMethod = "initSchema")
        VectorIndex pgVectorIndex(EmbeddingModel embeddingModel, ChunkVectorRepository repository) {
            return new PgVectorIndex(embeddingModel, repository);
        }
    }
}
