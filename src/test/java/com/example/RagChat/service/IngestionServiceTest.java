package com.example.RagChat.service;

import com.example.RagChat.config.RagChatProperties;
import com.example.RagChat.index.Chunker;
import com.example.RagChat.index.InMemoryVectorIndex;
import com.example.RagChat.loader.PlainTextDocumentLoader;
import com.example.RagChat.model.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.ai.embedding.EmbeddingModel;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IngestionServiceTest {

    @Mock
    private EmbeddingModel embeddingModel;

    private InMemoryVectorIndex index;
    private IngestionService service;

    @BeforeEach
    void setUp() {
        RagChatProperties properties = new RagChatProperties();
        properties.getChunk().setSize(100);
        properties.getChunk().setOverlap(20);
        index = new InMemoryVectorIndex(embeddingModel);
        service = new IngestionService(new Chunker(), index, new PlainTextDocumentLoader(), properties);
    }

    @Test
    void reingestingADocumentDoesNotDuplicateChunks() {
        when(embeddingModel.embed(anyString())).thenReturn(new float[]{1f, 0f});
        Document document = new Document("faq", "faq.txt", "x".repeat(250), ".txt");

        assertEquals(3, service.ingest(document));
        assertEquals(3, service.ingest(document));
        assertEquals(3, service.indexSize());
    }

    @Test
    void ingestsDirectoryAndRebuilds(@TempDir Path dir) throws Exception {
        when(embeddingModel.embed(anyString())).thenReturn(new float[]{0f, 1f});
        Files.writeString(dir.resolve("a.txt"), "short note");
        Files.writeString(dir.resolve("b.md"), "y".repeat(150));

        assertEquals(3, service.ingestDirectory(dir));
        assertEquals(3, service.indexSize());

        assertEquals(0, service.rebuild(null));
        assertEquals(0, service.indexSize());

        assertEquals(3, service.rebuild(dir));
    }

    @Test
    void removesSingleDocument() {
        when(embeddingModel.embed(anyString())).thenReturn(new float[]{1f, 1f});
        service.ingest(new Document("a", "a.txt", "alpha", ".txt"));
        service.ingest(new Document("b", "b.txt", "beta", ".txt"));

        assertEquals(1, service.removeDocument("a"));
        assertEquals(1, service.indexSize());
    }

    @Test
    void rejectsDocumentWithoutId() {
        assertThrows(IllegalArgumentException.class,
                () -> service.ingest(new Document(" ", "x.txt", "text", ".txt")));
    }
}
