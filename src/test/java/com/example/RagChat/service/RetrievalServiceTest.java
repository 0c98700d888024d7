package com.example.RagChat.service;

import com.example.RagChat.config.RagChatProperties;
import com.example.RagChat.exception.RetrievalDegradedException;
import com.example.RagChat.index.VectorIndex;
import com.example.RagChat.model.Chunk;
import com.example.RagChat.model.RagQueryRequest;
import com.example.RagChat.model.RagRetrievalResult;
import com.example.RagChat.model.RetrievedResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RetrievalServiceTest {

    @Mock
    private VectorIndex vectorIndex;

    private RetrievalService service;

    @BeforeEach
    void setUp() {
        service = new RetrievalService(vectorIndex, new RagChatProperties());
    }

    private static RetrievedResult result(String id, double score) {
        Chunk chunk = new Chunk(id, "doc", "text of " + id, 0, 10, Map.of("filename", "doc.md"));
        return new RetrievedResult(chunk, score);
    }

    @Test
    void usesConfiguredTopKByDefault() {
        when(vectorIndex.search("q", 5)).thenReturn(List.of());

        RagRetrievalResult result = service.retrieve(new RagQueryRequest("q", null, null));

        assertTrue(result.results().isEmpty());
        assertEquals("(no results)", result.context());
        verify(vectorIndex).search("q", 5);
    }

    @Test
    void keepsResultsCloseToTheTopScore() {
        when(vectorIndex.search("q", 3)).thenReturn(List.of(
                result("doc#0", 0.82), result("doc#1", 0.75), result("doc#2", 0.61)));

        RagRetrievalResult result = service.retrieve(new RagQueryRequest("q", 3, null));

        assertEquals(List.of("doc#0", "doc#1"), result.results().stream().map(r -> r.chunk().id()).toList());
        assertTrue(result.context().startsWith("[source=doc.md, chunk=doc#0, score=0.820]\ntext of doc#0"));
    }

    @Test
    void keepsBestResultWhenAllScoresAreLow() {
        when(vectorIndex.search("q", 5)).thenReturn(List.of(result("doc#0", 0.20), result("doc#1", 0.05)));

        RagRetrievalResult result = service.retrieve(new RagQueryRequest("q", null, null));

        assertEquals(List.of("doc#0"), result.results().stream().map(r -> r.chunk().id()).toList());
    }

    @Test
    void dynamicMinScoreRelaxesBelowRequested() {
        assertEquals(0.72, RetrievalService.computeDynamicMinScore(0.60, 0.82), 1e-9);
        assertEquals(0.40, RetrievalService.computeDynamicMinScore(0.60, 0.50), 1e-9);
        assertEquals(0.25, RetrievalService.computeDynamicMinScore(0.60, 0.30), 1e-9);
        assertEquals(0.20, RetrievalService.computeDynamicMinScore(0.60, 0.20), 1e-9);
    }

    @Test
    void storageFailuresBecomeRetrievalDegradation() {
        when(vectorIndex.search("q", 5)).thenThrow(new DataAccessResourceFailureException("db down"));

        assertThrows(RetrievalDegradedException.class, () -> service.retrieve(new RagQueryRequest("q", null, null)));
    }
}
