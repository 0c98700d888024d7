package com.example.RagChat.controller;

import com.example.RagChat.config.RagChatProperties;
import com.example.RagChat.model.IngestDocumentRequest;
import com.example.RagChat.model.IngestResult;
import com.example.RagChat.service.IngestionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;

@RestController
@RequestMapping("/api/documents")
@RequiredArgsConstructor
public class DocumentController {

    private final IngestionService ingestionService;
    private final RagChatProperties properties;

    @PostMapping
    public IngestResult ingest(@Valid @RequestBody IngestDocumentRequest request) {
        int chunks = ingestionService.ingest(request.toDocument());
        return new IngestResult(chunks, ingestionService.indexSize());
    }

    /**
     * Ingests a server-side directory; without {@code path} the configured documents directory is used.
     */
    @PostMapping("/directory")
    public IngestResult ingestDirectory(@RequestParam(value = "path", required = false) String path) {
        int chunks = ingestionService.ingestDirectory(resolveDirectory(path));
        return new IngestResult(chunks, ingestionService.indexSize());
    }

    @DeleteMapping("/{documentId}")
    public IngestResult remove(@PathVariable String documentId) {
        int removed = ingestionService.removeDocument(documentId);
        return new IngestResult(removed, ingestionService.indexSize());
    }

    /**
     * Clears the index. With {@code reload=true} the configured documents directory is ingested again.
     */
    @DeleteMapping
    public IngestResult rebuild(@RequestParam(value = "reload", defaultValue = "false") boolean reload) {
        int chunks = ingestionService.rebuild(reload ? resolveDirectory(null) : null);
        return new IngestResult(chunks, ingestionService.indexSize());
    }

    private Path resolveDirectory(String path) {
        String dir = path != null && !path.isBlank() ? path : properties.getIngest().getDocumentsDir();
        if (dir == null || dir.isBlank()) {
            throw new IllegalArgumentException("No directory given and ragchat.ingest.documents-dir is not set");
        }
        return Path.of(dir);
    }
}
