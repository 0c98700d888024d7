package com.example.RagChat.service;

import com.example.RagChat.config.RagChatProperties;
import com.example.RagChat.index.Chunker;
import com.example.RagChat.index.VectorIndex;
import com.example.RagChat.loader.DocumentLoader;
import com.example.RagChat.model.Chunk;
import com.example.RagChat.model.Document;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;

/**
 * Document ingestion: load, chunk, embed and upsert into the vector index.
 * Chunk ids are deterministic, so re-ingesting a document replaces its chunks in place.
 */
@Service
@RequiredArgsConstructor
public class IngestionService {

    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    private final Chunker chunker;
    private final VectorIndex vectorIndex;
    private final DocumentLoader documentLoader;
    private final RagChatProperties properties;

    /**
     * @return number of chunks stored for the document
     */
    public int ingest(Document document) {
        if (document.id() == null || document.id().isBlank()) {
            throw new IllegalArgumentException("Document id must not be blank");
        }
        RagChatProperties.Chunk cfg = properties.getChunk();
        List<Chunk> chunks = chunker.split(document, cfg.getSize(), cfg.getOverlap());
        vectorIndex.upsert(chunks);
        log.debug("Ingested document {} as {} chunk(s)", document.id(), chunks.size());
        return chunks.size();
    }

    public int ingestAll(List<Document> documents) {
        int total = 0;
        for (Document document : documents) {
            total += ingest(document);
        }
        log.info("Ingested {} document(s), {} chunk(s); index size {}", documents.size(), total, vectorIndex.size());
        return total;
    }

    public int removeDocument(String documentId) {
        int removed = vectorIndex.removeDocument(documentId);
        log.info("Removed {} chunk(s) of document {}", removed, documentId);
        return removed;
    }

    public int ingestDirectory(Path directory) {
        return ingestAll(documentLoader.loadDirectory(directory));
    }

    /**
     * Drops the whole index, optionally reloading a directory afterwards.
     */
    public int rebuild(Path directory) {
        vectorIndex.clear();
        log.info("Vector index cleared");
        return directory == null ? 0 : ingestDirectory(directory);
    }

    public int indexSize() {
        return vectorIndex.size();
    }
}
