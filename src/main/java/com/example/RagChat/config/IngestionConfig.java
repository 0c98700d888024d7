package com.example.RagChat.config;

import com.example.RagChat.loader.DocumentLoader;
import com.example.RagChat.loader.PlainTextDocumentLoader;
import com.example.RagChat.service.IngestionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
public class IngestionConfig {

    private static final Logger log = LoggerFactory.getLogger(IngestionConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public DocumentLoader documentLoader() {
        return new PlainTextDocumentLoader();
    }

    /**
     * Loads {@code ragchat.ingest.documents-dir} into the index at startup.
     */
    @Bean
    @ConditionalOnProperty(prefix = "ragchat.ingest", name = "documents-dir")
    public ApplicationRunner startupIngestion(IngestionService ingestionService, RagChatProperties properties) {
        return args -> {
            String configured = properties.getIngest().getDocumentsDir();
            if (configured == null || configured.isBlank()) {
                return;
            }
            Path dir = Path.of(configured);
            log.info("Ingesting documents from {}", dir);
            int chunks = ingestionService.ingestDirectory(dir);
            log.info("Startup ingestion finished: {} chunk(s)", chunks);
        };
    }
}
