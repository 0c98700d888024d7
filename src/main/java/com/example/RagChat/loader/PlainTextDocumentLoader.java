package com.example.RagChat.loader;

import com.example.RagChat.model.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Loads plain text and Markdown files as-is. Markdown is not rendered.
 * Document ids are the file path relative to the loaded directory, with forward slashes.
 */
public class PlainTextDocumentLoader implements DocumentLoader {

    private static final Logger log = LoggerFactory.getLogger(PlainTextDocumentLoader.class);

    static final Set<String> SUPPORTED_TYPES = Set.of(".txt", ".md");

    @Override
    public List<Document> loadDirectory(Path directory) {
        if (!Files.isDirectory(directory)) {
            log.warn("Documents directory not found: {}", directory);
            return List.of();
        }

        List<Path> files;
        try (Stream<Path> walk = Files.walk(directory)) {
            files = walk.filter(Files::isRegularFile).sorted().toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list documents in " + directory, e);
        }

        List<Document> documents = new ArrayList<>();
        for (Path file : files) {
            if (!supports(file)) {
                log.debug("Skipping unsupported file {}", file);
                continue;
            }
            try {
                documents.add(read(file, directory.relativize(file)));
            } catch (UncheckedIOException e) {
                log.error("Error loading {}: {}", file.getFileName(), e.getMessage());
            }
        }
        log.info("Loaded {} document(s) from {}", documents.size(), directory);
        return documents;
    }

    @Override
    public Document loadFile(Path file) {
        if (!supports(file)) {
            throw new IllegalArgumentException("Unsupported file type: " + file);
        }
        return read(file, file.getFileName());
    }

    @Override
    public boolean supports(Path file) {
        return SUPPORTED_TYPES.contains(extensionOf(file));
    }

    private Document read(Path file, Path idPath) {
        try {
            String text = Files.readString(file, StandardCharsets.UTF_8);
            String id = idPath.toString().replace('\\', '/');
            return new Document(id, file.toString(), text, extensionOf(file));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }

    static String extensionOf(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot).toLowerCase(Locale.ROOT);
    }
}
