package com.example.RagChat.loader;

import com.example.RagChat.model.Document;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PlainTextDocumentLoaderTest {

    private final PlainTextDocumentLoader loader = new PlainTextDocumentLoader();

    @Test
    void loadsTextAndMarkdownRecursively(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve("intro.txt"), "plain text");
        Files.createDirectories(dir.resolve("guides"));
        Files.writeString(dir.resolve("guides/setup.MD"), "# Setup");
        Files.writeString(dir.resolve("report.pdf"), "binary");

        List<Document> documents = loader.loadDirectory(dir);

        assertEquals(List.of("guides/setup.MD", "intro.txt"), documents.stream().map(Document::id).toList());
        Document setup = documents.get(0);
        assertEquals("# Setup", setup.rawText());
        assertEquals(".md", setup.fileType());
        assertTrue(setup.sourcePath().endsWith("setup.MD"));
    }

    @Test
    void missingDirectoryYieldsNothing(@TempDir Path dir) {
        assertTrue(loader.loadDirectory(dir.resolve("absent")).isEmpty());
    }

    @Test
    void rejectsUnsupportedSingleFile(@TempDir Path dir) throws Exception {
        Path pdf = Files.writeString(dir.resolve("report.pdf"), "binary");

        assertThrows(IllegalArgumentException.class, () -> loader.loadFile(pdf));
    }
}
