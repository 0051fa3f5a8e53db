package dev.hiringvault.document;

import dev.hiringvault.model.SourceDocument;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Reads candidate documents from a directory.
 * Files are returned sorted by name so the submission order is stable between runs.
 */
@Slf4j
@Component
public class DocumentLoader {

    static final List<String> SUPPORTED_EXTENSIONS = List.of(".pdf", ".doc", ".docx", ".txt");

    public static boolean isSupported(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        return SUPPORTED_EXTENSIONS.stream().anyMatch(lower::endsWith);
    }

    public SourceDocument load(Path file) {
        try {
            return new SourceDocument(file.getFileName().toString(), Files.readAllBytes(file));
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read " + file.getFileName(), e);
        }
    }

    /**
     * Load every supported document in a directory (not recursive).
     */
    public List<SourceDocument> loadDirectory(Path directory) {
        if (!Files.isDirectory(directory)) {
            throw new IllegalArgumentException("Not a directory: " + directory);
        }

        List<Path> files;
        try (Stream<Path> entries = Files.list(directory)) {
            files = entries.filter(Files::isRegularFile)
                    .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to list " + directory, e);
        }

        List<SourceDocument> documents = new ArrayList<>();
        int rejected = 0;
        for (Path file : files) {
            String name = file.getFileName().toString();
            if (!isSupported(name)) {
                rejected++;
                log.warn("Skipping {}: unsupported format", name);
                continue;
            }
            documents.add(load(file));
        }

        log.info("Queued {} documents from {} ({} rejected)", documents.size(), directory, rejected);
        return documents;
    }
}
