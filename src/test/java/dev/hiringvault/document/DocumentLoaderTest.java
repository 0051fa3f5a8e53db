package dev.hiringvault.document;

import dev.hiringvault.model.SourceDocument;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DocumentLoaderTest {

    private final DocumentLoader loader = new DocumentLoader();

    @TempDir
    Path tempDir;

    @ParameterizedTest
    @CsvSource({
            "cv.pdf, true",
            "CV.DOCX, true",
            "resume.doc, true",
            "notes.txt, true",
            "photo.png, false",
            "archive.pdf.zip, false"
    })
    @DisplayName("Should accept PDF, Word and text files only")
    void shouldDetectSupportedFormats(String name, boolean supported) {
        assertThat(DocumentLoader.isSupported(name)).isEqualTo(supported);
    }

    @Test
    @DisplayName("Should load supported files sorted by name")
    void shouldLoadDirectory() throws IOException {
        Files.writeString(tempDir.resolve("b.txt"), "Bob");
        Files.writeString(tempDir.resolve("a.txt"), "Ann");
        Files.writeString(tempDir.resolve("c.png"), "image");
        Files.createDirectory(tempDir.resolve("nested.pdf"));

        List<SourceDocument> documents = loader.loadDirectory(tempDir);

        assertThat(documents).extracting(SourceDocument::id).containsExactly("a.txt", "b.txt");
        assertThat(new String(documents.get(0).content(), StandardCharsets.UTF_8)).isEqualTo("Ann");
    }

    @Test
    @DisplayName("Should reject a path that is not a directory")
    void shouldRejectFile() throws IOException {
        Path file = Files.writeString(tempDir.resolve("a.txt"), "Ann");

        assertThatThrownBy(() -> loader.loadDirectory(file))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should fail on a missing file")
    void shouldFailOnMissingFile() {
        assertThatThrownBy(() -> loader.load(tempDir.resolve("missing.txt")))
                .isInstanceOf(UncheckedIOException.class);
    }
}
