package dev.hiringvault.ai;

import dev.hiringvault.config.LocalAnalysisProperties;
import dev.hiringvault.document.DocumentTextExtractor;
import dev.hiringvault.exception.ExtractionFailedException;
import dev.hiringvault.model.CandidateExtraction;
import dev.hiringvault.model.SourceDocument;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KeywordCandidateExtractorTest {

    private static final String CV = """
            Jane Doe
            jane.doe@example.com | +44 20 7946 0958
            Backend engineer at Acme 2018-2024. Built payment services in Go and SQL.
            Jane mentored four junior developers.
            """;

    private LocalAnalysisProperties properties;
    private KeywordCandidateExtractor extractor;

    @BeforeEach
    void setUp() {
        properties = new LocalAnalysisProperties();
        properties.setSkillVocabulary(List.of("Java", "Go", "SQL", "Kotlin"));
        properties.setSummaryLength(400);
        extractor = new KeywordCandidateExtractor(new DocumentTextExtractor(), properties);
    }

    @Test
    @DisplayName("Should split identity from professional attributes")
    void shouldSplitIdentity() {
        CandidateExtraction extraction = extractor.extractText("jane.txt", CV);

        assertThat(extraction.pii().realName()).isEqualTo("Jane Doe");
        assertThat(extraction.pii().email()).isEqualTo("jane.doe@example.com");
        assertThat(extraction.pii().phone()).isEqualTo("+44 20 7946 0958");
        assertThat(extraction.pii().documentId()).isEqualTo("jane.txt");
        assertThat(extraction.attributes().skills()).containsExactly("Go", "SQL");
    }

    @Test
    @DisplayName("Should keep identity out of the summary")
    void shouldScrubSummary() {
        String summary = extractor.extractText("jane.txt", CV).attributes().summary();

        assertThat(summary)
                .doesNotContain("Jane")
                .doesNotContain("Doe")
                .doesNotContain("@")
                .doesNotContain("7946")
                .contains("2018-2024")
                .contains("payment services");
    }

    @Test
    @DisplayName("Should fail when no name line is found")
    void shouldFailWithoutName() {
        assertThatThrownBy(() -> extractor.extractText("anon.txt", "12345\njohn@example.com"))
                .isInstanceOf(ExtractionFailedException.class)
                .hasMessage("No candidate name found");
    }

    @Test
    @DisplayName("Should truncate long summaries")
    void shouldTruncateSummary() {
        properties.setSummaryLength(20);

        String summary = extractor.extractText("jane.txt", CV).attributes().summary();

        assertThat(summary).endsWith("...");
        assertThat(summary.length()).isLessThanOrEqualTo(23);
    }

    @Test
    @DisplayName("Should read plain text documents end to end")
    void shouldExtractFromDocument() {
        StepVerifier.create(extractor.extract(SourceDocument.ofText("jane.txt", CV)))
                .assertNext(extraction -> {
                    assertThat(extraction.pii().realName()).isEqualTo("Jane Doe");
                    assertThat(extraction.attributes().skills()).contains("Go", "SQL");
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("Should report empty documents as extraction failures")
    void shouldFailOnEmptyDocument() {
        StepVerifier.create(extractor.extract(new SourceDocument("empty.pdf", new byte[0])))
                .expectError(ExtractionFailedException.class)
                .verify();
    }
}
