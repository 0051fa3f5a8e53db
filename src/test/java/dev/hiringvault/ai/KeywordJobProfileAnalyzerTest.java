package dev.hiringvault.ai;

import dev.hiringvault.config.LocalAnalysisProperties;
import dev.hiringvault.model.JobProfile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class KeywordJobProfileAnalyzerTest {

    private KeywordJobProfileAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        LocalAnalysisProperties properties = new LocalAnalysisProperties();
        properties.setSkillVocabulary(List.of("Java", "Go", "SQL"));
        analyzer = new KeywordJobProfileAnalyzer(properties);
    }

    @Test
    @DisplayName("Should extract title, skills, experience and qualifications")
    void shouldParseJobDescription() {
        String text = """
                Senior Backend Engineer

                We build payments in Go on top of PostgreSQL and plain SQL.
                5+ years of experience with distributed systems.
                Bachelor's degree in Computer Science or equivalent.
                """;

        JobProfile profile = analyzer.parse(text);

        assertThat(profile.title()).isEqualTo("Senior Backend Engineer");
        assertThat(profile.requiredSkills()).containsExactly("Go", "SQL");
        assertThat(profile.experience()).isEqualTo("5+ years of experience with distributed systems.");
        assertThat(profile.qualifications()).isEqualTo("Bachelor's degree in Computer Science or equivalent.");
    }

    @Test
    @DisplayName("Should fall back to a placeholder title")
    void shouldHandleBlankText() {
        StepVerifier.create(analyzer.analyze("   \n"))
                .assertNext(profile -> {
                    assertThat(profile.title()).isEqualTo("Untitled position");
                    assertThat(profile.requiredSkills()).isEmpty();
                    assertThat(profile.experience()).isEmpty();
                })
                .verifyComplete();
    }
}
