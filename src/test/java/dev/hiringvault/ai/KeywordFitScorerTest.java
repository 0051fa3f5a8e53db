package dev.hiringvault.ai;

import dev.hiringvault.exception.ScoringFailedException;
import dev.hiringvault.model.FitScore;
import dev.hiringvault.model.JobProfile;
import dev.hiringvault.model.ProfessionalAttributes;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class KeywordFitScorerTest {

    private static final JobProfile JOB = new JobProfile("Backend Engineer", List.of("Go", "SQL"), "", "");

    private final KeywordFitScorer scorer = new KeywordFitScorer();

    @Test
    @DisplayName("Should give full score when all skills are found")
    void shouldScoreFullMatch() {
        FitScore score = scorer.calculate(JOB,
                new ProfessionalAttributes(Set.of("Go"), "Writes sql every day"));

        assertThat(score.value()).isEqualTo(100);
        assertThat(score.rationale()).isEqualTo("Matches 2 of 2 required skills: Go, SQL");
    }

    @Test
    @DisplayName("Should score the share of required skills")
    void shouldScorePartialMatch() {
        FitScore score = scorer.calculate(JOB, new ProfessionalAttributes(Set.of("go"), ""));

        assertThat(score.value()).isEqualTo(50);
        assertThat(score.rationale()).isEqualTo("Matches 1 of 2 required skills: Go");
    }

    @Test
    @DisplayName("Should match whole terms only")
    void shouldNotMatchInsideWords() {
        FitScore score = scorer.calculate(JOB,
                new ProfessionalAttributes(Set.of(), "Google ads and PostgreSQLish tooling"));

        assertThat(score.value()).isZero();
        assertThat(score.rationale()).isEqualTo("None of the 2 required skills found");
    }

    @Test
    @DisplayName("Should fail when the job lists no skills")
    void shouldFailWithoutRequiredSkills() {
        JobProfile empty = new JobProfile("Generalist", List.of(), "", "");

        StepVerifier.create(scorer.score(empty, new ProfessionalAttributes(Set.of("Go"), "")))
                .expectErrorMatches(e -> e instanceof ScoringFailedException
                        && e.getMessage().equals("Job profile has no required skills"))
                .verify();
    }
}
