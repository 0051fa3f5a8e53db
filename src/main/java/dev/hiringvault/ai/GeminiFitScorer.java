package dev.hiringvault.ai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.hiringvault.exception.ScoringFailedException;
import dev.hiringvault.exception.ScreeningException;
import dev.hiringvault.model.FitScore;
import dev.hiringvault.model.JobProfile;
import dev.hiringvault.model.ProfessionalAttributes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Scoring through Gemini acting as a recruiter. Only the PII-free attributes are sent.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.ai.provider", havingValue = "gemini")
public class GeminiFitScorer implements ScoringAdapter {

    private final GeminiClient geminiClient;
    private final ObjectMapper objectMapper;

    @Override
    public Mono<FitScore> score(JobProfile jobProfile, ProfessionalAttributes attributes) {
        return Mono.fromCallable(() -> buildPrompt(jobProfile, attributes))
                .flatMap(prompt -> geminiClient.generateJson(prompt, FitAnalysis.class))
                .map(this::toFitScore)
                .onErrorMap(e -> !(e instanceof ScreeningException),
                        e -> new ScoringFailedException("Fit comparison failed: " + GeminiClient.describe(e), e));
    }

    FitScore toFitScore(FitAnalysis analysis) {
        if (analysis.score() == null) {
            throw new ScoringFailedException("Fit comparison returned no score");
        }
        return new FitScore(analysis.score(), analysis.justification());
    }

    private String buildPrompt(JobProfile jobProfile, ProfessionalAttributes attributes) throws JsonProcessingException {
        return String.format("""
                Act as an expert recruiter. Compare the following Job Description against the Candidate's Resume Summary.

                Job Description:
                %s

                Candidate Summary & Skills:
                %s

                Return a JSON object with:
                {
                    "score": 0-100 integer,
                    "justification": "One sentence explaining the score"
                }
                Return ONLY valid JSON.
                """,
                objectMapper.writeValueAsString(jobProfile),
                objectMapper.writeValueAsString(attributes));
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record FitAnalysis(Integer score, String justification) {
    }
}
