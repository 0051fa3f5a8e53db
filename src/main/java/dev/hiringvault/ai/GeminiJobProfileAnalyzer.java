package dev.hiringvault.ai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.hiringvault.model.JobProfile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Job description analysis through Gemini.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.ai.provider", havingValue = "gemini")
public class GeminiJobProfileAnalyzer implements JobProfileAnalyzer {

    private final GeminiClient geminiClient;

    @Override
    public Mono<JobProfile> analyze(String jobDescriptionText) {
        return geminiClient.generateJson(buildPrompt(jobDescriptionText), JdAnalysis.class)
                .map(analysis -> new JobProfile(analysis.title(), analysis.skills(),
                        analysis.experience(), analysis.qualifications()))
                .doOnError(e -> log.error("Job description analysis failed: {}", GeminiClient.describe(e)));
    }

    private String buildPrompt(String text) {
        return String.format("""
                Extract information from the following Job Description and return it as a JSON object with this exact structure:
                {
                    "title": "Clear Job Title",
                    "skills": ["Skill 1", "Skill 2", ...],
                    "requirements": ["Requirement 1", "Requirement 2", ...],
                    "responsibilities": ["Responsibility 1", "Responsibility 2", ...],
                    "experience": "Brief summary of experience needed",
                    "qualifications": "Brief summary of qualifications needed"
                }
                Return ONLY the valid JSON object.

                Job Description:
                %s
                """, text);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record JdAnalysis(
            String title,
            List<String> skills,
            List<String> requirements,
            List<String> responsibilities,
            String experience,
            String qualifications) {
    }
}
