package dev.hiringvault.ai;

import dev.hiringvault.config.LocalAnalysisProperties;
import dev.hiringvault.model.JobProfile;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Offline job description analysis based on the configured skill vocabulary.
 */
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.ai.provider", havingValue = "local", matchIfMissing = true)
public class KeywordJobProfileAnalyzer implements JobProfileAnalyzer {

    private static final Pattern EXPERIENCE = Pattern.compile("(?i)\\b(experience|years?)\\b");
    private static final Pattern QUALIFICATION = Pattern.compile("(?i)\\b(degree|bachelor|master|phd|qualification|certifi\\w*)\\b");

    private final LocalAnalysisProperties properties;

    @Override
    public Mono<JobProfile> analyze(String jobDescriptionText) {
        return Mono.fromCallable(() -> parse(jobDescriptionText));
    }

    JobProfile parse(String text) {
        List<String> lines = Arrays.stream(text.split("\\n"))
                .map(String::trim)
                .filter(line -> !line.isEmpty())
                .toList();

        String title = lines.isEmpty() ? "Untitled position" : lines.get(0);
        List<String> skills = new ArrayList<>(KeywordMatcher.findTerms(text, properties.getSkillVocabulary()));

        return new JobProfile(title, skills, firstMatching(lines, EXPERIENCE), firstMatching(lines, QUALIFICATION));
    }

    private String firstMatching(List<String> lines, Pattern pattern) {
        return lines.stream()
                .skip(1)
                .filter(line -> pattern.matcher(line).find())
                .findFirst()
                .orElse("");
    }
}
