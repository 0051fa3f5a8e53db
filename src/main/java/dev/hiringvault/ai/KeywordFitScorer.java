package dev.hiringvault.ai;

import dev.hiringvault.exception.ScoringFailedException;
import dev.hiringvault.model.FitScore;
import dev.hiringvault.model.JobProfile;
import dev.hiringvault.model.ProfessionalAttributes;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Offline scoring: share of the required skills found in the candidate's skills or summary.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.ai.provider", havingValue = "local", matchIfMissing = true)
public class KeywordFitScorer implements ScoringAdapter {

    @Override
    public Mono<FitScore> score(JobProfile jobProfile, ProfessionalAttributes attributes) {
        return Mono.fromCallable(() -> calculate(jobProfile, attributes));
    }

    FitScore calculate(JobProfile jobProfile, ProfessionalAttributes attributes) {
        List<String> required = jobProfile.requiredSkills();
        if (required.isEmpty()) {
            throw new ScoringFailedException("Job profile has no required skills");
        }

        List<String> matched = required.stream()
                .filter(skill -> hasSkill(attributes, skill))
                .toList();

        int score = (int) Math.round(100.0 * matched.size() / required.size());
        String rationale = matched.isEmpty()
                ? "None of the " + required.size() + " required skills found"
                : "Matches " + matched.size() + " of " + required.size() + " required skills: "
                        + String.join(", ", matched);

        log.debug("Keyword score {} ({} of {})", score, matched.size(), required.size());
        return new FitScore(score, rationale);
    }

    private boolean hasSkill(ProfessionalAttributes attributes, String skill) {
        boolean listed = attributes.skills().stream().anyMatch(s -> s.equalsIgnoreCase(skill));
        return listed || KeywordMatcher.containsTerm(attributes.summary(), skill);
    }
}
