package dev.hiringvault.ai;

import dev.hiringvault.model.FitScore;
import dev.hiringvault.model.JobProfile;
import dev.hiringvault.model.ProfessionalAttributes;
import reactor.core.publisher.Mono;

/**
 * Compares PII-free professional attributes against a job profile.
 */
public interface ScoringAdapter {

    /**
     * Score one candidate.
     *
     * @return Mono with a score in 0..100, or an error
     *         ({@link dev.hiringvault.exception.ScoringFailedException} for known failures)
     */
    Mono<FitScore> score(JobProfile jobProfile, ProfessionalAttributes attributes);
}
