package dev.hiringvault.ai;

import dev.hiringvault.model.JobProfile;
import reactor.core.publisher.Mono;

/**
 * Builds the structured {@link JobProfile} from the plain text of a job description.
 */
public interface JobProfileAnalyzer {

    Mono<JobProfile> analyze(String jobDescriptionText);
}
