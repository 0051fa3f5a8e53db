package dev.hiringvault.selection;

import dev.hiringvault.model.ProfessionalProfile;
import dev.hiringvault.model.Token;

/**
 * A screened candidate. Either {@link AnonymousCandidate}, which has no identity fields at all,
 * or {@link RevealedCandidate}, which can only be obtained through an explicit reveal.
 */
public sealed interface Candidate permits AnonymousCandidate, RevealedCandidate {

    Token token();

    String alias();

    ProfessionalProfile profile();

    /**
     * Position of the source document in the submitted batch, used as the ranking tie-break.
     */
    int submissionIndex();

    boolean revealed();

    default int score() {
        return profile().score();
    }
}
