package dev.hiringvault.selection;

import dev.hiringvault.model.PiiRecord;
import dev.hiringvault.model.ProfessionalProfile;
import dev.hiringvault.model.Token;

import java.util.Objects;

/**
 * Candidate as produced by the pipeline. Carries the vault token but no PII.
 */
public record AnonymousCandidate(
        Token token,
        String alias,
        ProfessionalProfile profile,
        int submissionIndex) implements Candidate {

    public AnonymousCandidate {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(alias, "alias");
        Objects.requireNonNull(profile, "profile");
    }

    @Override
    public boolean revealed() {
        return false;
    }

    /**
     * One-way transition to the revealed variant. Reserved to the registry's reveal.
     */
    RevealedCandidate reveal(PiiRecord pii) {
        return new RevealedCandidate(token, alias, profile, submissionIndex, pii);
    }
}
