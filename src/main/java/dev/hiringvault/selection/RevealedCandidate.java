package dev.hiringvault.selection;

import dev.hiringvault.model.PiiRecord;
import dev.hiringvault.model.ProfessionalProfile;
import dev.hiringvault.model.Token;

import java.util.Objects;

/**
 * Candidate whose identity was explicitly revealed by the reviewer.
 * Only {@link SelectionRegistry#reveal(Token)} creates instances.
 */
public final class RevealedCandidate implements Candidate {

    private final Token token;
    private final String alias;
    private final ProfessionalProfile profile;
    private final int submissionIndex;
    private final PiiRecord pii;

    RevealedCandidate(Token token, String alias, ProfessionalProfile profile, int submissionIndex, PiiRecord pii) {
        this.token = Objects.requireNonNull(token, "token");
        this.alias = Objects.requireNonNull(alias, "alias");
        this.profile = Objects.requireNonNull(profile, "profile");
        this.submissionIndex = submissionIndex;
        this.pii = Objects.requireNonNull(pii, "pii");
    }

    @Override
    public Token token() {
        return token;
    }

    @Override
    public String alias() {
        return alias;
    }

    @Override
    public ProfessionalProfile profile() {
        return profile;
    }

    @Override
    public int submissionIndex() {
        return submissionIndex;
    }

    public PiiRecord pii() {
        return pii;
    }

    @Override
    public boolean revealed() {
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RevealedCandidate other)) {
            return false;
        }
        return submissionIndex == other.submissionIndex
                && token.equals(other.token)
                && alias.equals(other.alias)
                && profile.equals(other.profile)
                && pii.equals(other.pii);
    }

    @Override
    public int hashCode() {
        return Objects.hash(token, alias, profile, submissionIndex, pii);
    }

    @Override
    public String toString() {
        return "RevealedCandidate[" + alias + ", score " + profile.score() + "]";
    }
}
