package dev.hiringvault.model;

import java.util.Objects;

/**
 * Output of an extraction adapter: identity and professional data kept apart.
 */
public record CandidateExtraction(PiiRecord pii, ProfessionalAttributes attributes) {

    public CandidateExtraction {
        Objects.requireNonNull(pii, "pii");
        Objects.requireNonNull(attributes, "attributes");
    }
}
