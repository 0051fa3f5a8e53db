package dev.hiringvault.model;

import java.util.Set;

/**
 * Scored professional profile of a candidate. Contains no identity fields.
 */
public record ProfessionalProfile(
        Set<String> skills,
        String summary,
        int score,
        String rationale) {

    public ProfessionalProfile {
        skills = ProfessionalAttributes.normalizeSkills(skills);
        summary = summary != null ? summary : "";
        rationale = rationale != null ? rationale : "";
    }

    public static ProfessionalProfile scored(ProfessionalAttributes attributes, FitScore fit) {
        return new ProfessionalProfile(attributes.skills(), attributes.summary(), fit.value(), fit.rationale());
    }
}
