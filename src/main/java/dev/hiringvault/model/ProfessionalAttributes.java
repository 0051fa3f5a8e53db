package dev.hiringvault.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * PII-free part of an extraction: what the scorer is allowed to see.
 */
public record ProfessionalAttributes(Set<String> skills, String summary) {

    public ProfessionalAttributes {
        skills = normalizeSkills(skills);
        summary = summary != null ? summary.trim() : "";
    }

    public static ProfessionalAttributes of(Collection<String> skills, String summary) {
        return new ProfessionalAttributes(normalizeSkills(skills), summary);
    }

    static Set<String> normalizeSkills(Collection<String> skills) {
        if (skills == null) {
            return Set.of();
        }
        Set<String> ordered = new LinkedHashSet<>();
        skills.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(skill -> !skill.isEmpty())
                .forEach(ordered::add);
        return Collections.unmodifiableSet(ordered);
    }
}
