package dev.hiringvault.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Structured view of a single job description.
 * Immutable once analysed; required skills keep their original order without duplicates.
 */
public record JobProfile(
        String title,
        List<String> requiredSkills,
        String experience,
        String qualifications) {

    public JobProfile {
        title = title != null ? title.trim() : "";
        requiredSkills = distinct(requiredSkills);
        experience = experience != null ? experience : "";
        qualifications = qualifications != null ? qualifications : "";
    }

    private static List<String> distinct(List<String> skills) {
        if (skills == null) {
            return List.of();
        }
        Set<String> ordered = new LinkedHashSet<>();
        skills.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(skill -> !skill.isEmpty())
                .forEach(ordered::add);
        return List.copyOf(ordered);
    }
}
