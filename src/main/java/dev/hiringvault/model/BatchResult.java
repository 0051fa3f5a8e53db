package dev.hiringvault.model;

import dev.hiringvault.selection.AnonymousCandidate;

import java.util.List;

/**
 * Outcome of one pipeline run: ranked anonymous candidates plus the documents that failed.
 */
public record BatchResult(
        List<AnonymousCandidate> candidates,
        List<DocumentFailure> failures,
        int submitted) {

    public BatchResult {
        candidates = List.copyOf(candidates);
        failures = List.copyOf(failures);
    }

    public int processed() {
        return candidates.size();
    }

    public String summary() {
        return processed() + " of " + submitted + " documents processed";
    }
}
