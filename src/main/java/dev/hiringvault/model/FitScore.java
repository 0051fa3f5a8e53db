package dev.hiringvault.model;

import dev.hiringvault.exception.ScoringFailedException;

/**
 * Score returned by a scoring adapter for one candidate.
 */
public record FitScore(int value, String rationale) {

    public static final int MIN = 0;
    public static final int MAX = 100;

    public FitScore {
        if (value < MIN || value > MAX) {
            throw new ScoringFailedException("Score " + value + " is outside " + MIN + ".." + MAX);
        }
        rationale = rationale != null ? rationale.trim() : "";
    }
}
