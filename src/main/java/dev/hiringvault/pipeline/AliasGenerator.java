package dev.hiringvault.pipeline;

/**
 * Pseudonyms shown before a reveal: "Candidate A", "Candidate B", ..., "Candidate AA".
 * Derived from the submission position only, never from the document content or the token.
 */
public final class AliasGenerator {

    private static final String PREFIX = "Candidate ";

    private AliasGenerator() {
    }

    public static String aliasFor(int submissionIndex) {
        if (submissionIndex < 0) {
            throw new IllegalArgumentException("submissionIndex must be >= 0");
        }
        StringBuilder letters = new StringBuilder();
        int n = submissionIndex + 1;
        while (n > 0) {
            int rem = (n - 1) % 26;
            letters.insert(0, (char) ('A' + rem));
            n = (n - 1) / 26;
        }
        return PREFIX + letters;
    }
}
