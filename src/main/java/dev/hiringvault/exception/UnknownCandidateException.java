package dev.hiringvault.exception;

/**
 * A selection or reveal referenced a token with no candidate behind it.
 */
public class UnknownCandidateException extends ScreeningException {

    public UnknownCandidateException() {
        super("No candidate is registered for the given token");
    }
}
