package dev.hiringvault.exception;

public class ScoringFailedException extends ScreeningException {

    public ScoringFailedException(String reason) {
        super(reason);
    }

    public ScoringFailedException(String reason, Throwable cause) {
        super(reason, cause);
    }
}
