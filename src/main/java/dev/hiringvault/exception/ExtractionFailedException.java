package dev.hiringvault.exception;

public class ExtractionFailedException extends ScreeningException {

    public ExtractionFailedException(String reason) {
        super(reason);
    }

    public ExtractionFailedException(String reason, Throwable cause) {
        super(reason, cause);
    }
}
