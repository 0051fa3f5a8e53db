package dev.hiringvault.exception;

/**
 * Base type of all screening errors. Messages never contain candidate PII.
 */
public class ScreeningException extends RuntimeException {

    public ScreeningException(String message) {
        super(message);
    }

    public ScreeningException(String message, Throwable cause) {
        super(message, cause);
    }
}
