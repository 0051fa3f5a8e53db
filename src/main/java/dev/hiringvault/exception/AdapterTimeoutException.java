package dev.hiringvault.exception;

import java.time.Duration;

/**
 * An extraction or scoring call did not complete within the per-document timeout.
 */
public class AdapterTimeoutException extends ScreeningException {

    public AdapterTimeoutException(Duration timeout, Throwable cause) {
        super("Document processing exceeded " + timeout.toMillis() + "ms", cause);
    }
}
