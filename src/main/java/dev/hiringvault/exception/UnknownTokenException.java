package dev.hiringvault.exception;

/**
 * The vault was asked for a token it never issued, or one that was already purged.
 */
public class UnknownTokenException extends ScreeningException {

    public UnknownTokenException() {
        super("Vault access denied: unknown or purged token");
    }
}
