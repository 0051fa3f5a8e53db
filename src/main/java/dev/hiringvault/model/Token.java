package dev.hiringvault.model;

import java.util.Objects;

/**
 * Opaque capability issued by the vault for one stored {@link PiiRecord}.
 */
public record Token(String value) {

    public Token {
        Objects.requireNonNull(value, "token value");
    }

    @Override
    public String toString() {
        // Only a short suffix, the full value is a capability.
        return "Token[..." + value.substring(Math.max(0, value.length() - 4)) + "]";
    }
}
