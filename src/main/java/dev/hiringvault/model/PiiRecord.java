package dev.hiringvault.model;

/**
 * Personally identifying data extracted from one candidate document.
 * Held by the vault only; {@link #toString()} is redacted so it never ends up in logs.
 */
public record PiiRecord(
        String realName,
        String email,
        String phone,
        String documentId) {

    /**
     * Human readable identity used when a revealed candidate is exported.
     */
    public String displayIdentity() {
        String name = realName != null && !realName.isBlank() ? realName.trim() : "Unknown name";
        if (email == null || email.isBlank()) {
            return name;
        }
        return name + " (" + email.trim() + ")";
    }

    @Override
    public String toString() {
        return "PiiRecord[redacted]";
    }
}
