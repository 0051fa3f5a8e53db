package dev.hiringvault.model;

import java.time.Instant;

/**
 * Audit trail entry for an explicit reveal.
 */
public record RevealAudit(String alias, Instant revealedAt) {
}
