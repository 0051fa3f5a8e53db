package dev.hiringvault.model;

/**
 * A document that was excluded from the batch, with a reason safe to show and log.
 */
public record DocumentFailure(String documentId, FailureStage stage, String reason) {
}
