package dev.hiringvault.model;

/**
 * Step of the per-document chain at which processing failed.
 */
public enum FailureStage {
    EXTRACTION,
    SCORING,
    TIMEOUT,
    UNEXPECTED
}
