package dev.hiringvault.ai;

import dev.hiringvault.model.CandidateExtraction;
import dev.hiringvault.model.SourceDocument;
import reactor.core.publisher.Mono;

/**
 * Turns a raw candidate document into identity data and professional attributes.
 * Implementations must never put identity fields into the professional attributes.
 */
public interface ExtractionAdapter {

    /**
     * Extract a single document.
     *
     * @param document The uploaded document
     * @return Mono with the extraction, or an error
     *         ({@link dev.hiringvault.exception.ExtractionFailedException} for known failures)
     */
    Mono<CandidateExtraction> extract(SourceDocument document);
}
