package dev.hiringvault.pipeline;

import dev.hiringvault.ai.ExtractionAdapter;
import dev.hiringvault.ai.ScoringAdapter;
import dev.hiringvault.config.PipelineProperties;
import dev.hiringvault.exception.AdapterTimeoutException;
import dev.hiringvault.exception.ExtractionFailedException;
import dev.hiringvault.exception.ScoringFailedException;
import dev.hiringvault.exception.ScreeningException;
import dev.hiringvault.metrics.ScreeningMetrics;
import dev.hiringvault.model.BatchResult;
import dev.hiringvault.model.CandidateExtraction;
import dev.hiringvault.model.DocumentFailure;
import dev.hiringvault.model.FailureStage;
import dev.hiringvault.model.FitScore;
import dev.hiringvault.model.JobProfile;
import dev.hiringvault.model.SourceDocument;
import dev.hiringvault.vault.PiiVault;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Turns a batch of candidate documents into ranked anonymous candidates.
 * Documents are processed concurrently and independently; a failing document is reported
 * and left out, it never aborts the batch.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CandidatePipeline {

    private final ExtractionAdapter extractionAdapter;
    private final ScoringAdapter scoringAdapter;
    private final PipelineProperties properties;
    private final ScreeningMetrics metrics;

    /**
     * Run the pipeline over a batch.
     *
     * @param documents  Documents in submission order
     * @param jobProfile The active job profile
     * @param vault      Vault of the current session, receives one entry per candidate
     * @return Mono with the ranked candidates and the per-document failures
     */
    public Mono<BatchResult> run(List<SourceDocument> documents, JobProfile jobProfile, PiiVault vault) {
        List<SourceDocument> batch = List.copyOf(documents);
        int concurrency = Math.max(1, properties.getConcurrency());

        return Mono.defer(() -> {
            long start = System.nanoTime();
            BatchCollector collector = new BatchCollector(vault);
            metrics.recordDocumentsSubmitted(batch.size());
            log.info("Processing {} documents for '{}' (concurrency {})",
                    batch.size(), jobProfile.title(), concurrency);

            return Flux.range(0, batch.size())
                    .flatMap(index -> processDocument(index, batch.get(index), jobProfile, collector), concurrency)
                    .then(Mono.fromCallable(() -> collector.result(batch.size())))
                    .doOnNext(result -> {
                        metrics.recordBatch(result.submitted(), result.processed(),
                                Duration.ofNanos(System.nanoTime() - start));
                        log.info("Batch complete: {}", result.summary());
                    })
                    .doOnCancel(collector::cancel);
        });
    }

    private Mono<Void> processDocument(int index, SourceDocument document, JobProfile jobProfile,
            BatchCollector collector) {
        Duration timeout = properties.getDocumentTimeout();

        return Mono.defer(() -> extractionAdapter.extract(document))
                .onErrorMap(this::isForeign, e -> new ExtractionFailedException(
                        "Extraction adapter error: " + e.getClass().getSimpleName(), e))
                .switchIfEmpty(Mono.error(() -> new ExtractionFailedException("Extraction adapter returned no result")))
                .flatMap(extraction -> Mono.defer(() -> scoringAdapter.score(jobProfile, extraction.attributes()))
                        .onErrorMap(this::isForeign, e -> new ScoringFailedException(
                                "Scoring adapter error: " + e.getClass().getSimpleName(), e))
                        .switchIfEmpty(Mono.error(() -> new ScoringFailedException("Scoring adapter returned no result")))
                        .map(fit -> new Scored(extraction, fit)))
                // Adapters may block (document parsing), keep them off the batch thread
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(timeout)
                .onErrorMap(TimeoutException.class, e -> new AdapterTimeoutException(timeout, e))
                .doOnNext(scored -> collector.admit(index, scored.extraction(), scored.fit())
                        .ifPresent(candidate -> {
                            metrics.recordDocumentProcessed();
                            log.info("Processed {} -> {} (score {})",
                                    document.id(), candidate.alias(), candidate.score());
                        }))
                .onErrorResume(e -> {
                    DocumentFailure failure = toFailure(document, e);
                    collector.reject(index, failure);
                    metrics.recordDocumentFailed(failure.stage());
                    log.warn("Document {} skipped at {}: {}", document.id(), failure.stage(), failure.reason());
                    return Mono.empty();
                })
                .then();
    }

    private boolean isForeign(Throwable e) {
        return !(e instanceof ScreeningException) && !(e instanceof TimeoutException);
    }

    static DocumentFailure toFailure(SourceDocument document, Throwable e) {
        FailureStage stage;
        String reason;
        if (e instanceof AdapterTimeoutException) {
            stage = FailureStage.TIMEOUT;
            reason = e.getMessage();
        } else if (e instanceof ExtractionFailedException) {
            stage = FailureStage.EXTRACTION;
            reason = e.getMessage();
        } else if (e instanceof ScoringFailedException) {
            stage = FailureStage.SCORING;
            reason = e.getMessage();
        } else {
            // Foreign messages may echo adapter payloads, keep the type only
            stage = FailureStage.UNEXPECTED;
            reason = "Unexpected error: " + e.getClass().getSimpleName();
        }
        return new DocumentFailure(document.id(), stage, reason);
    }

    private record Scored(CandidateExtraction extraction, FitScore fit) {
    }
}
