package dev.hiringvault.metrics;

import dev.hiringvault.model.FailureStage;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Metrics for screening runs. Only counts and durations, never candidate data.
 */
@Component
public class ScreeningMetrics {

    private static final String TAG_STAGE = "stage";
    private final MeterRegistry registry;

    private final Counter documentsSubmittedCounter;
    private final Counter documentsProcessedCounter;
    private final Counter documentsFailedCounter;
    private final Counter revealsCounter;
    private final Timer batchTimer;

    private final AtomicInteger lastBatchSubmitted = new AtomicInteger(0);
    private final AtomicInteger lastBatchProcessed = new AtomicInteger(0);

    public ScreeningMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.documentsSubmittedCounter = Counter.builder("screening_documents_submitted_total")
                .description("Documents submitted to the candidate pipeline")
                .register(registry);

        this.documentsProcessedCounter = Counter.builder("screening_documents_processed_total")
                .description("Documents turned into anonymous candidates")
                .register(registry);

        this.documentsFailedCounter = Counter.builder("screening_documents_failed_total")
                .description("Documents excluded from a batch because of a failure")
                .register(registry);

        this.revealsCounter = Counter.builder("screening_reveals_total")
                .description("Explicit candidate identity reveals")
                .register(registry);

        this.batchTimer = Timer.builder("screening_batch_duration")
                .description("Time to run the pipeline over one batch")
                .register(registry);

        Gauge.builder("screening_last_batch_submitted", lastBatchSubmitted, AtomicInteger::get)
                .description("Documents submitted in the last batch")
                .register(registry);

        Gauge.builder("screening_last_batch_processed", lastBatchProcessed, AtomicInteger::get)
                .description("Candidates produced by the last batch")
                .register(registry);
    }

    public void recordDocumentsSubmitted(int count) {
        documentsSubmittedCounter.increment(count);
    }

    public void recordDocumentProcessed() {
        documentsProcessedCounter.increment();
    }

    /**
     * Record a failed document, tagged with the stage it failed at.
     */
    public void recordDocumentFailed(FailureStage stage) {
        documentsFailedCounter.increment();
        Counter.builder("screening_documents_failed_by_stage_total")
                .tag(TAG_STAGE, stage.name().toLowerCase())
                .register(registry)
                .increment();
    }

    public void recordReveal() {
        revealsCounter.increment();
    }

    public void recordBatch(int submitted, int processed, Duration elapsed) {
        lastBatchSubmitted.set(submitted);
        lastBatchProcessed.set(processed);
        batchTimer.record(elapsed);
    }
}
