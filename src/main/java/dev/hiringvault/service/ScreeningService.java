package dev.hiringvault.service;

import dev.hiringvault.ai.JobProfileAnalyzer;
import dev.hiringvault.document.DocumentTextExtractor;
import dev.hiringvault.metrics.ScreeningMetrics;
import dev.hiringvault.model.JobProfile;
import dev.hiringvault.model.SourceDocument;
import dev.hiringvault.pipeline.CandidatePipeline;
import dev.hiringvault.selection.SelectionRegistry;
import dev.hiringvault.vault.PiiVault;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * Entry point for a screening: analyses the job description and opens a session over a batch.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScreeningService {

    private final JobProfileAnalyzer jobProfileAnalyzer;
    private final DocumentTextExtractor textExtractor;
    private final CandidatePipeline pipeline;
    private final ScreeningMetrics metrics;

    /**
     * Analyse a job description document into a {@link JobProfile}.
     */
    public Mono<JobProfile> analyzeJobDescription(SourceDocument jobDescription) {
        return Mono.fromCallable(() -> textExtractor.extractText(jobDescription))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(jobProfileAnalyzer::analyze)
                .doOnNext(profile -> log.info("Job profile '{}' requires {} skills",
                        profile.title(), profile.requiredSkills().size()));
    }

    /**
     * Run the pipeline in a fresh vault and open a session over the result.
     * If the run fails or is cancelled the vault is purged and no session is created.
     */
    public Mono<ScreeningSession> openSession(List<SourceDocument> documents, JobProfile jobProfile) {
        return Mono.defer(() -> {
            PiiVault vault = new PiiVault();
            return pipeline.run(documents, jobProfile, vault)
                    .map(result -> new ScreeningSession(jobProfile, result,
                            new SelectionRegistry(result.candidates(), vault, metrics), vault))
                    .doOnError(e -> vault.purge())
                    .doOnCancel(vault::purge);
        });
    }
}
