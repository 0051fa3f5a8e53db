package dev.hiringvault;

import dev.hiringvault.config.ScreeningProperties;
import dev.hiringvault.document.DocumentLoader;
import dev.hiringvault.export.ShortlistExporter;
import dev.hiringvault.model.BatchResult;
import dev.hiringvault.model.DocumentFailure;
import dev.hiringvault.model.JobProfile;
import dev.hiringvault.model.ShortlistEntry;
import dev.hiringvault.model.SourceDocument;
import dev.hiringvault.selection.Candidate;
import dev.hiringvault.selection.SelectionRegistry;
import dev.hiringvault.service.ScreeningService;
import dev.hiringvault.service.ScreeningSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.nio.file.Path;
import java.util.List;

/**
 * Runs one screening from the command line: job description and CV folder in,
 * anonymous ranking and shortlist file out.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScreeningRunner {

    private static final String SEPARATOR = "========================================";

    private final ScreeningService screeningService;
    private final DocumentLoader documentLoader;
    private final ShortlistExporter shortlistExporter;
    private final ScreeningProperties properties;

    /**
     * Execute the screening and write the shortlist.
     *
     * @return Number of shortlisted candidates
     */
    public int execute() {
        log.info(SEPARATOR);
        log.info("Hiring Vault Screening Starting");
        log.info(SEPARATOR);

        try {
            return screen();
        } catch (RuntimeException e) {
            log.error("Screening failed: {}", e.getMessage(), e);
            throw new IllegalStateException("Screening execution failed", e);
        }
    }

    private int screen() {
        if (!StringUtils.hasText(properties.getJobDescription()) || !StringUtils.hasText(properties.getDocumentsDir())) {
            throw new IllegalStateException("screening.job-description and screening.documents-dir must be set");
        }

        SourceDocument jobDescription = documentLoader.load(Path.of(properties.getJobDescription()));
        JobProfile jobProfile = screeningService.analyzeJobDescription(jobDescription).block();
        if (jobProfile == null) {
            throw new IllegalStateException("Job description analysis returned nothing");
        }

        List<SourceDocument> documents = documentLoader.loadDirectory(Path.of(properties.getDocumentsDir()));

        try (ScreeningSession session = screeningService.openSession(documents, jobProfile).block()) {
            if (session == null) {
                throw new IllegalStateException("Screening returned no session");
            }
            logRanking(session.getBatchResult());

            SelectionRegistry registry = session.getRegistry();
            applySelection(session, registry);
            applyReveals(session, registry);

            List<ShortlistEntry> shortlist = registry.exportSelection();
            Path file = shortlistExporter.export(Path.of(properties.getExportFile()), jobProfile.title(), shortlist);

            log.info(SEPARATOR);
            log.info("Screening Completed: {}", session.getBatchResult().summary());
            log.info("Shortlisted: {} ({} revealed) -> {}", shortlist.size(),
                    shortlist.stream().filter(ShortlistEntry::isRevealed).count(), file);
            log.info(SEPARATOR);
            return shortlist.size();
        }
    }

    private void logRanking(BatchResult result) {
        log.info("Ranking ({}):", result.summary());
        int rank = 1;
        for (Candidate candidate : result.candidates()) {
            log.info("  {}. {} - {}% [{}] {}", rank++, candidate.alias(), candidate.score(),
                    String.join(", ", candidate.profile().skills()), candidate.profile().rationale());
        }
        for (DocumentFailure failure : result.failures()) {
            log.warn("  Skipped {} ({}): {}", failure.documentId(), failure.stage(), failure.reason());
        }
    }

    private void applySelection(ScreeningSession session, SelectionRegistry registry) {
        List<Candidate> ranked = registry.candidates();
        ranked.stream()
                .limit(Math.max(0, properties.getSelectTop()))
                .forEach(candidate -> registry.select(candidate.token()));

        for (String alias : properties.getSelect()) {
            session.findByAlias(alias).ifPresentOrElse(
                    candidate -> registry.select(candidate.token()),
                    () -> log.warn("Cannot select '{}': no such candidate", alias));
        }
    }

    private void applyReveals(ScreeningSession session, SelectionRegistry registry) {
        for (String alias : properties.getReveal()) {
            session.findByAlias(alias).ifPresentOrElse(
                    candidate -> registry.reveal(candidate.token()),
                    () -> log.warn("Cannot reveal '{}': no such candidate", alias));
        }
    }
}
