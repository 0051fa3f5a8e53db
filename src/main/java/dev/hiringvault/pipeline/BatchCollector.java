package dev.hiringvault.pipeline;

import dev.hiringvault.model.BatchResult;
import dev.hiringvault.model.CandidateExtraction;
import dev.hiringvault.model.DocumentFailure;
import dev.hiringvault.model.FitScore;
import dev.hiringvault.model.ProfessionalProfile;
import dev.hiringvault.model.Token;
import dev.hiringvault.selection.AnonymousCandidate;
import dev.hiringvault.vault.PiiVault;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Gathers the outcome of every document of one batch.
 * Storing the PII and assembling the candidate happen under the same lock as cancellation,
 * so a token never exists in the vault without the candidate that owns it.
 */
@Slf4j
class BatchCollector {

    static final Comparator<AnonymousCandidate> RANKING = Comparator
            .comparingInt(AnonymousCandidate::score).reversed()
            .thenComparingInt(AnonymousCandidate::submissionIndex);

    private final PiiVault vault;
    private final List<AnonymousCandidate> candidates = new ArrayList<>();
    private final List<IndexedFailure> failures = new ArrayList<>();
    private boolean cancelled;

    BatchCollector(PiiVault vault) {
        this.vault = vault;
    }

    /**
     * Store the PII and register the anonymous candidate as one unit.
     *
     * @return the candidate, or empty if the batch was cancelled in the meantime
     */
    synchronized Optional<AnonymousCandidate> admit(int submissionIndex, CandidateExtraction extraction, FitScore fit) {
        if (cancelled) {
            return Optional.empty();
        }
        ProfessionalProfile profile = ProfessionalProfile.scored(extraction.attributes(), fit);
        String alias = AliasGenerator.aliasFor(submissionIndex);

        Token token = vault.store(extraction.pii());
        AnonymousCandidate candidate = new AnonymousCandidate(token, alias, profile, submissionIndex);
        candidates.add(candidate);
        return Optional.of(candidate);
    }

    synchronized void reject(int submissionIndex, DocumentFailure failure) {
        if (!cancelled) {
            failures.add(new IndexedFailure(submissionIndex, failure));
        }
    }

    /**
     * Roll back every token issued for this batch.
     */
    synchronized void cancel() {
        if (cancelled) {
            return;
        }
        cancelled = true;
        candidates.forEach(candidate -> vault.discard(candidate.token()));
        log.info("Batch cancelled: discarded {} vault entries", candidates.size());
        candidates.clear();
        failures.clear();
    }

    synchronized BatchResult result(int submitted) {
        List<AnonymousCandidate> ranked = candidates.stream()
                .sorted(RANKING)
                .toList();
        List<DocumentFailure> orderedFailures = failures.stream()
                .sorted(Comparator.comparingInt(IndexedFailure::submissionIndex))
                .map(IndexedFailure::failure)
                .toList();
        return new BatchResult(ranked, orderedFailures, submitted);
    }

    private record IndexedFailure(int submissionIndex, DocumentFailure failure) {
    }
}
