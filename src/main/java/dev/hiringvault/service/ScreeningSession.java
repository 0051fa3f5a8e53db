package dev.hiringvault.service;

import dev.hiringvault.model.BatchResult;
import dev.hiringvault.model.JobProfile;
import dev.hiringvault.selection.Candidate;
import dev.hiringvault.selection.SelectionRegistry;
import dev.hiringvault.vault.PiiVault;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * One reviewer session over one batch. Owns the vault; closing the session purges it.
 */
@Slf4j
@Getter
public class ScreeningSession implements AutoCloseable {

    private final JobProfile jobProfile;
    private final BatchResult batchResult;
    private final SelectionRegistry registry;
    private final PiiVault vault;

    ScreeningSession(JobProfile jobProfile, BatchResult batchResult, SelectionRegistry registry, PiiVault vault) {
        this.jobProfile = jobProfile;
        this.batchResult = batchResult;
        this.registry = registry;
        this.vault = vault;
    }

    /**
     * Look up a candidate by the alias shown to the reviewer.
     */
    public Optional<Candidate> findByAlias(String alias) {
        if (alias == null) {
            return Optional.empty();
        }
        String wanted = alias.trim();
        return registry.candidates().stream()
                .filter(candidate -> candidate.alias().equalsIgnoreCase(wanted))
                .findFirst();
    }

    @Override
    public void close() {
        log.info("Closing screening session for '{}'", jobProfile.title());
        vault.purge();
    }
}
