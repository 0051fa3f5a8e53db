package dev.hiringvault.selection;

import dev.hiringvault.exception.UnknownCandidateException;
import dev.hiringvault.metrics.ScreeningMetrics;
import dev.hiringvault.model.PiiRecord;
import dev.hiringvault.model.RevealAudit;
import dev.hiringvault.model.ShortlistEntry;
import dev.hiringvault.model.Token;
import dev.hiringvault.vault.PiiVault;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reviewer decisions over the candidates of one batch.
 * <p>
 * Selection and reveal are independent per candidate. Selection toggles freely; reveal is the
 * only way to obtain a {@link RevealedCandidate} and can never be undone.
 */
@Slf4j
public class SelectionRegistry {

    private final PiiVault vault;
    private final ScreeningMetrics metrics;
    private final Clock clock;

    // Rank order of the batch result
    private final Map<Token, Candidate> candidates = new LinkedHashMap<>();
    private final Set<Token> selected = new HashSet<>();
    private final List<RevealAudit> revealAudit = new ArrayList<>();

    public SelectionRegistry(List<AnonymousCandidate> ranked, PiiVault vault, ScreeningMetrics metrics) {
        this(ranked, vault, metrics, Clock.systemUTC());
    }

    SelectionRegistry(List<AnonymousCandidate> ranked, PiiVault vault, ScreeningMetrics metrics, Clock clock) {
        this.vault = vault;
        this.metrics = metrics;
        this.clock = clock;
        ranked.forEach(candidate -> candidates.put(candidate.token(), candidate));
    }

    /**
     * Mark a candidate as selected. Selecting twice has no further effect.
     *
     * @throws UnknownCandidateException if no candidate has this token
     */
    public synchronized void select(Token token) {
        Candidate candidate = require(token);
        if (selected.add(token)) {
            log.info("Selected {}", candidate.alias());
        }
    }

    /**
     * Remove a candidate from the selection. Deselecting twice has no further effect.
     *
     * @throws UnknownCandidateException if no candidate has this token
     */
    public synchronized void deselect(Token token) {
        Candidate candidate = require(token);
        if (selected.remove(token)) {
            log.info("Deselected {}", candidate.alias());
        }
    }

    public synchronized boolean isSelected(Token token) {
        require(token);
        return selected.contains(token);
    }

    public synchronized boolean isRevealed(Token token) {
        return require(token).revealed();
    }

    public synchronized Candidate candidate(Token token) {
        return require(token);
    }

    /**
     * Current view of every candidate, in rank order.
     */
    public synchronized List<Candidate> candidates() {
        return List.copyOf(candidates.values());
    }

    /**
     * Selected candidates, in rank order.
     */
    public synchronized List<Candidate> selectedCandidates() {
        return candidates.values().stream()
                .filter(candidate -> selected.contains(candidate.token()))
                .toList();
    }

    /**
     * Reveal the identity behind a candidate. Repeated calls return the same record.
     *
     * @throws UnknownCandidateException if no candidate has this token
     * @throws dev.hiringvault.exception.UnknownTokenException if the vault no longer knows the token
     */
    public synchronized PiiRecord reveal(Token token) {
        Candidate candidate = require(token);
        if (candidate instanceof RevealedCandidate revealed) {
            log.debug("{} already revealed", revealed.alias());
            return revealed.pii();
        }

        AnonymousCandidate anonymous = (AnonymousCandidate) candidate;
        PiiRecord pii = vault.retrieve(token);
        candidates.put(token, anonymous.reveal(pii));

        revealAudit.add(new RevealAudit(anonymous.alias(), Instant.now(clock)));
        metrics.recordReveal();
        log.info("Identity revealed for {}", anonymous.alias());
        return pii;
    }

    public synchronized List<RevealAudit> revealAudit() {
        return List.copyOf(revealAudit);
    }

    /**
     * Shortlist of the selected candidates in rank order.
     * Revealed candidates are listed with their identity, all others with their alias only.
     * Export never reveals anybody.
     */
    public synchronized List<ShortlistEntry> exportSelection() {
        List<ShortlistEntry> entries = new ArrayList<>();
        for (Candidate candidate : selectedCandidates()) {
            String label;
            if (candidate instanceof RevealedCandidate revealed) {
                label = revealed.pii().displayIdentity();
            } else if (candidate instanceof AnonymousCandidate anonymous) {
                label = anonymous.alias();
            } else {
                throw new IllegalStateException("Unsupported candidate type: " + candidate.getClass().getName());
            }
            entries.add(new ShortlistEntry(label, candidate.score(), candidate.revealed()));
        }
        return entries;
    }

    private Candidate require(Token token) {
        Candidate candidate = token != null ? candidates.get(token) : null;
        if (candidate == null) {
            throw new UnknownCandidateException();
        }
        return candidate;
    }
}
