package dev.hiringvault.vault;

import dev.hiringvault.exception.UnknownTokenException;
import dev.hiringvault.model.PiiRecord;
import dev.hiringvault.model.Token;
import lombok.extern.slf4j.Slf4j;

import java.security.SecureRandom;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.Map;
import java.util.Objects;

/**
 * Session scoped custodian of candidate PII.
 * Every record is reachable only through the random token returned by {@link #store(PiiRecord)}.
 */
@Slf4j
public class PiiVault implements AutoCloseable {

    private static final int TOKEN_BYTES = 16;
    private static final HexFormat HEX = HexFormat.of();

    private final SecureRandom random;
    private final Object lock = new Object();
    private final Map<String, PiiRecord> records = new HashMap<>();

    public PiiVault() {
        this(new SecureRandom());
    }

    PiiVault(SecureRandom random) {
        this.random = Objects.requireNonNull(random);
    }

    /**
     * Store a record under a fresh 128-bit token.
     *
     * @param pii The record to keep
     * @return The token granting access to it
     */
    public Token store(PiiRecord pii) {
        Objects.requireNonNull(pii, "pii");
        synchronized (lock) {
            String value;
            do {
                value = nextTokenValue();
            } while (records.containsKey(value));
            records.put(value, pii);
            return new Token(value);
        }
    }

    /**
     * Retrieve the record behind a token.
     *
     * @throws UnknownTokenException if the token was never issued or has been purged
     */
    public PiiRecord retrieve(Token token) {
        if (token == null) {
            throw new UnknownTokenException();
        }
        synchronized (lock) {
            PiiRecord pii = records.get(token.value());
            if (pii == null) {
                throw new UnknownTokenException();
            }
            return pii;
        }
    }

    /**
     * Remove a single entry. Used to roll back tokens of a cancelled batch.
     *
     * @return true if the token was live
     */
    public boolean discard(Token token) {
        if (token == null) {
            return false;
        }
        synchronized (lock) {
            return records.remove(token.value()) != null;
        }
    }

    public int size() {
        synchronized (lock) {
            return records.size();
        }
    }

    /**
     * Drop every record. Tokens issued before the purge are no longer valid.
     */
    public void purge() {
        int purged;
        synchronized (lock) {
            purged = records.size();
            records.clear();
        }
        log.info("Vault purged ({} records)", purged);
    }

    @Override
    public void close() {
        purge();
    }

    private String nextTokenValue() {
        byte[] bytes = new byte[TOKEN_BYTES];
        random.nextBytes(bytes);
        return HEX.formatHex(bytes);
    }
}
