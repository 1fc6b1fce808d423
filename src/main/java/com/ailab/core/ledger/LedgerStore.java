package com.ailab.core.ledger;

/**
 * Persistence backend for the {@link AllocationLedger}.
 * Implementations: {@link JsonFileLedgerStore}, {@link InMemoryLedgerStore}.
 *
 * <p>{@link #save} must be all-or-nothing: a crash mid-write leaves either the previous
 * document or the new one, never a mix.
 */
public interface LedgerStore {

    /**
     * @return the last saved document, or an empty one if nothing was saved yet
     */
    LedgerDocument load();

    /**
     * Replaces the stored document, preserving the previous one as a backup first.
     */
    void save(LedgerDocument document);

    /**
     * Human-readable location for logs and health output.
     */
    String describe();

    /**
     * @return true if the backend can currently accept writes
     */
    boolean isWritable();
}
