package com.ailab.core.ledger;

import java.util.ArrayList;
import java.util.List;

/**
 * Non-durable store. Keeps every saved document so tests can inspect the write history.
 */
public class InMemoryLedgerStore implements LedgerStore {

    private final List<LedgerDocument> history = new ArrayList<>();
    private LedgerDocument current;

    public InMemoryLedgerStore() {
        this(LedgerDocument.empty());
    }

    public InMemoryLedgerStore(LedgerDocument initial) {
        this.current = initial;
    }

    @Override
    public synchronized LedgerDocument load() {
        return current;
    }

    @Override
    public synchronized void save(LedgerDocument document) {
        history.add(current);
        current = document;
    }

    @Override
    public String describe() {
        return "in-memory";
    }

    @Override
    public boolean isWritable() {
        return true;
    }

    /** Documents replaced so far, oldest first. */
    public synchronized List<LedgerDocument> backups() {
        return List.copyOf(new ArrayList<>(history));
    }
}
