package com.example.bully.persistence;

import java.io.IOException;
import java.util.ArrayList;

/**
 * Keeps the "durable" state in memory. Survives a replica restart inside the
 * same JVM, which is what the in-memory cluster uses to simulate crashes.
 */
public class InMemoryPersistenceManager implements PersistenceManager {
    private DurableState saved = DurableState.empty();
    private volatile boolean failSaves = false;

    @Override
    public void initialize() {
        // Nothing to do for in memory implementation
    }

    @Override
    public synchronized DurableState load() {
        return copyOf(saved);
    }

    @Override
    public synchronized void save(DurableState state) throws IOException {
        if (failSaves) {
            throw new IOException("Simulated write failure");
        }
        this.saved = copyOf(state);
    }

    @Override
    public void close() {
        // Nothing to do
    }

    /**
     * Makes every following save fail, as a full disk would
     */
    public void setFailSaves(boolean failSaves) {
        this.failSaves = failSaves;
    }

    private static DurableState copyOf(DurableState state) {
        return new DurableState(new ArrayList<>(state.getCommits()), state.getApplierSnapshot(),
                state.getHaltReason());
    }
}
