package com.example.bully.applier;

/**
 * The application state that commits are applied to.
 * Implementations must be deterministic: applying the same commands in the
 * same order on two replicas yields the same state and the same results.
 */
public interface StateApplier {
    /**
     * Apply a state-changing command
     *
     * @param command the opaque command payload
     * @return the opaque result handed back to the client
     * @throws IllegalArgumentException if the command is malformed
     */
    String apply(String command);

    /**
     * Answer a read-only query against local state. Never goes through the log.
     */
    String query(String query);

    /**
     * Take snapshot of the current state, stored alongside the commit log
     */
    String takeSnapshot();

    /**
     * Replace the current state with a snapshot
     *
     * @param snapshot snapshot produced by {@link #takeSnapshot()}, or null for
     *                 the initial empty state
     */
    void restoreSnapshot(String snapshot);
}
