package com.example.bully.persistence;

import java.io.IOException;

public interface PersistenceManager {
    /**
     * Initializes the persistence system
     *
     * @throws IOException if an I/O error occurs
     */
    void initialize() throws IOException;

    /**
     * Loads the last state written by {@link #save(DurableState)}
     *
     * @return the persisted state, or an empty state if nothing was saved yet
     * @throws IOException if an I/O error occurs
     */
    DurableState load() throws IOException;

    /**
     * Atomically replaces the persisted state. After a crash, {@link #load()}
     * returns either the previous or the new state, never a mix.
     *
     * @param state the state to save
     * @throws IOException if the state could not be made durable
     */
    void save(DurableState state) throws IOException;

    /**
     * Cleans up resources used by the persistence system
     *
     * @throws IOException if an I/O error occurs
     */
    void close() throws IOException;
}
