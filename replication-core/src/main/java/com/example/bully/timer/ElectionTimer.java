package com.example.bully.timer;

/**
 * One-shot timer a deferring candidate arms while it waits for the
 * Coordinator announcement of a higher replica.
 */
public interface ElectionTimer {
    /**
     * start the timer, replacing any pending timeout
     * when timer expires, timeout handler will be called
     */
    void start();

    /**
     * stop the timer
     * any scheduled timeout will be cancelled
     */
    void stop();

    boolean isPending();

    /**
     * Sets the handler to be called when the timeout occurs
     */
    void setTimeoutHandler(Runnable handler);

    void shutdown();
}
