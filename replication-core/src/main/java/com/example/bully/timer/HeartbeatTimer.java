package com.example.bully.timer;

public interface HeartbeatTimer {
    /**
     * Start running the heartbeat handler periodically
     */
    void start();

    /**
     * Stop running the heartbeat handler
     */
    void stop();

    /**
     * Set the handler to be called on every tick
     */
    void setHeartbeatHandler(Runnable handler);

    void shutdown();
}
