package com.example.bully.timer;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class HeartbeatTimerImpl implements HeartbeatTimer {
    private final ScheduledExecutorService scheduler;
    private final long heartbeatIntervalMs;
    private Runnable heartbeatHandler;
    private ScheduledFuture<?> scheduledTask;

    public HeartbeatTimerImpl(long heartbeatIntervalMs) {
        this.heartbeatIntervalMs = heartbeatIntervalMs;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "heartbeat-timer");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public synchronized void start() {
        if (heartbeatHandler == null) {
            throw new IllegalStateException("Heartbeat handler not set");
        }
        stop();
        log.debug("HeartbeatTimer: Starting with interval {}ms", heartbeatIntervalMs);
        scheduledTask = scheduler.scheduleWithFixedDelay(this::triggerHeartbeat, heartbeatIntervalMs,
                heartbeatIntervalMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public synchronized void stop() {
        if (scheduledTask != null) {
            log.debug("HeartbeatTimer: Stopping");
            scheduledTask.cancel(false);
            scheduledTask = null;
        }
    }

    @Override
    public synchronized void setHeartbeatHandler(Runnable handler) {
        this.heartbeatHandler = handler;
    }

    private void triggerHeartbeat() {
        Runnable handler;
        synchronized (this) {
            handler = heartbeatHandler;
        }
        if (handler == null) {
            return;
        }
        // an exception escaping here would cancel all future ticks
        try {
            handler.run();
        } catch (RuntimeException e) {
            log.error("HeartbeatTimer: Handler failed", e);
        }
    }

    @Override
    public void shutdown() {
        stop();
        scheduler.shutdownNow();
    }
}
