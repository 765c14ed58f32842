package com.example.bully.timer;

import java.util.Random;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class ElectionTimerImpl implements ElectionTimer {

    private final ScheduledExecutorService scheduler;
    private final long baseTimeoutMs;
    private final long timeoutVarianceMs;
    private final Random random = new Random();
    private Runnable timeoutHandler;
    private ScheduledFuture<?> scheduledTask;

    public ElectionTimerImpl(long baseTimeoutMs, long timeoutVarianceMs) {
        this.baseTimeoutMs = baseTimeoutMs;
        this.timeoutVarianceMs = timeoutVarianceMs;
        log.info("ElectionTimer created with base: {}ms, variance: {}ms", baseTimeoutMs, timeoutVarianceMs);

        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "election-timer");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public synchronized void start() {
        if (timeoutHandler == null) {
            throw new IllegalStateException("Timeout handler not set");
        }
        stop();
        long timeout = calculateRandomTimeout();
        log.debug("ElectionTimer: Starting with timeout {}ms", timeout);
        scheduledTask = scheduler.schedule(this::handleTimeout, timeout, TimeUnit.MILLISECONDS);
    }

    @Override
    public synchronized void stop() {
        if (scheduledTask != null) {
            scheduledTask.cancel(false);
            scheduledTask = null;
        }
    }

    @Override
    public synchronized boolean isPending() {
        return scheduledTask != null;
    }

    @Override
    public synchronized void setTimeoutHandler(Runnable handler) {
        this.timeoutHandler = handler;
    }

    private long calculateRandomTimeout() {
        if (timeoutVarianceMs <= 0) {
            return baseTimeoutMs;
        }
        long variance = (long) (random.nextDouble() * 2 * timeoutVarianceMs) - timeoutVarianceMs;
        return Math.max(1, baseTimeoutMs + variance);
    }

    /**
     * Handle timeout event by calling timeout handler
     */
    private void handleTimeout() {
        Runnable handler;
        synchronized (this) {
            scheduledTask = null;
            handler = timeoutHandler;
        }
        log.debug("ElectionTimer: Timeout fired");
        if (handler == null) {
            return;
        }
        try {
            handler.run();
        } catch (RuntimeException e) {
            log.error("ElectionTimer: Handler failed", e);
        }
    }

    /**
     * shutdown timer and cleanup resources
     */
    @Override
    public void shutdown() {
        stop();
        scheduler.shutdownNow();
    }
}
