package com.example.bully.detector;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntConsumer;

import lombok.extern.slf4j.Slf4j;

/**
 * Counts consecutive failed probes per replica. A single success resets the
 * count; reaching the threshold fires the handler once and resets it.
 */
@Slf4j
public class FailureDetector {
    private final Map<Integer, AtomicInteger> failureCounters = new ConcurrentHashMap<>();
    private final int failureThreshold;
    private final IntConsumer failureHandler;

    public FailureDetector(int failureThreshold, IntConsumer failureHandler) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be at least 1");
        }
        this.failureThreshold = failureThreshold;
        this.failureHandler = failureHandler;
    }

    /**
     * Record a successful probe of a replica
     *
     * @param replicaId id of the replica
     */
    public void recordSuccess(int replicaId) {
        AtomicInteger counter = failureCounters.get(replicaId);
        if (counter != null && counter.get() > 0) {
            log.debug("Resetting failure counter for replica {}", replicaId);
            counter.set(0);
        }
    }

    /**
     * Record a failed probe of a replica
     *
     * @param replicaId id of the replica
     * @return true if the replica has reached the failure threshold, false otherwise
     */
    public boolean recordFailure(int replicaId) {
        AtomicInteger counter = failureCounters.computeIfAbsent(replicaId, k -> new AtomicInteger(0));
        int failures = counter.incrementAndGet();
        log.debug("Recorded failure #{} for replica {}", failures, replicaId);
        if (failures >= failureThreshold) {
            log.warn("Replica {} has reached failure threshold ({} consecutive failures)", replicaId,
                    failureThreshold);
            counter.set(0);
            if (failureHandler != null) {
                failureHandler.accept(replicaId);
            }
            return true;
        }
        return false;
    }

    public int getFailuresCount(int replicaId) {
        AtomicInteger counter = failureCounters.get(replicaId);
        return counter != null ? counter.get() : 0;
    }

    public void resetAllCounters() {
        failureCounters.clear();
    }
}
