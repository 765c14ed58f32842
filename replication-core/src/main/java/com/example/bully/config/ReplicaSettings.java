package com.example.bully.config;

import java.util.ArrayList;
import java.util.List;

import lombok.Data;

/**
 * Static settings of one replica. Timeouts are in milliseconds.
 */
@Data
public class ReplicaSettings {
    private int replicaId;
    private List<Integer> peerIds = new ArrayList<>();

    private long heartbeatIntervalMs = 1000;
    private int failureThreshold = 2; // consecutive missed heartbeats before the leader is presumed dead
    private long rpcTimeoutMs = 1000;
    private long electionAckTimeoutMs = 2000;
    private long coordinatorWaitMs = 3000;
    private long coordinatorWaitVarianceMs = 500;
    private long replicationTimeoutMs = 3000;

    public ReplicaSettings() {
    }

    public ReplicaSettings(int replicaId, List<Integer> peerIds) {
        this.replicaId = replicaId;
        this.peerIds = new ArrayList<>(peerIds);
    }

    /**
     * @return number of replicas in the cluster, including this one
     */
    public int clusterSize() {
        return peerIds.size() + 1;
    }

    public void validate() {
        if (peerIds.contains(replicaId)) {
            throw new IllegalArgumentException("Replica " + replicaId + " lists itself as a peer");
        }
        if (peerIds.stream().distinct().count() != peerIds.size()) {
            throw new IllegalArgumentException("Duplicate peer ids: " + peerIds);
        }
        if (heartbeatIntervalMs <= 0 || rpcTimeoutMs <= 0 || electionAckTimeoutMs <= 0 || coordinatorWaitMs <= 0
                || replicationTimeoutMs <= 0) {
            throw new IllegalArgumentException("Timeouts must be positive");
        }
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be at least 1");
        }
    }
}
