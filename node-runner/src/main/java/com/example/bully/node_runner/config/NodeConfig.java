package com.example.bully.node_runner.config;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import com.example.bully.config.ReplicaSettings;

import lombok.Data;

@Configuration
@ConfigurationProperties(prefix = "replica")
@Data
public class NodeConfig {
    private int id;
    // peer id -> base URL; a peer without URL resolves to http://replica-<id>:8080
    private Map<Integer, String> peers = new HashMap<>();
    private String storageDir = "data";

    private long heartbeatIntervalMs = 1000;
    private int failureThreshold = 2;
    private long rpcTimeoutMs = 1000;
    private long electionAckTimeoutMs = 2000;
    private long coordinatorWaitMs = 3000;
    private long coordinatorWaitVarianceMs = 500;
    private long replicationTimeoutMs = 3000;

    private int connectionTimeoutMs = 1000;
    private int readTimeoutMs = 3000;

    public ReplicaSettings toReplicaSettings() {
        ReplicaSettings settings = new ReplicaSettings(id, new ArrayList<>(peers.keySet()));
        settings.setHeartbeatIntervalMs(heartbeatIntervalMs);
        settings.setFailureThreshold(failureThreshold);
        settings.setRpcTimeoutMs(rpcTimeoutMs);
        settings.setElectionAckTimeoutMs(electionAckTimeoutMs);
        settings.setCoordinatorWaitMs(coordinatorWaitMs);
        settings.setCoordinatorWaitVarianceMs(coordinatorWaitVarianceMs);
        settings.setReplicationTimeoutMs(replicationTimeoutMs);
        return settings;
    }
}
