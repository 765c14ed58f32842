package com.example.bully.node_runner.config;

import java.io.IOException;
import java.util.Map;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.example.bully.applier.StateApplier;
import com.example.bully.config.ReplicaSettings;
import com.example.bully.kvstore.InMemoryKVStore;
import com.example.bully.kvstore.KVStore;
import com.example.bully.kvstore.statemachine.KVStoreStateMachine;
import com.example.bully.log.CommitLog;
import com.example.bully.log.PersistentCommitLog;
import com.example.bully.networking.config.NetworkConfig;
import com.example.bully.networking.rpc.HttpReplicaRpcService;
import com.example.bully.node.ReplicaNode;
import com.example.bully.persistence.FilePersistenceManager;
import com.example.bully.persistence.PersistenceManager;
import com.example.bully.timer.ElectionTimer;
import com.example.bully.timer.ElectionTimerImpl;
import com.example.bully.timer.HeartbeatTimer;
import com.example.bully.timer.HeartbeatTimerImpl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Configuration
@Slf4j
@RequiredArgsConstructor
public class NodeRunnerConfig {
    private final NodeConfig nodeConfig;

    @Bean
    public ReplicaSettings replicaSettings() {
        ReplicaSettings settings = nodeConfig.toReplicaSettings();
        settings.validate();
        log.info("Replica {} configured with peers {}", settings.getReplicaId(), settings.getPeerIds());
        return settings;
    }

    @Bean
    public PersistenceManager persistenceManager() throws IOException {
        FilePersistenceManager persistenceManager = new FilePersistenceManager(
                nodeConfig.getStorageDir(),
                nodeConfig.getId());
        persistenceManager.initialize();
        return persistenceManager;
    }

    @Bean
    public KVStore kvStore() {
        return new InMemoryKVStore();
    }

    @Bean
    public StateApplier stateApplier(KVStore kvStore) {
        return new KVStoreStateMachine(kvStore);
    }

    @Bean
    public CommitLog commitLog(PersistenceManager persistenceManager, StateApplier stateApplier) throws IOException {
        return new PersistentCommitLog(persistenceManager, stateApplier);
    }

    @Bean
    public ElectionTimer electionTimer() {
        return new ElectionTimerImpl(nodeConfig.getCoordinatorWaitMs(), nodeConfig.getCoordinatorWaitVarianceMs());
    }

    @Bean
    public HeartbeatTimer heartbeatTimer() {
        return new HeartbeatTimerImpl(nodeConfig.getHeartbeatIntervalMs());
    }

    @Bean
    public NetworkConfig networkConfig() {
        NetworkConfig networkConfig = new NetworkConfig();
        networkConfig.setConnectionTimeoutMs(nodeConfig.getConnectionTimeoutMs());
        networkConfig.setReadTimeoutMs(nodeConfig.getReadTimeoutMs());
        for (Map.Entry<Integer, String> peer : nodeConfig.getPeers().entrySet()) {
            String url = peer.getValue();
            if (url == null || url.isBlank()) {
                url = networkConfig.resolveReplicaUrl(peer.getKey());
            }
            networkConfig.addReplicaUrl(peer.getKey(), url);
        }
        return networkConfig;
    }

    @Bean
    public HttpReplicaRpcService replicaRpcService(NetworkConfig networkConfig) {
        return new HttpReplicaRpcService(networkConfig);
    }

    @Bean
    public ReplicaNode replicaNode(
            ReplicaSettings replicaSettings,
            CommitLog commitLog,
            StateApplier stateApplier,
            HttpReplicaRpcService rpcService,
            ElectionTimer electionTimer,
            HeartbeatTimer heartbeatTimer) {
        return new ReplicaNode(replicaSettings, commitLog, stateApplier, rpcService, electionTimer, heartbeatTimer);
    }
}
