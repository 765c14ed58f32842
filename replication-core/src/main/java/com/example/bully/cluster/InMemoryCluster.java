package com.example.bully.cluster;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Consumer;
import java.util.function.Supplier;

import com.example.bully.applier.StateApplier;
import com.example.bully.config.ReplicaSettings;
import com.example.bully.log.CommitLog;
import com.example.bully.log.PersistentCommitLog;
import com.example.bully.node.ReplicaNode;
import com.example.bully.persistence.InMemoryPersistenceManager;
import com.example.bully.rpc.InMemoryReplicaRpcService;
import com.example.bully.state.ReplicaRole;
import com.example.bully.timer.ElectionTimerImpl;
import com.example.bully.timer.HeartbeatTimerImpl;

import lombok.extern.slf4j.Slf4j;

/**
 * Runs a whole cluster inside one JVM. Durable state lives in
 * {@link InMemoryPersistenceManager}s that outlive the replicas, so stopping
 * and starting a replica behaves like a process crash and restart.
 */
@Slf4j
public class InMemoryCluster {
    private final List<Integer> replicaIds;
    private final Supplier<StateApplier> applierFactory;
    private final Consumer<ReplicaSettings> settingsCustomizer;
    private final Map<Integer, ReplicaNode> nodes = new TreeMap<>();
    private final Map<Integer, InMemoryReplicaRpcService> rpcServices = new HashMap<>();
    private final Map<Integer, InMemoryPersistenceManager> storage = new HashMap<>();

    public InMemoryCluster(List<Integer> replicaIds, Supplier<StateApplier> applierFactory) {
        this(replicaIds, applierFactory, settings -> {
        });
    }

    /**
     * @param settingsCustomizer adjusts the settings of every replica, typically
     *                           to shorten timeouts
     */
    public InMemoryCluster(List<Integer> replicaIds, Supplier<StateApplier> applierFactory,
            Consumer<ReplicaSettings> settingsCustomizer) {
        this.replicaIds = new ArrayList<>(replicaIds);
        this.applierFactory = applierFactory;
        this.settingsCustomizer = settingsCustomizer;
    }

    // Initializes the cluster by creating the transport and storage of every replica
    public void init() {
        for (int replicaId : replicaIds) {
            rpcServices.put(replicaId, new InMemoryReplicaRpcService(replicaId));
            storage.put(replicaId, new InMemoryPersistenceManager());
        }
        // Register all RPC services with each other
        for (int replicaId : replicaIds) {
            InMemoryReplicaRpcService rpcService = rpcServices.get(replicaId);
            for (Map.Entry<Integer, InMemoryReplicaRpcService> entry : rpcServices.entrySet()) {
                if (entry.getKey() != replicaId) {
                    rpcService.registerReplica(entry.getKey(), entry.getValue());
                }
            }
        }
    }

    /**
     * Start all replicas in the cluster
     */
    public void startAll() {
        for (int replicaId : replicaIds) {
            startNode(replicaId);
        }
    }

    /**
     * Starts a replica from its durable state. Does nothing if it is running.
     */
    public synchronized ReplicaNode startNode(int replicaId) {
        ReplicaNode existing = nodes.get(replicaId);
        if (existing != null && existing.isRunning()) {
            return existing;
        }
        ReplicaNode node = createNode(replicaId);
        nodes.put(replicaId, node);
        node.start();
        return node;
    }

    /**
     * Crashes a replica. Its durable state is kept for a later restart.
     */
    public synchronized void stopNode(int replicaId) {
        ReplicaNode node = nodes.get(replicaId);
        if (node == null || !node.isRunning()) {
            log.info("Replica {} not found or already stopped", replicaId);
            return;
        }
        log.info("Stopping replica {}", replicaId);
        node.stop();
    }

    public synchronized void stopAll() {
        for (ReplicaNode node : nodes.values()) {
            node.stop();
        }
    }

    /**
     * Stops every replica and releases the transport threads
     */
    public synchronized void shutdown() {
        stopAll();
        for (InMemoryReplicaRpcService rpcService : rpcServices.values()) {
            rpcService.shutdown();
        }
    }

    /**
     * Cuts every link between a replica and the rest of the cluster. The
     * replica keeps running on its side of the partition.
     */
    public synchronized void isolate(int replicaId) {
        log.info("Isolating replica {}", replicaId);
        for (int peerId : replicaIds) {
            if (peerId != replicaId) {
                rpcServices.get(replicaId).unregisterReplica(peerId);
                rpcServices.get(peerId).unregisterReplica(replicaId);
            }
        }
    }

    /**
     * Heals a partition created by {@link #isolate(int)}
     */
    public synchronized void reconnect(int replicaId) {
        log.info("Reconnecting replica {}", replicaId);
        for (int peerId : replicaIds) {
            if (peerId != replicaId) {
                rpcServices.get(replicaId).registerReplica(peerId, rpcServices.get(peerId));
                rpcServices.get(peerId).registerReplica(replicaId, rpcServices.get(replicaId));
            }
        }
    }

    private ReplicaNode createNode(int replicaId) {
        List<Integer> peers = new ArrayList<>();
        for (int id : replicaIds) {
            if (id != replicaId) {
                peers.add(id);
            }
        }
        ReplicaSettings settings = new ReplicaSettings(replicaId, peers);
        settingsCustomizer.accept(settings);

        StateApplier applier = applierFactory.get();
        CommitLog commitLog;
        try {
            commitLog = new PersistentCommitLog(storage.get(replicaId), applier);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to recover replica " + replicaId, e);
        }
        return new ReplicaNode(settings, commitLog, applier, rpcServices.get(replicaId),
                new ElectionTimerImpl(settings.getCoordinatorWaitMs(), settings.getCoordinatorWaitVarianceMs()),
                new HeartbeatTimerImpl(settings.getHeartbeatIntervalMs()));
    }

    /*
     * Get a replica by its id
     */
    public synchronized ReplicaNode getNode(int replicaId) {
        return nodes.get(replicaId);
    }

    public InMemoryPersistenceManager getStorage(int replicaId) {
        return storage.get(replicaId);
    }

    /**
     * @return id of a running replica that considers itself leader, or null
     */
    public synchronized Integer getCurrentLeaderId() {
        Integer leader = null;
        for (ReplicaNode node : nodes.values()) {
            if (node.isRunning() && node.getRole() == ReplicaRole.LEADER) {
                leader = node.getReplicaId();
            }
        }
        return leader;
    }

    /**
     * Waits until every running replica agrees on the same running leader
     *
     * @return the leader id, or null on timeout
     */
    public Integer waitForLeader(long timeoutMs) throws InterruptedException {
        long endTime = System.currentTimeMillis() + timeoutMs;
        while (System.currentTimeMillis() < endTime) {
            Integer leader = agreedLeader();
            if (leader != null) {
                return leader;
            }
            Thread.sleep(50);
        }
        return null;
    }

    private synchronized Integer agreedLeader() {
        Integer leader = getCurrentLeaderId();
        if (leader == null) {
            return null;
        }
        for (ReplicaNode node : nodes.values()) {
            if (node.isRunning() && !leader.equals(node.getLeaderId())) {
                return null;
            }
        }
        return leader;
    }
}
