package com.example.bully.rpc;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import com.example.bully.exception.UnreachablePeerException;
import com.example.bully.model.Ack;
import com.example.bully.model.CoordinatorRequest;
import com.example.bully.model.ElectionRequest;
import com.example.bully.model.ExecuteRequest;
import com.example.bully.model.ExecuteResponse;
import com.example.bully.model.GetCommitsRequest;
import com.example.bully.model.GetCommitsResponse;
import com.example.bully.model.HeartbeatRequest;
import com.example.bully.model.ReplicaMessage;
import com.example.bully.model.ReplicateRequest;

import lombok.extern.slf4j.Slf4j;

/**
 * Delivers messages between replicas living in the same JVM.
 * A stopped service is unreachable for its peers and cannot send, which is
 * how crashes and restarts are simulated.
 */
@Slf4j
public class InMemoryReplicaRpcService implements ReplicaRpcService {
    private final int replicaId;
    private final ExecutorService executor;
    private final Map<Integer, InMemoryReplicaRpcService> replicaRegistry = new ConcurrentHashMap<>();
    private volatile ReplicaMessageHandler handler;
    private volatile boolean running = false;

    /**
     * Creates a new in-memory RPC service for the specified replica
     *
     * @param replicaId id of the replica this service belongs to
     */
    public InMemoryReplicaRpcService(int replicaId) {
        this.replicaId = replicaId;
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "rpc-worker-" + replicaId);
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Registers other replicas in the cluster for communication
     */
    public void registerReplica(int peerId, InMemoryReplicaRpcService rpcService) {
        replicaRegistry.put(peerId, rpcService);
    }

    public boolean unregisterReplica(int peerId) {
        InMemoryReplicaRpcService removed = replicaRegistry.remove(peerId);
        if (removed == null) {
            log.debug("{}: Replica {} already unregistered", replicaId, peerId);
            return false;
        }
        log.debug("{}: Unregistered replica {}", replicaId, peerId);
        return true;
    }

    @Override
    public CompletableFuture<Ack> sendElection(int targetId, ElectionRequest request) {
        return send(targetId, request, Ack.class);
    }

    @Override
    public CompletableFuture<Ack> sendCoordinator(int targetId, CoordinatorRequest request) {
        return send(targetId, request, Ack.class);
    }

    @Override
    public CompletableFuture<Ack> sendHeartbeat(int targetId, HeartbeatRequest request) {
        return send(targetId, request, Ack.class);
    }

    @Override
    public CompletableFuture<ExecuteResponse> sendExecute(int targetId, ExecuteRequest request) {
        return send(targetId, request, ExecuteResponse.class);
    }

    @Override
    public CompletableFuture<GetCommitsResponse> sendGetCommits(int targetId, GetCommitsRequest request) {
        return send(targetId, request, GetCommitsResponse.class);
    }

    @Override
    public CompletableFuture<Ack> sendReplicate(int targetId, ReplicateRequest request) {
        return send(targetId, request, Ack.class);
    }

    private <T> CompletableFuture<T> send(int targetId, ReplicaMessage message, Class<T> responseType) {
        if (!running) {
            return CompletableFuture.failedFuture(new IllegalStateException("RPC service not started"));
        }
        return CompletableFuture.supplyAsync(() -> {
            InMemoryReplicaRpcService target = replicaRegistry.get(targetId);
            if (target == null || !target.running) {
                throw new UnreachablePeerException(targetId, null);
            }
            return responseType.cast(target.deliver(message));
        }, executor);
    }

    /**
     * Handles an incoming message by delegating to the registered handler
     */
    private Object deliver(ReplicaMessage message) {
        ReplicaMessageHandler current = handler;
        if (current == null) {
            throw new IllegalStateException("No handler registered for replica " + replicaId);
        }
        return current.handle(message);
    }

    @Override
    public void registerHandler(ReplicaMessageHandler handler) {
        this.handler = handler;
    }

    @Override
    public void start() {
        running = true;
    }

    @Override
    public void stop() {
        running = false;
    }

    /**
     * Releases the worker threads. The service cannot be restarted afterwards.
     */
    public void shutdown() {
        stop();
        executor.shutdownNow();
    }

    public boolean isRunning() {
        return running;
    }
}
