package com.example.bully.rpc;

import java.util.concurrent.CompletableFuture;

import com.example.bully.model.Ack;
import com.example.bully.model.CoordinatorRequest;
import com.example.bully.model.ElectionRequest;
import com.example.bully.model.ExecuteRequest;
import com.example.bully.model.ExecuteResponse;
import com.example.bully.model.GetCommitsRequest;
import com.example.bully.model.GetCommitsResponse;
import com.example.bully.model.HeartbeatRequest;
import com.example.bully.model.ReplicateRequest;

/**
 * Point-to-point request/response calls between replicas.
 * A returned future completes exceptionally with an
 * {@link com.example.bully.exception.UnreachablePeerException} when the
 * target cannot be reached; callers bound the wait with their own timeout.
 */
public interface ReplicaRpcService {
    /**
     * Sends an Election request to a replica with a higher id
     *
     * @param targetId id of the target replica
     * @param request  election request to send
     * @return CompletableFuture that will complete with the ack or an exception
     */
    CompletableFuture<Ack> sendElection(int targetId, ElectionRequest request);

    /**
     * Announces a new leader together with its commit history
     */
    CompletableFuture<Ack> sendCoordinator(int targetId, CoordinatorRequest request);

    /**
     * Liveness probe
     */
    CompletableFuture<Ack> sendHeartbeat(int targetId, HeartbeatRequest request);

    /**
     * Executes (or forwards) a client command on the target replica
     */
    CompletableFuture<ExecuteResponse> sendExecute(int targetId, ExecuteRequest request);

    /**
     * Fetches all commits after a given id
     */
    CompletableFuture<GetCommitsResponse> sendGetCommits(int targetId, GetCommitsRequest request);

    /**
     * Pushes new commits from the leader to a follower
     */
    CompletableFuture<Ack> sendReplicate(int targetId, ReplicateRequest request);

    /**
     * Registers the handler for all incoming messages
     */
    void registerHandler(ReplicaMessageHandler handler);

    /**
     * Start the RPC service
     */
    void start();

    /**
     * Stops the RPC service and release resources
     */
    void stop();
}
