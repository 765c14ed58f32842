package com.example.bully.execution;

import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import com.example.bully.applier.StateApplier;
import com.example.bully.config.ReplicaSettings;
import com.example.bully.exception.ForwardingFailureException;
import com.example.bully.exception.InvalidCommandException;
import com.example.bully.exception.NoLeaderKnownException;
import com.example.bully.exception.ReplicationException;
import com.example.bully.log.AppendResult;
import com.example.bully.log.CommitLog;
import com.example.bully.model.ExecuteRequest;
import com.example.bully.model.ExecuteResponse;
import com.example.bully.replication.ReplicationCoordinator;
import com.example.bully.rpc.ReplicaRpcService;
import com.example.bully.state.LeaderSnapshot;
import com.example.bully.state.LeaderView;
import com.example.bully.state.ReplicaRole;

import lombok.extern.slf4j.Slf4j;

/**
 * Entry point for client commands on any replica. Commands only ever take
 * effect through the leader's commit path.
 */
@Slf4j
public class RequestExecutionPipeline {
    private final int selfId;
    private final LeaderView leaderView;
    private final CommitLog commitLog;
    private final StateApplier applier;
    private final ReplicationCoordinator replicationCoordinator;
    private final ReplicaRpcService rpcService;
    private final long forwardTimeoutMs;

    public RequestExecutionPipeline(ReplicaSettings settings, LeaderView leaderView, CommitLog commitLog,
            StateApplier applier, ReplicationCoordinator replicationCoordinator, ReplicaRpcService rpcService) {
        this.selfId = settings.getReplicaId();
        this.leaderView = leaderView;
        this.commitLog = commitLog;
        this.applier = applier;
        this.replicationCoordinator = replicationCoordinator;
        this.rpcService = rpcService;
        // the leader itself waits up to the replication timeout for its quorum
        this.forwardTimeoutMs = settings.getRpcTimeoutMs() + settings.getReplicationTimeoutMs();
    }

    /**
     * Executes a state-changing command.
     *
     * @param command   opaque command for the state applier
     * @param forwarded true if another replica already forwarded this command;
     *                  it is then never forwarded again
     * @return the applier's result
     * @throws NoLeaderKnownException      if no leader is known (retryable)
     * @throws ForwardingFailureException  if the leader could not be reached
     *                                     (retryable)
     * @throws InvalidCommandException     if the leader's applier rejected the
     *                                     command; nothing was committed
     * @throws com.example.bully.exception.PersistenceException   if the leader
     *                                     could not persist the command
     * @throws com.example.bully.exception.QuorumTimeoutException if the
     *                                     command is committed on the leader but
     *                                     its replication is uncertain
     */
    public String execute(String command, boolean forwarded) {
        Optional<AppendResult> appended = appendAsLeader(command);
        if (appended.isPresent()) {
            log.debug("{}: Appended commit {}", selfId, appended.get().getCommit().getId());
            replicationCoordinator.replicate(appended.get().getCommit());
            return appended.get().getResult();
        }
        LeaderSnapshot snapshot = leaderView.snapshot();
        if (snapshot.getRole() == ReplicaRole.FOLLOWER && snapshot.hasLeader() && !forwarded) {
            return forward(snapshot.getLeaderId(), command);
        }
        throw new NoLeaderKnownException(selfId);
    }

    /**
     * The role check and the append happen under the view lock, so a step-down
     * either precedes the append or waits for it
     */
    private Optional<AppendResult> appendAsLeader(String command) {
        try {
            return leaderView.runAsLeader(() -> commitLog.append(command));
        } catch (IllegalArgumentException e) {
            log.debug("{}: Command rejected by applier: {}", selfId, e.getMessage());
            throw new InvalidCommandException(e.getMessage(), e);
        }
    }

    private String forward(int leaderId, String command) {
        log.debug("{}: Forwarding command to leader {}", selfId, leaderId);
        ExecuteResponse response;
        try {
            response = rpcService.sendExecute(leaderId, new ExecuteRequest(command, true))
                    .get(forwardTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ForwardingFailureException(leaderId, e);
        } catch (ExecutionException | TimeoutException e) {
            log.warn("{}: Forwarding to leader {} failed: {}", selfId, leaderId, e.toString());
            throw new ForwardingFailureException(leaderId, e);
        }
        if (!response.succeeded()) {
            throw ReplicationException.of(response.getError(), response.getMessage());
        }
        return response.getResult();
    }

    /**
     * Remote side of {@link #execute(String, boolean)}; failures travel back as
     * an error code
     */
    public ExecuteResponse handleExecute(ExecuteRequest request) {
        try {
            return ExecuteResponse.ok(execute(request.getCommand(), request.isForwarded()));
        } catch (ReplicationException e) {
            return ExecuteResponse.failure(e.getErrorCode(), e.getMessage());
        }
    }

    /**
     * Serves a read-only query from local state. A lagging follower may
     * return stale results.
     */
    public String query(String query) {
        return applier.query(query);
    }
}
