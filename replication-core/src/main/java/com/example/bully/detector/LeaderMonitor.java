package com.example.bully.detector;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

import com.example.bully.config.ReplicaSettings;
import com.example.bully.election.ElectionCoordinator;
import com.example.bully.exception.ConsistencyViolationException;
import com.example.bully.log.CommitLog;
import com.example.bully.model.Ack;
import com.example.bully.model.HeartbeatRequest;
import com.example.bully.replication.ReplicationCoordinator;
import com.example.bully.rpc.ReplicaRpcService;
import com.example.bully.state.LeaderSnapshot;
import com.example.bully.state.LeaderView;
import com.example.bully.timer.HeartbeatTimer;

import lombok.extern.slf4j.Slf4j;

/**
 * Periodically probes the leader this replica follows. After
 * {@code failureThreshold} consecutive missed heartbeats the leader is
 * presumed dead and an election starts. Runs on the heartbeat timer thread,
 * never on an RPC handler thread.
 *
 * A leader instead heartbeats every replica with a higher id and steps down
 * as soon as one of them reports a higher leader, which ends a second
 * leadership left over from a healed partition.
 */
@Slf4j
public class LeaderMonitor {
    private final int selfId;
    private final List<Integer> higherPeerIds;
    private final LeaderView leaderView;
    private final CommitLog commitLog;
    private final ReplicaRpcService rpcService;
    private final HeartbeatTimer heartbeatTimer;
    private final ElectionCoordinator electionCoordinator;
    private final ReplicationCoordinator replicationCoordinator;
    private final FailureDetector failureDetector;
    private final long rpcTimeoutMs;

    public LeaderMonitor(ReplicaSettings settings, LeaderView leaderView, CommitLog commitLog,
            ReplicaRpcService rpcService, HeartbeatTimer heartbeatTimer, ElectionCoordinator electionCoordinator,
            ReplicationCoordinator replicationCoordinator) {
        this.selfId = settings.getReplicaId();
        this.higherPeerIds = settings.getPeerIds().stream().filter(id -> id > selfId).sorted()
                .collect(Collectors.toList());
        this.leaderView = leaderView;
        this.commitLog = commitLog;
        this.rpcService = rpcService;
        this.heartbeatTimer = heartbeatTimer;
        this.electionCoordinator = electionCoordinator;
        this.replicationCoordinator = replicationCoordinator;
        this.rpcTimeoutMs = settings.getRpcTimeoutMs();
        this.failureDetector = new FailureDetector(settings.getFailureThreshold(), this::declareLeaderLost);
        this.heartbeatTimer.setHeartbeatHandler(this::probe);
    }

    public void start() {
        heartbeatTimer.start();
    }

    public void stop() {
        heartbeatTimer.shutdown();
        failureDetector.resetAllCounters();
    }

    /**
     * One probe cycle
     */
    void probe() {
        LeaderSnapshot snapshot = leaderView.snapshot();
        switch (snapshot.getRole()) {
            case UNKNOWN:
                log.debug("{}: No leader known, starting election", selfId);
                electionCoordinator.triggerElection();
                break;
            case FOLLOWER:
                // a deferring follower has no leader yet; the election timer covers it
                if (snapshot.hasLeader()) {
                    probeLeader(snapshot.getLeaderId());
                }
                break;
            case LEADER:
                checkHigherReplicas();
                break;
            case CANDIDATE:
                break;
            default:
                throw new IllegalStateException("Unknown role: " + snapshot.getRole());
        }
    }

    private void probeLeader(int leaderId) {
        Ack ack;
        try {
            ack = rpcService.sendHeartbeat(leaderId, new HeartbeatRequest(selfId)).get(rpcTimeoutMs,
                    TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        } catch (ExecutionException | TimeoutException e) {
            log.debug("{}: Heartbeat to leader {} failed: {}", selfId, leaderId, e.toString());
            failureDetector.recordFailure(leaderId);
            return;
        }
        failureDetector.recordSuccess(leaderId);

        Integer reportedLeader = ack.getLeaderId();
        if (reportedLeader == null || reportedLeader != leaderId) {
            // the replica we follow no longer leads
            if (reportedLeader != null && leaderView.adoptLeader(reportedLeader)) {
                log.info("{}: Leader {} now follows {}, switching", selfId, leaderId, reportedLeader);
                catchUp(reportedLeader);
            } else {
                log.info("{}: Replica {} is no longer leader", selfId, leaderId);
                declareLeaderLost(leaderId);
            }
            return;
        }
        if (ack.getLatestCommitId() > commitLog.latestId()) {
            log.info("{}: Behind leader {} ({} < {}), catching up", selfId, leaderId, commitLog.latestId(),
                    ack.getLatestCommitId());
            catchUp(leaderId);
        }
    }

    private void checkHigherReplicas() {
        if (higherPeerIds.isEmpty()) {
            return;
        }
        Map<Integer, CompletableFuture<Ack>> pending = new LinkedHashMap<>();
        for (int peerId : higherPeerIds) {
            pending.put(peerId, rpcService.sendHeartbeat(peerId, new HeartbeatRequest(selfId))
                    .orTimeout(rpcTimeoutMs, TimeUnit.MILLISECONDS)
                    .exceptionally(ex -> null));
        }
        int highestLeader = selfId;
        for (Map.Entry<Integer, CompletableFuture<Ack>> entry : pending.entrySet()) {
            Ack ack = entry.getValue().join();
            if (ack != null && ack.getLeaderId() != null && ack.getLeaderId() > highestLeader) {
                log.warn("{}: Replica {} reports leader {} while we lead", selfId, entry.getKey(), ack.getLeaderId());
                highestLeader = ack.getLeaderId();
            }
        }
        if (highestLeader != selfId && replicationCoordinator.yieldTo(highestLeader)) {
            log.info("{}: Stepped down in favour of {}", selfId, highestLeader);
        }
    }

    private void catchUp(int leaderId) {
        if (commitLog.isHalted()) {
            return;
        }
        try {
            replicationCoordinator.pullFrom(leaderId);
        } catch (ConsistencyViolationException e) {
            log.error("{}: Catch-up from leader {} halted: {}", selfId, leaderId, e.getMessage());
        }
    }

    private void declareLeaderLost(int leaderId) {
        if (leaderView.markLeaderLost(leaderId)) {
            log.warn("{}: Leader {} presumed dead, starting election", selfId, leaderId);
            electionCoordinator.triggerElection();
        }
    }

    public FailureDetector getFailureDetector() {
        return failureDetector;
    }
}
