package com.example.bully.node;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import com.example.bully.applier.StateApplier;
import com.example.bully.config.ReplicaSettings;
import com.example.bully.detector.LeaderMonitor;
import com.example.bully.election.ElectionCoordinator;
import com.example.bully.execution.RequestExecutionPipeline;
import com.example.bully.exception.ConsistencyViolationException;
import com.example.bully.log.CommitLog;
import com.example.bully.model.Ack;
import com.example.bully.model.CoordinatorRequest;
import com.example.bully.model.ElectionRequest;
import com.example.bully.model.ExecuteRequest;
import com.example.bully.model.GetCommitsRequest;
import com.example.bully.model.HeartbeatRequest;
import com.example.bully.model.ReplicaMessage;
import com.example.bully.model.ReplicateRequest;
import com.example.bully.replication.ReplicationCoordinator;
import com.example.bully.rpc.ReplicaMessageHandler;
import com.example.bully.rpc.ReplicaRpcService;
import com.example.bully.state.LeaderView;
import com.example.bully.state.ReplicaRole;
import com.example.bully.timer.ElectionTimer;
import com.example.bully.timer.HeartbeatTimer;

import lombok.extern.slf4j.Slf4j;

/**
 * One replica: wires the commit log, leader view, election and replication
 * coordinators, leader monitor and execution pipeline, and routes inbound
 * messages to them.
 */
@Slf4j
public class ReplicaNode implements ReplicaMessageHandler {
    private final int replicaId;
    private final List<Integer> peerIds;
    private final ReplicaSettings settings;
    private final CommitLog commitLog;
    private final ReplicaRpcService rpcService;
    private final LeaderView leaderView;
    private final ReplicationCoordinator replicationCoordinator;
    private final ElectionCoordinator electionCoordinator;
    private final LeaderMonitor leaderMonitor;
    private final RequestExecutionPipeline pipeline;
    private volatile boolean running = false;

    public ReplicaNode(ReplicaSettings settings, CommitLog commitLog, StateApplier applier,
            ReplicaRpcService rpcService, ElectionTimer electionTimer, HeartbeatTimer heartbeatTimer) {
        settings.validate();
        this.replicaId = settings.getReplicaId();
        this.peerIds = List.copyOf(settings.getPeerIds());
        this.settings = settings;
        this.commitLog = commitLog;
        this.rpcService = rpcService;
        this.leaderView = new LeaderView(replicaId);
        this.replicationCoordinator = new ReplicationCoordinator(settings, commitLog, leaderView, rpcService);
        this.electionCoordinator = new ElectionCoordinator(settings, leaderView, commitLog, rpcService,
                replicationCoordinator, electionTimer);
        this.leaderMonitor = new LeaderMonitor(settings, leaderView, commitLog, rpcService, heartbeatTimer,
                electionCoordinator, replicationCoordinator);
        this.pipeline = new RequestExecutionPipeline(settings, leaderView, commitLog, applier,
                replicationCoordinator, rpcService);
        this.rpcService.registerHandler(this);
    }

    /**
     * Starts the replica: catch up from reachable peers, adopt a live leader
     * if there is one, then begin monitoring. A replica that finds no leader
     * starts an election on the first monitor tick.
     */
    public synchronized void start() {
        if (running) {
            return;
        }
        log.info("{}: Starting replica with peers {} and latest commit {}", replicaId, peerIds,
                commitLog.latestId());
        rpcService.start();
        running = true;
        replicationCoordinator.pullFromPeers();
        discoverLeader();
        leaderMonitor.start();
    }

    /**
     * Asks every peer for its view of the leader and adopts the highest
     * replica that itself claims to lead
     */
    private void discoverLeader() {
        Map<Integer, CompletableFuture<Ack>> pending = new TreeMap<>();
        for (int peerId : peerIds) {
            pending.put(peerId, rpcService.sendHeartbeat(peerId, new HeartbeatRequest(replicaId))
                    .orTimeout(settings.getRpcTimeoutMs(), TimeUnit.MILLISECONDS)
                    .exceptionally(ex -> null));
        }
        Integer liveLeader = null;
        for (Map.Entry<Integer, CompletableFuture<Ack>> entry : pending.entrySet()) {
            Ack ack = entry.getValue().join();
            if (ack != null && entry.getKey().equals(ack.getLeaderId())) {
                liveLeader = entry.getKey();
            }
        }
        if (liveLeader == null) {
            log.info("{}: No live leader found", replicaId);
            return;
        }
        if (leaderView.adoptLeader(liveLeader)) {
            log.info("{}: Rejoining as follower of {}", replicaId, liveLeader);
            try {
                replicationCoordinator.pullFrom(liveLeader);
            } catch (ConsistencyViolationException e) {
                log.error("{}: Catch-up from leader {} halted: {}", replicaId, liveLeader, e.getMessage());
            }
        }
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        log.info("{}: Stopping replica", replicaId);
        running = false;
        leaderMonitor.stop();
        electionCoordinator.stop();
        rpcService.stop();
        leaderView.reset();
    }

    @Override
    public Object handle(ReplicaMessage message) {
        return switch (message.messageType()) {
            case ELECTION -> electionCoordinator.handleElection((ElectionRequest) message);
            case COORDINATOR -> electionCoordinator.handleCoordinator((CoordinatorRequest) message);
            case HEARTBEAT -> handleHeartbeat((HeartbeatRequest) message);
            case EXECUTE -> pipeline.handleExecute((ExecuteRequest) message);
            case GET_COMMITS -> replicationCoordinator.handleGetCommits((GetCommitsRequest) message);
            case REPLICATE -> replicationCoordinator.handleReplicate((ReplicateRequest) message);
        };
    }

    private Ack handleHeartbeat(HeartbeatRequest request) {
        log.trace("{}: Heartbeat from {}", replicaId, request.getSenderId());
        return new Ack(replicaId, true, leaderView.getLeaderId(), commitLog.latestId());
    }

    /**
     * @see RequestExecutionPipeline#execute(String, boolean)
     */
    public String execute(String command) {
        return pipeline.execute(command, false);
    }

    public String query(String query) {
        return pipeline.query(query);
    }

    public int getReplicaId() {
        return replicaId;
    }

    public List<Integer> getPeerIds() {
        return new ArrayList<>(peerIds);
    }

    public ReplicaRole getRole() {
        return leaderView.getRole();
    }

    public Integer getLeaderId() {
        return leaderView.getLeaderId();
    }

    public LeaderView getLeaderView() {
        return leaderView;
    }

    public CommitLog getCommitLog() {
        return commitLog;
    }

    public RequestExecutionPipeline getPipeline() {
        return pipeline;
    }

    public boolean isRunning() {
        return running;
    }
}
