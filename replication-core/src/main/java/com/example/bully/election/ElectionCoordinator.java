package com.example.bully.election;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import com.example.bully.config.ReplicaSettings;
import com.example.bully.log.CommitLog;
import com.example.bully.model.Ack;
import com.example.bully.model.CoordinatorRequest;
import com.example.bully.model.ElectionRequest;
import com.example.bully.replication.ReplicationCoordinator;
import com.example.bully.rpc.ReplicaRpcService;
import com.example.bully.state.LeaderSnapshot;
import com.example.bully.state.LeaderView;
import com.example.bully.state.ReplicaRole;
import com.example.bully.timer.ElectionTimer;

import lombok.extern.slf4j.Slf4j;

/**
 * Bully election.
 *
 * A candidate asks every replica with a higher id to take over. If any of
 * them answers within the ack timeout the candidate steps back and arms the
 * election timer while it waits for the winner's announcement. If none
 * answers it pulls the freshest commits from its peers, becomes leader and
 * announces itself together with its full history.
 *
 * Elections run one at a time on a dedicated thread; network waits never
 * happen while the {@link LeaderView} lock is held.
 */
@Slf4j
public class ElectionCoordinator {
    private final int selfId;
    private final List<Integer> peerIds;
    private final List<Integer> higherPeerIds;
    private final LeaderView leaderView;
    private final CommitLog commitLog;
    private final ReplicaRpcService rpcService;
    private final ReplicationCoordinator replicationCoordinator;
    private final ElectionTimer electionTimer;
    private final ReplicaSettings settings;
    private final ExecutorService electionExecutor;

    public ElectionCoordinator(ReplicaSettings settings, LeaderView leaderView, CommitLog commitLog,
            ReplicaRpcService rpcService, ReplicationCoordinator replicationCoordinator,
            ElectionTimer electionTimer) {
        this.selfId = settings.getReplicaId();
        this.peerIds = List.copyOf(settings.getPeerIds());
        this.higherPeerIds = peerIds.stream().filter(id -> id > selfId).sorted().collect(Collectors.toList());
        this.leaderView = leaderView;
        this.commitLog = commitLog;
        this.rpcService = rpcService;
        this.replicationCoordinator = replicationCoordinator;
        this.electionTimer = electionTimer;
        this.settings = settings;
        this.electionExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "election-" + selfId);
            t.setDaemon(true);
            return t;
        });
        this.electionTimer.setTimeoutHandler(this::onCoordinatorWaitExpired);
    }

    /**
     * Queues an election. Does nothing if one is already running or this
     * replica leads.
     */
    public void triggerElection() {
        try {
            electionExecutor.execute(this::runElection);
        } catch (RejectedExecutionException e) {
            log.debug("{}: Election executor stopped, ignoring election trigger", selfId);
        }
    }

    void runElection() {
        if (!leaderView.beginElection()) {
            log.debug("{}: Election skipped, role is {}", selfId, leaderView.getRole());
            return;
        }
        electionTimer.stop();
        log.info("{}: Starting election, contacting higher replicas {}", selfId, higherPeerIds);

        boolean answered = awaitAnyAck();
        if (Thread.currentThread().isInterrupted()) {
            leaderView.reset();
            return;
        }
        if (answered) {
            if (leaderView.deferElection()) {
                log.info("{}: A higher replica answered, waiting for its announcement", selfId);
                electionTimer.start();
            }
            return;
        }

        int pulled = replicationCoordinator.pullFromPeers();
        if (pulled > 0) {
            log.info("{}: Pulled {} commits before taking over", selfId, pulled);
        }
        if (!leaderView.becomeLeader()) {
            log.info("{}: Election interrupted, now following {}", selfId, leaderView.getLeaderId());
            return;
        }
        log.info("{}: Won election with latest commit {}, announcing", selfId, commitLog.latestId());
        announce();
    }

    /**
     * @return true if at least one higher replica acknowledged within the
     *         election ack timeout
     */
    private boolean awaitAnyAck() {
        if (higherPeerIds.isEmpty()) {
            return false;
        }
        CompletableFuture<Boolean> anyAck = new CompletableFuture<>();
        AtomicInteger pending = new AtomicInteger(higherPeerIds.size());
        ElectionRequest request = new ElectionRequest(selfId);
        for (int peerId : higherPeerIds) {
            rpcService.sendElection(peerId, request)
                    .orTimeout(settings.getRpcTimeoutMs(), TimeUnit.MILLISECONDS)
                    .whenComplete((ack, ex) -> {
                        if (ex == null && ack != null && ack.isSuccess()) {
                            log.debug("{}: Replica {} answered election", selfId, peerId);
                            anyAck.complete(true);
                        } else if (ex != null) {
                            log.debug("{}: Election request to {} failed: {}", selfId, peerId, ex.toString());
                        }
                        if (pending.decrementAndGet() == 0) {
                            anyAck.complete(false);
                        }
                    });
        }
        try {
            return anyAck.get(settings.getElectionAckTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException | ExecutionException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Broadcasts the coordinator announcement to every peer without waiting
     */
    public void announce() {
        for (int peerId : peerIds) {
            announceTo(peerId);
        }
    }

    public void announceTo(int peerId) {
        CoordinatorRequest request = new CoordinatorRequest(selfId, commitLog.getSince(CommitLog.EMPTY_ID));
        rpcService.sendCoordinator(peerId, request)
                .orTimeout(settings.getRpcTimeoutMs(), TimeUnit.MILLISECONDS)
                .whenComplete((ack, ex) -> {
                    if (ex != null) {
                        log.debug("{}: Announcement to {} failed: {}", selfId, peerId, ex.toString());
                        return;
                    }
                    onAnnouncementAck(peerId, ack);
                });
    }

    private void onAnnouncementAck(int peerId, Ack ack) {
        Integer reportedLeader = ack.getLeaderId();
        if (!ack.isSuccess() && reportedLeader != null && reportedLeader > selfId) {
            log.info("{}: Replica {} follows higher leader {}, yielding", selfId, peerId, reportedLeader);
            replicationCoordinator.yieldTo(reportedLeader);
            return;
        }
        replicationCoordinator.onCoordinatorAck(peerId, ack);
    }

    public Ack handleElection(ElectionRequest request) {
        int candidateId = request.getCandidateId();
        LeaderSnapshot snapshot = leaderView.snapshot();
        Ack ack = new Ack(selfId, true, snapshot.getLeaderId(), commitLog.latestId());
        if (candidateId >= selfId) {
            log.warn("{}: Unexpected election request from {}", selfId, candidateId);
            return ack;
        }
        if (snapshot.getRole() == ReplicaRole.LEADER) {
            log.info("{}: Election request from {}, re-announcing leadership", selfId, candidateId);
            announceTo(candidateId);
        } else if (snapshot.getRole() != ReplicaRole.CANDIDATE) {
            log.info("{}: Election request from {}, starting own election", selfId, candidateId);
            triggerElection();
        }
        return ack;
    }

    public Ack handleCoordinator(CoordinatorRequest request) {
        int leaderId = request.getLeaderId();
        if (!leaderView.adoptLeader(leaderId)) {
            return new Ack(selfId, false, leaderView.getLeaderId(), commitLog.latestId());
        }
        electionTimer.stop();
        log.info("{}: Adopted leader {}", selfId, leaderId);
        boolean inSync = replicationCoordinator.catchUpFromAnnouncement(leaderId, request.getCommitHistory());
        return new Ack(selfId, inSync, leaderId, commitLog.latestId());
    }

    /**
     * The replica that answered our election never announced itself
     */
    private void onCoordinatorWaitExpired() {
        LeaderSnapshot snapshot = leaderView.snapshot();
        if (snapshot.hasLeader() || snapshot.getRole() == ReplicaRole.CANDIDATE
                || snapshot.getRole() == ReplicaRole.LEADER) {
            return;
        }
        log.warn("{}: No coordinator announcement received, restarting election", selfId);
        triggerElection();
    }

    public void stop() {
        electionTimer.shutdown();
        electionExecutor.shutdownNow();
    }
}
