package com.example.bully.replication;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import com.example.bully.config.ReplicaSettings;
import com.example.bully.exception.ConsistencyViolationException;
import com.example.bully.exception.QuorumTimeoutException;
import com.example.bully.log.CommitLog;
import com.example.bully.model.Ack;
import com.example.bully.model.Commit;
import com.example.bully.model.ElectionRequest;
import com.example.bully.model.GetCommitsRequest;
import com.example.bully.model.GetCommitsResponse;
import com.example.bully.model.ReplicateRequest;
import com.example.bully.rpc.ReplicaRpcService;
import com.example.bully.state.LeaderView;

import lombok.extern.slf4j.Slf4j;

/**
 * Moves commits between replicas.
 *
 * On the leader it fans a new commit out to every follower in parallel and
 * waits for a quorum. On every replica it fetches missing commits from a peer
 * and feeds them through {@link CommitLog#acceptMissing(List)}, which makes
 * every catch-up path idempotent.
 */
@Slf4j
public class ReplicationCoordinator {
    private static final int NO_REPLICA = Integer.MIN_VALUE;

    private final int selfId;
    private final List<Integer> peerIds;
    private final CommitLog commitLog;
    private final LeaderView leaderView;
    private final ReplicaRpcService rpcService;
    private final ReplicaSettings settings;

    public ReplicationCoordinator(ReplicaSettings settings, CommitLog commitLog, LeaderView leaderView,
            ReplicaRpcService rpcService) {
        this.selfId = settings.getReplicaId();
        this.peerIds = List.copyOf(settings.getPeerIds());
        this.commitLog = commitLog;
        this.leaderView = leaderView;
        this.rpcService = rpcService;
        this.settings = settings;
    }

    /**
     * Strict majority of the whole cluster, the leader included
     */
    public int quorumSize() {
        return settings.clusterSize() / 2 + 1;
    }

    /**
     * Sends a freshly appended commit to all followers and blocks until a
     * quorum holds it.
     *
     * If a follower rejects the commit because it follows a higher leader,
     * this replica yields to that leader once the wait is over.
     *
     * @throws QuorumTimeoutException if the quorum was not reached within the
     *                                replication timeout, or can no longer be
     *                                reached because too many followers failed
     *                                or a higher leader exists
     */
    public void replicate(Commit commit) {
        int quorum = quorumSize();
        AtomicInteger acknowledged = new AtomicInteger(1); // the leader holds it already
        if (quorum <= 1) {
            return;
        }
        AtomicInteger failed = new AtomicInteger();
        AtomicInteger higherLeader = new AtomicInteger(NO_REPLICA);
        int tolerableFailures = settings.clusterSize() - quorum;
        CompletableFuture<Boolean> quorumReached = new CompletableFuture<>();
        ReplicateRequest request = new ReplicateRequest(selfId, List.of(commit));

        for (int peerId : peerIds) {
            rpcService.sendReplicate(peerId, request)
                    .orTimeout(settings.getRpcTimeoutMs(), TimeUnit.MILLISECONDS)
                    .whenComplete((ack, ex) -> {
                        if (ex == null && ack != null && ack.isSuccess()) {
                            if (acknowledged.incrementAndGet() >= quorum) {
                                quorumReached.complete(true);
                            }
                            return;
                        }
                        if (ex != null) {
                            log.debug("{}: Replicating commit {} to {} failed: {}", selfId, commit.getId(), peerId,
                                    ex.toString());
                        } else {
                            log.warn("{}: Replica {} rejected commit {} (its leader {}, latest {})", selfId, peerId,
                                    commit.getId(), ack == null ? null : ack.getLeaderId(),
                                    ack == null ? null : ack.getLatestCommitId());
                            if (ack != null && ack.getLeaderId() != null && ack.getLeaderId() > selfId) {
                                higherLeader.accumulateAndGet(ack.getLeaderId(), Math::max);
                                quorumReached.complete(false);
                            }
                        }
                        if (failed.incrementAndGet() > tolerableFailures) {
                            quorumReached.complete(false);
                        }
                    });
        }

        boolean reached;
        try {
            reached = quorumReached.get(settings.getReplicationTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            reached = false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            reached = false;
        } catch (ExecutionException e) {
            reached = false;
        }
        if (higherLeader.get() != NO_REPLICA) {
            log.warn("{}: Replica {} leads, stepping down after commit {}", selfId, higherLeader.get(),
                    commit.getId());
            yieldTo(higherLeader.get());
        }
        if (!reached) {
            log.warn("{}: Commit {} missed quorum ({} of {})", selfId, commit.getId(), acknowledged.get(), quorum);
            throw new QuorumTimeoutException(commit.getId(), acknowledged.get(), quorum);
        }
        log.debug("{}: Commit {} replicated to quorum", selfId, commit.getId());
    }

    /**
     * Steps down in favour of a higher leader and catches up from it. The
     * leader is then asked to re-announce itself to this replica, which lets it
     * pull any commits only this replica holds.
     *
     * @return false if this replica did not switch to leaderId
     */
    public boolean yieldTo(int leaderId) {
        if (!leaderView.adoptLeader(leaderId)) {
            return false;
        }
        try {
            pullFrom(leaderId);
        } catch (ConsistencyViolationException e) {
            log.error("{}: Cannot catch up from leader {}: {}", selfId, leaderId, e.getMessage());
        }
        rpcService.sendElection(leaderId, new ElectionRequest(selfId))
                .orTimeout(settings.getRpcTimeoutMs(), TimeUnit.MILLISECONDS)
                .whenComplete((ack, ex) -> {
                    if (ex != null) {
                        log.debug("{}: Re-announcement request to {} failed: {}", selfId, leaderId, ex.toString());
                    }
                });
        return true;
    }

    /**
     * Follower side of {@link #replicate(Commit)}
     */
    public Ack handleReplicate(ReplicateRequest request) {
        int leaderId = request.getLeaderId();
        if (!leaderView.adoptLeader(leaderId)) {
            log.info("{}: Rejecting commits from {}, not our leader", selfId, leaderId);
            return new Ack(selfId, false, leaderView.getLeaderId(), commitLog.latestId());
        }
        List<Commit> commits = request.getCommits();
        if (commits == null || commits.isEmpty()) {
            return new Ack(selfId, true, leaderId, commitLog.latestId());
        }
        long firstId = commits.stream().mapToLong(Commit::getId).min().getAsLong();
        long lastId = commits.stream().mapToLong(Commit::getId).max().getAsLong();
        try {
            if (firstId > commitLog.latestId() + 1) {
                log.info("{}: Gap before commit {}, catching up from leader {}", selfId, firstId, leaderId);
                pullFrom(leaderId);
            }
            commitLog.acceptMissing(commits);
        } catch (ConsistencyViolationException e) {
            return new Ack(selfId, false, leaderId, commitLog.latestId());
        }
        long latest = commitLog.latestId();
        return new Ack(selfId, latest >= lastId, leaderId, latest);
    }

    /**
     * Catches up from the history attached to a coordinator announcement.
     *
     * @return false if this replica holds commits beyond the announced history
     *         or the history diverges from the local log; the local commits are
     *         kept in both cases
     */
    public boolean catchUpFromAnnouncement(int leaderId, List<Commit> history) {
        long announcedLatest = history == null || history.isEmpty() ? CommitLog.EMPTY_ID
                : history.stream().mapToLong(Commit::getId).max().getAsLong();
        try {
            int added = commitLog.acceptMissing(history);
            if (added > 0) {
                log.info("{}: Caught up {} commits from leader {}", selfId, added, leaderId);
            }
        } catch (ConsistencyViolationException e) {
            return false;
        }
        long latest = commitLog.latestId();
        if (latest > announcedLatest) {
            log.warn("{}: Local log (latest {}) is ahead of leader {} (latest {}), keeping local commits", selfId,
                    latest, leaderId, announcedLatest);
            return false;
        }
        return latest == announcedLatest;
    }

    /**
     * Leader side of the follower-ahead case: a follower answered the
     * announcement with more commits than the leader has
     */
    public void onCoordinatorAck(int peerId, Ack ack) {
        if (ack.isSuccess() || ack.getLatestCommitId() <= commitLog.latestId()) {
            return;
        }
        log.info("{}: Replica {} is ahead ({} > {}), pulling its commits", selfId, peerId, ack.getLatestCommitId(),
                commitLog.latestId());
        try {
            pullFrom(peerId);
        } catch (ConsistencyViolationException e) {
            log.error("{}: Cannot reconcile with replica {}: {}", selfId, peerId, e.getMessage());
        }
    }

    /**
     * Fetches and applies every commit a peer has beyond the local log
     *
     * @return number of commits added, 0 if the peer was unreachable
     * @throws ConsistencyViolationException if the peer's log diverges
     */
    public int pullFrom(int peerId) {
        GetCommitsResponse response = fetch(peerId).join();
        if (response == null) {
            return 0;
        }
        return commitLog.acceptMissing(response.getCommits());
    }

    /**
     * Asks every peer in parallel for the commits it has beyond the local log
     * and accepts them. Unreachable peers are skipped.
     *
     * @return number of commits added
     */
    public int pullFromPeers() {
        Map<Integer, CompletableFuture<GetCommitsResponse>> pending = new LinkedHashMap<>();
        for (int peerId : peerIds) {
            pending.put(peerId, fetch(peerId));
        }
        int added = 0;
        for (Map.Entry<Integer, CompletableFuture<GetCommitsResponse>> entry : pending.entrySet()) {
            GetCommitsResponse response = entry.getValue().join();
            if (response == null || response.getCommits() == null || response.getCommits().isEmpty()) {
                continue;
            }
            try {
                added += commitLog.acceptMissing(response.getCommits());
            } catch (ConsistencyViolationException e) {
                log.error("{}: Log of replica {} diverges from ours: {}", selfId, entry.getKey(), e.getMessage());
                break;
            }
        }
        if (added > 0) {
            log.info("{}: Pulled {} commits from peers, latest id is now {}", selfId, added, commitLog.latestId());
        }
        return added;
    }

    public GetCommitsResponse handleGetCommits(GetCommitsRequest request) {
        List<Commit> commits = new ArrayList<>(commitLog.getSince(request.getLatestCommitId()));
        log.debug("{}: Sending {} commits after {} to {}", selfId, commits.size(), request.getLatestCommitId(),
                request.getRequesterId());
        return new GetCommitsResponse(commits);
    }

    /**
     * @return a future that completes with null when the peer is unreachable
     */
    private CompletableFuture<GetCommitsResponse> fetch(int peerId) {
        GetCommitsRequest request = new GetCommitsRequest(selfId, commitLog.latestId());
        return rpcService.sendGetCommits(peerId, request)
                .orTimeout(settings.getRpcTimeoutMs(), TimeUnit.MILLISECONDS)
                .exceptionally(ex -> {
                    log.debug("{}: GetCommits from {} failed: {}", selfId, peerId, ex.toString());
                    return null;
                });
    }
}
