package com.example.bully.state;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import lombok.extern.slf4j.Slf4j;

/**
 * Role and current leader of one replica.
 *
 * Election, failure detection and the RPC handlers all race on this state,
 * so it is only exposed through atomic transitions. Each method holds the
 * lock for its own body and never across network calls.
 *
 * {@link #runAsLeader(Supplier)} additionally holds the lock around a local
 * append, so a leader cannot step down halfway through one. Lock order is
 * view before commit log; the log never calls back into the view.
 */
@Slf4j
public class LeaderView {
    private final int selfId;
    private final ReentrantLock lock = new ReentrantLock();
    private ReplicaRole role = ReplicaRole.UNKNOWN;
    private Integer leaderId = null;

    public LeaderView(int selfId) {
        this.selfId = selfId;
    }

    /**
     * UNKNOWN/FOLLOWER -> CANDIDATE
     *
     * @return false if an election is already running or this replica leads
     */
    public boolean beginElection() {
        lock.lock();
        try {
            if (role == ReplicaRole.CANDIDATE || role == ReplicaRole.LEADER) {
                return false;
            }
            transition(ReplicaRole.CANDIDATE, null);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * CANDIDATE -> FOLLOWER without a leader, after a higher replica answered
     * our election request. The leader is set by the coming announcement.
     */
    public boolean deferElection() {
        lock.lock();
        try {
            if (role != ReplicaRole.CANDIDATE) {
                return false;
            }
            transition(ReplicaRole.FOLLOWER, null);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * CANDIDATE -> LEADER
     *
     * @return false if a coordinator announcement arrived while the election
     *         was running
     */
    public boolean becomeLeader() {
        lock.lock();
        try {
            if (role != ReplicaRole.CANDIDATE) {
                return false;
            }
            transition(ReplicaRole.LEADER, selfId);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs a local action only while this replica leads. Every transition
     * waits for the action to finish.
     *
     * @return the action's result, or empty if this replica is not the leader
     */
    public <T> Optional<T> runAsLeader(Supplier<T> action) {
        lock.lock();
        try {
            if (role != ReplicaRole.LEADER) {
                return Optional.empty();
            }
            return Optional.of(action.get());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Adopt an announced leader. The highest announced id wins: an announcement
     * from a lower id than the leader we currently follow is stale and ignored,
     * and a leader or candidate only yields to a higher id.
     *
     * @return true if this replica now follows announcedLeaderId
     */
    public boolean adoptLeader(int announcedLeaderId) {
        lock.lock();
        try {
            if (announcedLeaderId == selfId) {
                return false;
            }
            switch (role) {
                case LEADER:
                case CANDIDATE:
                    if (announcedLeaderId < selfId) {
                        log.info("{}: Ignoring announcement from lower replica {} while {}", selfId,
                                announcedLeaderId, role);
                        return false;
                    }
                    break;
                case FOLLOWER:
                case UNKNOWN:
                    if (leaderId != null && leaderId > announcedLeaderId) {
                        log.info("{}: Ignoring stale announcement from {}, following {}", selfId,
                                announcedLeaderId, leaderId);
                        return false;
                    }
                    break;
                default:
                    throw new IllegalStateException("Unknown role: " + role);
            }
            if (role != ReplicaRole.FOLLOWER || leaderId == null || leaderId != announcedLeaderId) {
                transition(ReplicaRole.FOLLOWER, announcedLeaderId);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * FOLLOWER -> UNKNOWN when the failure detector gives up on the leader
     *
     * @return false if the leader changed in the meantime
     */
    public boolean markLeaderLost(int suspectedLeaderId) {
        lock.lock();
        try {
            if (role != ReplicaRole.FOLLOWER || leaderId == null || leaderId != suspectedLeaderId) {
                return false;
            }
            transition(ReplicaRole.UNKNOWN, null);
            return true;
        } finally {
            lock.unlock();
        }
    }

    public void reset() {
        lock.lock();
        try {
            transition(ReplicaRole.UNKNOWN, null);
        } finally {
            lock.unlock();
        }
    }

    public LeaderSnapshot snapshot() {
        lock.lock();
        try {
            return new LeaderSnapshot(role, leaderId);
        } finally {
            lock.unlock();
        }
    }

    public ReplicaRole getRole() {
        return snapshot().getRole();
    }

    public Integer getLeaderId() {
        return snapshot().getLeaderId();
    }

    public boolean isLeader() {
        return getRole() == ReplicaRole.LEADER;
    }

    public int getSelfId() {
        return selfId;
    }

    private void transition(ReplicaRole newRole, Integer newLeaderId) {
        if (role != newRole || !Objects.equals(leaderId, newLeaderId)) {
            log.info("{}: Transitioning from {} (leader {}) to {} (leader {})", selfId, role, leaderId, newRole,
                    newLeaderId);
        }
        role = newRole;
        leaderId = newLeaderId;
    }
}
