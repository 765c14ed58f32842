package com.example.bully.detector;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.example.bully.applier.RecordingApplier;
import com.example.bully.config.ReplicaSettings;
import com.example.bully.election.ElectionCoordinator;
import com.example.bully.exception.UnreachablePeerException;
import com.example.bully.log.PersistentCommitLog;
import com.example.bully.model.Ack;
import com.example.bully.model.HeartbeatRequest;
import com.example.bully.persistence.InMemoryPersistenceManager;
import com.example.bully.replication.ReplicationCoordinator;
import com.example.bully.rpc.ReplicaRpcService;
import com.example.bully.state.LeaderView;
import com.example.bully.state.ReplicaRole;
import com.example.bully.timer.HeartbeatTimer;

public class LeaderMonitorTest {
    private LeaderView leaderView;
    private ReplicaRpcService rpcService;
    private ElectionCoordinator electionCoordinator;
    private ReplicationCoordinator replicationCoordinator;
    private LeaderMonitor monitor;

    @BeforeEach
    public void setUp() throws IOException {
        ReplicaSettings settings = new ReplicaSettings(1, List.of(2, 3));
        settings.setFailureThreshold(2);
        settings.setRpcTimeoutMs(100);
        leaderView = new LeaderView(1);
        rpcService = mock(ReplicaRpcService.class);
        electionCoordinator = mock(ElectionCoordinator.class);
        replicationCoordinator = mock(ReplicationCoordinator.class);
        PersistentCommitLog commitLog = new PersistentCommitLog(new InMemoryPersistenceManager(),
                new RecordingApplier());
        monitor = new LeaderMonitor(settings, leaderView, commitLog, rpcService, mock(HeartbeatTimer.class),
                electionCoordinator, replicationCoordinator);
    }

    private void leaderAnswers(Ack ack) {
        when(rpcService.sendHeartbeat(eq(3), any(HeartbeatRequest.class)))
                .thenReturn(CompletableFuture.completedFuture(ack));
    }

    @Test
    public void testStartsElectionWithoutLeader() {
        monitor.probe();

        verify(electionCoordinator).triggerElection();
    }

    @Test
    public void testLeaderPresumedDeadAfterThreshold() {
        leaderView.adoptLeader(3);
        when(rpcService.sendHeartbeat(eq(3), any(HeartbeatRequest.class)))
                .thenReturn(CompletableFuture.failedFuture(new UnreachablePeerException(3, null)));

        monitor.probe();
        verify(electionCoordinator, never()).triggerElection();
        assertEquals(ReplicaRole.FOLLOWER, leaderView.getRole());

        monitor.probe();
        verify(electionCoordinator).triggerElection();
        assertEquals(ReplicaRole.UNKNOWN, leaderView.getRole());
    }

    @Test
    public void testSuccessfulHeartbeatResetsFailures() {
        leaderView.adoptLeader(3);
        when(rpcService.sendHeartbeat(eq(3), any(HeartbeatRequest.class)))
                .thenReturn(CompletableFuture.failedFuture(new UnreachablePeerException(3, null)))
                .thenReturn(CompletableFuture.completedFuture(new Ack(3, true, 3, 0)))
                .thenReturn(CompletableFuture.failedFuture(new UnreachablePeerException(3, null)));

        monitor.probe();
        monitor.probe();
        monitor.probe();

        verify(electionCoordinator, never()).triggerElection();
        assertEquals(3, leaderView.getLeaderId());
    }

    @Test
    public void testCatchesUpWhenBehindLeader() {
        leaderView.adoptLeader(3);
        leaderAnswers(new Ack(3, true, 3, 4));

        monitor.probe();

        verify(replicationCoordinator).pullFrom(3);
    }

    @Test
    public void testLeaderThatSteppedDownIsLost() {
        leaderView.adoptLeader(3);
        leaderAnswers(new Ack(3, true, null, 0));

        monitor.probe();

        assertEquals(ReplicaRole.UNKNOWN, leaderView.getRole());
        verify(electionCoordinator).triggerElection();
    }

    private void becomeLeader() {
        leaderView.beginElection();
        leaderView.becomeLeader();
    }

    @Test
    public void testLeaderStepsDownForHigherLeader() {
        becomeLeader();
        when(rpcService.sendHeartbeat(eq(2), any(HeartbeatRequest.class)))
                .thenReturn(CompletableFuture.completedFuture(new Ack(2, true, 1, 0)));
        leaderAnswers(new Ack(3, true, 3, 2));
        when(replicationCoordinator.yieldTo(3)).thenReturn(true);

        monitor.probe();

        verify(rpcService).sendHeartbeat(2, new HeartbeatRequest(1));
        verify(rpcService).sendHeartbeat(3, new HeartbeatRequest(1));
        verify(replicationCoordinator).yieldTo(3);
        verify(electionCoordinator, never()).triggerElection();
    }

    @Test
    public void testLeaderKeepsLeadingWhenHigherReplicasFollowIt() {
        becomeLeader();
        when(rpcService.sendHeartbeat(eq(2), any(HeartbeatRequest.class)))
                .thenReturn(CompletableFuture.failedFuture(new UnreachablePeerException(2, null)));
        leaderAnswers(new Ack(3, true, 1, 0));

        monitor.probe();

        verify(replicationCoordinator, never()).yieldTo(anyInt());
        assertEquals(ReplicaRole.LEADER, leaderView.getRole());
    }

    @Test
    public void testHighestLeaderProbesNobody() throws IOException {
        LeaderView highestView = new LeaderView(3);
        LeaderMonitor highestMonitor = new LeaderMonitor(new ReplicaSettings(3, List.of(1, 2)), highestView,
                new PersistentCommitLog(new InMemoryPersistenceManager(), new RecordingApplier()), rpcService,
                mock(HeartbeatTimer.class), electionCoordinator, replicationCoordinator);
        highestView.beginElection();
        highestView.becomeLeader();

        highestMonitor.probe();

        verify(rpcService, never()).sendHeartbeat(anyInt(), any(HeartbeatRequest.class));
        verify(electionCoordinator, never()).triggerElection();
    }
}
