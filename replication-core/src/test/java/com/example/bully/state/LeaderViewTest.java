package com.example.bully.state;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

public class LeaderViewTest {
    private LeaderView view;

    @BeforeEach
    public void setUp() {
        view = new LeaderView(2);
    }

    @Test
    @DisplayName("Should start as UNKNOWN without a leader")
    void testInitialState() {
        assertEquals(ReplicaRole.UNKNOWN, view.getRole());
        assertNull(view.getLeaderId());
        assertFalse(view.snapshot().hasLeader());
    }

    @Nested
    @DisplayName("Election transitions")
    class ElectionTests {
        @Test
        void testWinElection() {
            assertTrue(view.beginElection());
            assertEquals(ReplicaRole.CANDIDATE, view.getRole());

            assertTrue(view.becomeLeader());
            assertTrue(view.isLeader());
            assertEquals(2, view.getLeaderId());
        }

        @Test
        void testOnlyOneElectionAtATime() {
            assertTrue(view.beginElection());
            assertFalse(view.beginElection());
        }

        @Test
        void testLeaderDoesNotStartElection() {
            view.beginElection();
            view.becomeLeader();

            assertFalse(view.beginElection());
        }

        @Test
        void testDeferElection() {
            view.beginElection();

            assertTrue(view.deferElection());
            assertEquals(ReplicaRole.FOLLOWER, view.getRole());
            assertNull(view.getLeaderId());
            assertFalse(view.becomeLeader());
        }

        @Test
        void testAnnouncementDuringElectionBlocksTakeover() {
            view.beginElection();
            assertTrue(view.adoptLeader(3));

            assertFalse(view.becomeLeader());
            assertEquals(3, view.getLeaderId());
        }

        @Test
        void testConcurrentElectionTriggersStartOneElection() throws InterruptedException {
            ExecutorService executor = Executors.newFixedThreadPool(8);
            CountDownLatch start = new CountDownLatch(1);
            AtomicInteger started = new AtomicInteger();
            for (int i = 0; i < 8; i++) {
                executor.execute(() -> {
                    try {
                        start.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return;
                    }
                    if (view.beginElection()) {
                        started.incrementAndGet();
                    }
                });
            }
            start.countDown();
            executor.shutdown();
            assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
            assertEquals(1, started.get());
        }
    }

    @Nested
    @DisplayName("Coordinator adoption")
    class AdoptionTests {
        @Test
        @DisplayName("Should adopt a higher leader from any role")
        void testAdoptHigherLeader() {
            view.beginElection();
            view.becomeLeader();

            assertTrue(view.adoptLeader(3));
            assertEquals(ReplicaRole.FOLLOWER, view.getRole());
            assertEquals(3, view.getLeaderId());
        }

        @Test
        @DisplayName("Should ignore a stale lower announcement after a higher one")
        void testIgnoreStaleLowerAnnouncement() {
            assertTrue(view.adoptLeader(3));

            assertFalse(view.adoptLeader(1));
            assertEquals(3, view.getLeaderId());
        }

        @Test
        @DisplayName("Should let a leader ignore a lower announcement")
        void testLeaderIgnoresLowerAnnouncement() {
            view.beginElection();
            view.becomeLeader();

            assertFalse(view.adoptLeader(1));
            assertTrue(view.isLeader());
        }

        @Test
        @DisplayName("Should follow a lower leader when none is known")
        void testUnknownAdoptsLowerLeader() {
            assertTrue(view.adoptLeader(1));
            assertEquals(1, view.getLeaderId());
        }

        @Test
        void testNeverAdoptsItself() {
            assertFalse(view.adoptLeader(2));
        }
    }

    @Test
    void testMarkLeaderLost() {
        view.adoptLeader(3);

        assertFalse(view.markLeaderLost(1));
        assertTrue(view.markLeaderLost(3));
        assertEquals(ReplicaRole.UNKNOWN, view.getRole());
        assertNull(view.getLeaderId());
        assertTrue(view.beginElection());
    }

    @Nested
    @DisplayName("Leader-only actions")
    class RunAsLeaderTests {
        @Test
        void testRefusedUnlessLeader() {
            assertEquals(Optional.empty(), view.runAsLeader(() -> "appended"));

            view.adoptLeader(3);
            assertEquals(Optional.empty(), view.runAsLeader(() -> "appended"));
        }

        @Test
        void testRunsWhileLeader() {
            view.beginElection();
            view.becomeLeader();

            assertEquals(Optional.of("appended"), view.runAsLeader(() -> "appended"));
        }

        @Test
        @Timeout(5)
        @DisplayName("Should hold a step-down until the running action finishes")
        void testStepDownWaitsForAction() throws Exception {
            view.beginElection();
            view.becomeLeader();
            CountDownLatch actionStarted = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            ExecutorService executor = Executors.newFixedThreadPool(2);
            try {
                Future<Optional<String>> action = executor.submit(() -> view.runAsLeader(() -> {
                    actionStarted.countDown();
                    try {
                        release.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return "appended";
                }));
                assertTrue(actionStarted.await(1, TimeUnit.SECONDS));

                Future<Boolean> stepDown = executor.submit(() -> view.adoptLeader(3));
                Thread.sleep(200);
                assertFalse(stepDown.isDone());

                release.countDown();
                assertEquals(Optional.of("appended"), action.get(1, TimeUnit.SECONDS));
                assertTrue(stepDown.get(1, TimeUnit.SECONDS));
                assertEquals(ReplicaRole.FOLLOWER, view.getRole());
                assertEquals(Optional.empty(), view.runAsLeader(() -> "late"));
            } finally {
                executor.shutdownNow();
            }
        }
    }
}
