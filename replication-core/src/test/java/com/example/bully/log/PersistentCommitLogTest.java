package com.example.bully.log;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.example.bully.applier.RecordingApplier;
import com.example.bully.exception.ConsistencyViolationException;
import com.example.bully.exception.PersistenceException;
import com.example.bully.model.Commit;
import com.example.bully.persistence.DurableState;
import com.example.bully.persistence.InMemoryPersistenceManager;

public class PersistentCommitLogTest {
    private InMemoryPersistenceManager persistenceManager;
    private RecordingApplier applier;
    private PersistentCommitLog commitLog;

    @BeforeEach
    public void setUp() throws IOException {
        persistenceManager = new InMemoryPersistenceManager();
        applier = new RecordingApplier();
        commitLog = new PersistentCommitLog(persistenceManager, applier);
    }

    @Nested
    @DisplayName("Append")
    class AppendTests {
        @Test
        @DisplayName("Should allocate sequential ids starting at 1")
        void testSequentialIds() {
            assertEquals(CommitLog.EMPTY_ID, commitLog.latestId());

            AppendResult first = commitLog.append("A");
            AppendResult second = commitLog.append("B");

            assertEquals(1, first.getCommit().getId());
            assertEquals(2, second.getCommit().getId());
            assertEquals("applied:B", second.getResult());
            assertEquals(2, commitLog.latestId());
            assertEquals(List.of("A", "B"), applier.getApplied());
        }

        @Test
        @DisplayName("Should persist commits together with the applier state")
        void testPersistsJointly() throws IOException {
            commitLog.append("A");

            DurableState saved = persistenceManager.load();
            assertEquals(List.of(new Commit(1, "A")), saved.getCommits());
            assertEquals("A", saved.getApplierSnapshot());
        }

        @Test
        @DisplayName("Should roll back the state mutation when the write fails")
        void testRollbackOnPersistenceFailure() {
            commitLog.append("A");
            persistenceManager.setFailSaves(true);

            assertThrows(PersistenceException.class, () -> commitLog.append("B"));

            assertEquals(1, commitLog.latestId());
            assertEquals(List.of("A"), applier.getApplied());
            assertTrue(commitLog.get(2).isEmpty());
        }

        @Test
        @DisplayName("Should not log a command the applier rejects")
        void testRejectedCommand() {
            assertThrows(IllegalArgumentException.class, () -> commitLog.append("FAIL now"));

            assertEquals(CommitLog.EMPTY_ID, commitLog.latestId());
            assertTrue(applier.getApplied().isEmpty());
        }
    }

    @Test
    public void testGetSince() {
        commitLog.append("A");
        commitLog.append("B");
        commitLog.append("C");

        assertEquals(3, commitLog.getSince(CommitLog.EMPTY_ID).size());
        List<Commit> since = commitLog.getSince(1);
        assertEquals(List.of(new Commit(2, "B"), new Commit(3, "C")), since);
        assertTrue(commitLog.getSince(3).isEmpty());
        assertTrue(commitLog.getSince(10).isEmpty());
    }

    @Test
    public void testRecoveryRestoresLogAndState() throws IOException {
        commitLog.append("A");
        commitLog.append("B");

        RecordingApplier restartedApplier = new RecordingApplier();
        PersistentCommitLog recovered = new PersistentCommitLog(persistenceManager, restartedApplier);

        assertEquals(2, recovered.latestId());
        assertEquals(List.of("A", "B"), restartedApplier.getApplied());
        assertEquals("B", recovered.get(2).get().getCommand());
    }

    @Test
    public void testCrashBeforeWriteLeavesNeitherCommitNorMutation() throws IOException {
        commitLog.append("A");
        persistenceManager.setFailSaves(true);
        assertThrows(PersistenceException.class, () -> commitLog.append("B"));

        // restart from whatever reached the durable store
        persistenceManager.setFailSaves(false);
        RecordingApplier restartedApplier = new RecordingApplier();
        PersistentCommitLog recovered = new PersistentCommitLog(persistenceManager, restartedApplier);

        assertEquals(1, recovered.latestId());
        assertEquals(List.of("A"), restartedApplier.getApplied());
    }

    @Test
    public void testRecoveryRejectsCorruptLog() throws IOException {
        persistenceManager.save(new DurableState(List.of(new Commit(1, "A"), new Commit(3, "C")), "A,C"));

        assertThrows(IOException.class, () -> new PersistentCommitLog(persistenceManager, new RecordingApplier()));
    }

    @Nested
    @DisplayName("Accept missing")
    class AcceptMissingTests {
        @Test
        @DisplayName("Should apply only commits that are not present yet")
        void testAppendsMissing() {
            commitLog.append("A");

            int added = commitLog.acceptMissing(List.of(new Commit(1, "A"), new Commit(2, "B"), new Commit(3, "C")));

            assertEquals(2, added);
            assertEquals(3, commitLog.latestId());
            assertEquals(List.of("A", "B", "C"), applier.getApplied());
        }

        @Test
        @DisplayName("Should be idempotent")
        void testIdempotent() {
            List<Commit> commits = List.of(new Commit(1, "A"), new Commit(2, "B"));
            commitLog.acceptMissing(commits);

            assertEquals(0, commitLog.acceptMissing(commits));
            assertEquals(List.of("A", "B"), applier.getApplied());
        }

        @Test
        @DisplayName("Should accept commits in any order")
        void testUnordered() {
            commitLog.acceptMissing(List.of(new Commit(2, "B"), new Commit(1, "A")));

            assertEquals(List.of("A", "B"), applier.getApplied());
        }

        @Test
        @DisplayName("Should stop at a gap")
        void testStopsAtGap() {
            int added = commitLog.acceptMissing(List.of(new Commit(1, "A"), new Commit(3, "C")));

            assertEquals(1, added);
            assertEquals(1, commitLog.latestId());
        }

        @Test
        @DisplayName("Should report divergence and halt further catch-up")
        void testConsistencyViolation() {
            commitLog.append("A");

            assertThrows(ConsistencyViolationException.class,
                    () -> commitLog.acceptMissing(List.of(new Commit(1, "X"), new Commit(2, "B"))));

            assertTrue(commitLog.isHalted());
            assertEquals("A", commitLog.get(1).get().getCommand());
            assertThrows(ConsistencyViolationException.class,
                    () -> commitLog.acceptMissing(List.of(new Commit(2, "B"))));
            assertEquals(1, commitLog.latestId());
        }

        @Test
        @DisplayName("Should stay halted after a restart")
        void testHaltSurvivesRestart() throws IOException {
            commitLog.append("A");
            assertThrows(ConsistencyViolationException.class,
                    () -> commitLog.acceptMissing(List.of(new Commit(1, "X"))));

            PersistentCommitLog recovered = new PersistentCommitLog(persistenceManager, new RecordingApplier());

            assertTrue(recovered.isHalted());
            assertEquals(List.of(new Commit(1, "A")), recovered.getSince(0));
            assertThrows(ConsistencyViolationException.class,
                    () -> recovered.acceptMissing(List.of(new Commit(2, "B"))));
            assertEquals(1, recovered.latestId());
        }

        @Test
        @DisplayName("Should persist the halt together with the commits accepted before it")
        void testHaltPersistedWithAcceptedPrefix() throws IOException {
            commitLog.append("A");

            assertThrows(ConsistencyViolationException.class,
                    () -> commitLog.acceptMissing(List.of(new Commit(2, "B"), new Commit(2, "Y"))));

            DurableState saved = persistenceManager.load();
            assertEquals(List.of(new Commit(1, "A"), new Commit(2, "B")), saved.getCommits());
            assertNotNull(saved.getHaltReason());
        }

        @Test
        @DisplayName("Should keep the valid prefix before a divergent commit")
        void testKeepsPrefixBeforeViolation() throws IOException {
            commitLog.append("A");

            assertThrows(ConsistencyViolationException.class,
                    () -> commitLog.acceptMissing(List.of(new Commit(2, "B"), new Commit(1, "X"))));

            // sorted first: 1 diverges before 2 is reached
            assertEquals(1, commitLog.latestId());
            assertFalse(persistenceManager.load().getCommits().size() > 1);
        }

        @Test
        @DisplayName("Should roll back the whole batch when the write fails")
        void testRollbackOnPersistenceFailure() {
            commitLog.append("A");
            persistenceManager.setFailSaves(true);

            assertThrows(PersistenceException.class,
                    () -> commitLog.acceptMissing(List.of(new Commit(2, "B"), new Commit(3, "C"))));

            assertEquals(1, commitLog.latestId());
            assertEquals(List.of("A"), applier.getApplied());
        }
    }
}
