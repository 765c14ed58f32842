package com.example.bully.log;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import com.example.bully.applier.StateApplier;
import com.example.bully.exception.ConsistencyViolationException;
import com.example.bully.exception.PersistenceException;
import com.example.bully.model.Commit;
import com.example.bully.persistence.DurableState;
import com.example.bully.persistence.PersistenceManager;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class PersistentCommitLog implements CommitLog {
    private final PersistenceManager persistenceManager;
    private final StateApplier applier;
    private final ReadWriteLock logLock = new ReentrantReadWriteLock();
    private final List<Commit> logCache; // commit with id n sits at position n - 1
    private volatile ConsistencyViolationException violation;

    public PersistentCommitLog(PersistenceManager persistenceManager, StateApplier applier) throws IOException {
        this.persistenceManager = persistenceManager;
        this.applier = applier;
        DurableState state = persistenceManager.load();
        this.logCache = new ArrayList<>(state.getCommits());
        verifyContiguous(logCache);
        applier.restoreSnapshot(state.getApplierSnapshot());
        if (state.getHaltReason() != null) {
            violation = new ConsistencyViolationException(state.getHaltReason());
            log.error("Recovered a halted commit log: {}", state.getHaltReason());
        }
        log.info("Recovered commit log with latest id {}", latestId());
    }

    private static void verifyContiguous(List<Commit> commits) throws IOException {
        for (int i = 0; i < commits.size(); i++) {
            if (commits.get(i).getId() != i + 1) {
                throw new IOException("Corrupt commit log: expected id " + (i + 1) + " but found "
                        + commits.get(i).getId());
            }
        }
    }

    @Override
    public AppendResult append(String command) {
        if (command == null) {
            throw new IllegalArgumentException("Command cannot be null");
        }
        logLock.writeLock().lock();
        try {
            String before = applier.takeSnapshot();
            Commit commit = new Commit(logCache.size() + 1, command);
            String result;
            try {
                result = applier.apply(command);
            } catch (RuntimeException e) {
                applier.restoreSnapshot(before);
                throw e;
            }
            logCache.add(commit);
            persistOrRollback(1, before);
            log.debug("Appended commit {}", commit);
            return new AppendResult(commit, result);
        } finally {
            logLock.writeLock().unlock();
        }
    }

    @Override
    public List<Commit> getSince(long afterId) {
        logLock.readLock().lock();
        try {
            int fromIndex = (int) Math.max(0, afterId);
            if (fromIndex >= logCache.size()) {
                return Collections.emptyList();
            }
            return new ArrayList<>(logCache.subList(fromIndex, logCache.size()));
        } finally {
            logLock.readLock().unlock();
        }
    }

    @Override
    public long latestId() {
        logLock.readLock().lock();
        try {
            return logCache.size();
        } finally {
            logLock.readLock().unlock();
        }
    }

    @Override
    public Optional<Commit> get(long id) {
        logLock.readLock().lock();
        try {
            if (id < 1 || id > logCache.size()) {
                return Optional.empty();
            }
            return Optional.of(logCache.get((int) id - 1));
        } finally {
            logLock.readLock().unlock();
        }
    }

    @Override
    public int acceptMissing(List<Commit> commits) {
        if (commits == null || commits.isEmpty()) {
            return 0;
        }
        List<Commit> sorted = new ArrayList<>(commits);
        sorted.sort(Comparator.comparingLong(Commit::getId));

        logLock.writeLock().lock();
        try {
            if (violation != null) {
                throw violation;
            }
            String before = null;
            int added = 0;
            ConsistencyViolationException detected = null;
            try {
                for (Commit incoming : sorted) {
                    long latest = logCache.size();
                    if (incoming.getId() < 1) {
                        throw new IllegalArgumentException("Invalid commit id: " + incoming.getId());
                    }
                    if (incoming.getId() <= latest) {
                        Commit existing = logCache.get((int) incoming.getId() - 1);
                        if (!existing.getCommand().equals(incoming.getCommand())) {
                            detected = new ConsistencyViolationException(incoming.getId(), existing.getCommand(),
                                    incoming.getCommand());
                            break;
                        }
                    } else if (incoming.getId() == latest + 1) {
                        if (before == null) {
                            before = applier.takeSnapshot();
                        }
                        applier.apply(incoming.getCommand());
                        logCache.add(new Commit(incoming.getId(), incoming.getCommand()));
                        added++;
                    } else {
                        log.warn("Gap before commit {}, local log ends at {}; stopping", incoming.getId(), latest);
                        break;
                    }
                }
            } catch (RuntimeException e) {
                rollback(added, before);
                throw e;
            }
            if (detected != null) {
                violation = detected;
                log.error("CONSISTENCY VIOLATION, halting catch-up: {}", detected.getMessage());
            }
            if (added > 0) {
                persistOrRollback(added, before);
                log.info("Accepted {} missing commits, latest id is now {}", added, logCache.size());
            } else if (detected != null) {
                persistHalt();
            }
            if (detected != null) {
                throw detected;
            }
            return added;
        } finally {
            logLock.writeLock().unlock();
        }
    }

    @Override
    public boolean isHalted() {
        return violation != null;
    }

    private void persistOrRollback(int added, String before) {
        try {
            persistenceManager.save(currentState());
        } catch (IOException e) {
            rollback(added, before);
            log.error("Failed to persist commit log, rolled back {} commits", added, e);
            throw new PersistenceException("Failed to persist commit log", e);
        }
    }

    private void persistHalt() {
        try {
            persistenceManager.save(currentState());
        } catch (IOException e) {
            log.error("Failed to persist the halt, it will not survive a restart", e);
        }
    }

    private DurableState currentState() {
        ConsistencyViolationException halt = violation;
        return new DurableState(new ArrayList<>(logCache), applier.takeSnapshot(),
                halt == null ? null : halt.getMessage());
    }

    private void rollback(int added, String before) {
        if (added > 0) {
            logCache.subList(logCache.size() - added, logCache.size()).clear();
        }
        if (before != null) {
            applier.restoreSnapshot(before);
        }
    }
}
