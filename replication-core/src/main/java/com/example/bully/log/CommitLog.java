package com.example.bully.log;

import java.util.List;
import java.util.Optional;

import com.example.bully.model.Commit;

/**
 * Append-only, durable, strictly ordered sequence of commits.
 * Each append is applied to the state applier and persisted as one atomic unit.
 */
public interface CommitLog {
    /** Latest id of an empty log. */
    long EMPTY_ID = 0;

    /**
     * Allocates the next id, applies the command and persists both together
     *
     * @param command the command to append
     * @return the new commit and the applier's result
     * @throws com.example.bully.exception.PersistenceException if the write
     *                                                         could not complete;
     *                                                         nothing is visible
     *                                                         then
     */
    AppendResult append(String command);

    /**
     * Returns all commits with an id strictly greater than afterId
     *
     * @param afterId exclusive lower bound, {@link #EMPTY_ID} for the whole log
     * @return commits in ascending id order
     */
    List<Commit> getSince(long afterId);

    /**
     * @return the highest id present, or {@link #EMPTY_ID} if the log is empty
     */
    long latestId();

    Optional<Commit> get(long id);

    /**
     * Applies and appends every commit not yet present. Commits already present
     * must carry the same command.
     *
     * @param commits commits received from another replica
     * @return the number of commits appended
     * @throws com.example.bully.exception.ConsistencyViolationException on a
     *                                                                   divergent
     *                                                                   commit; the
     *                                                                   log refuses
     *                                                                   further
     *                                                                   catch-up
     *                                                                   afterwards
     */
    int acceptMissing(List<Commit> commits);

    /**
     * @return true once a consistency violation has been observed, also after
     *         a restart
     */
    boolean isHalted();
}
