package com.example.bully.exception;

import com.example.bully.model.ErrorCode;

/**
 * Base exception for all replication failures
 */
public class ReplicationException extends RuntimeException {
    private final ErrorCode errorCode;
    private final boolean retryable;

    public ReplicationException(String message, ErrorCode errorCode, boolean retryable) {
        super(message);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }

    public ReplicationException(String message, Throwable cause, ErrorCode errorCode, boolean retryable) {
        super(message, cause);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * @return true if the client may safely send the same command again,
     *         possibly to another replica
     */
    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Rebuilds the exception a remote replica reported in an execute response
     */
    public static ReplicationException of(ErrorCode errorCode, String message) {
        return switch (errorCode) {
            case NO_LEADER -> new NoLeaderKnownException(message);
            case FORWARDING_FAILURE -> new ForwardingFailureException(message);
            case UNREACHABLE_PEER -> new UnreachablePeerException(message);
            case PERSISTENCE_FAILURE -> new PersistenceException(message);
            case CONSISTENCY_VIOLATION -> new ConsistencyViolationException(message);
            case QUORUM_TIMEOUT -> new QuorumTimeoutException(message);
            case INVALID_COMMAND -> new InvalidCommandException(message);
        };
    }
}
