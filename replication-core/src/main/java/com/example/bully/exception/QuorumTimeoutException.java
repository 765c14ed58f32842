package com.example.bully.exception;

import com.example.bully.model.ErrorCode;

/**
 * The leader committed the command locally but a quorum of replicas did not
 * acknowledge it in time. The outcome is uncertain for the client, so the
 * command must not be blindly retried.
 */
public class QuorumTimeoutException extends ReplicationException {

    public QuorumTimeoutException(String message) {
        super(message, ErrorCode.QUORUM_TIMEOUT, false);
    }

    public QuorumTimeoutException(long commitId, int acknowledged, int quorum) {
        this("Commit " + commitId + " acknowledged by " + acknowledged + " of " + quorum
                + " required replicas before timeout");
    }
}
