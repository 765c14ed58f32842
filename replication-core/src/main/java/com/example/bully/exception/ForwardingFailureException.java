package com.example.bully.exception;

import com.example.bully.model.ErrorCode;

/**
 * A follower could not relay a client command to its leader
 */
public class ForwardingFailureException extends ReplicationException {

    public ForwardingFailureException(String message) {
        super(message, ErrorCode.FORWARDING_FAILURE, true);
    }

    public ForwardingFailureException(int leaderId, Throwable cause) {
        super("Failed to forward command to leader " + leaderId, cause, ErrorCode.FORWARDING_FAILURE, true);
    }
}
