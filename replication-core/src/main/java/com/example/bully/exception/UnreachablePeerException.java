package com.example.bully.exception;

import com.example.bully.model.ErrorCode;

/**
 * A peer did not answer within the RPC timeout or refused the connection.
 * Means "that peer is down", never a consistency signal.
 */
public class UnreachablePeerException extends ReplicationException {

    public UnreachablePeerException(String message) {
        super(message, ErrorCode.UNREACHABLE_PEER, true);
    }

    public UnreachablePeerException(int peerId, Throwable cause) {
        super("Replica " + peerId + " is unreachable", cause, ErrorCode.UNREACHABLE_PEER, true);
    }
}
