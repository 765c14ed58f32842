package com.example.bully.exception;

import com.example.bully.model.ErrorCode;

/**
 * Two different commands were observed for the same commit id.
 * This is never repaired automatically.
 */
public class ConsistencyViolationException extends ReplicationException {

    public ConsistencyViolationException(String message) {
        super(message, ErrorCode.CONSISTENCY_VIOLATION, false);
    }

    public ConsistencyViolationException(long commitId, String existingCommand, String incomingCommand) {
        this("Divergent commands at commit " + commitId + ": existing=[" + existingCommand + "], incoming=["
                + incomingCommand + "]");
    }
}
