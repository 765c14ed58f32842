package com.example.bully.exception;

import com.example.bully.model.ErrorCode;

/**
 * The state applier rejected the command. Nothing was committed, and sending
 * the same command again fails the same way.
 */
public class InvalidCommandException extends ReplicationException {

    public InvalidCommandException(String message) {
        super(message, ErrorCode.INVALID_COMMAND, false);
    }

    public InvalidCommandException(String message, Throwable cause) {
        super(message, cause, ErrorCode.INVALID_COMMAND, false);
    }
}
