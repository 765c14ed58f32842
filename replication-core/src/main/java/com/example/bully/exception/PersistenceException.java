package com.example.bully.exception;

import com.example.bully.model.ErrorCode;

/**
 * Thrown when a commit and its state mutation could not be made durable.
 * Neither of them is visible afterwards.
 */
public class PersistenceException extends ReplicationException {

    public PersistenceException(String message) {
        super(message, ErrorCode.PERSISTENCE_FAILURE, false);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause, ErrorCode.PERSISTENCE_FAILURE, false);
    }
}
