package com.example.bully.exception;

import com.example.bully.model.ErrorCode;

public class NoLeaderKnownException extends ReplicationException {

    public NoLeaderKnownException(String message) {
        super(message, ErrorCode.NO_LEADER, true);
    }

    public NoLeaderKnownException(int replicaId) {
        this("Replica " + replicaId + " knows no leader, try again later");
    }
}
