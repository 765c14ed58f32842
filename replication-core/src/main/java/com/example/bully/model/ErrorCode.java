package com.example.bully.model;

public enum ErrorCode {
    NO_LEADER,
    FORWARDING_FAILURE,
    UNREACHABLE_PEER,
    PERSISTENCE_FAILURE,
    CONSISTENCY_VIOLATION,
    QUORUM_TIMEOUT,
    INVALID_COMMAND
}
