package com.example.bully.model;

public enum MessageType {
    ELECTION,
    COORDINATOR,
    HEARTBEAT,
    EXECUTE,
    GET_COMMITS,
    REPLICATE
}
