package com.example.bully.model;

/**
 * Every request a replica can receive. Handlers switch over {@link #messageType()}
 * so that adding a message type breaks compilation until it is handled.
 */
public sealed interface ReplicaMessage
        permits ElectionRequest, CoordinatorRequest, HeartbeatRequest, ExecuteRequest, GetCommitsRequest,
        ReplicateRequest {

    MessageType messageType();
}
