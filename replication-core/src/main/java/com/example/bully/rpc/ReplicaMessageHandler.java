package com.example.bully.rpc;

import com.example.bully.model.ReplicaMessage;

/**
 * Receives every inbound replica message. The returned object is the
 * response for the message's type: {@code Ack}, {@code ExecuteResponse} or
 * {@code GetCommitsResponse}.
 */
@FunctionalInterface
public interface ReplicaMessageHandler {
    Object handle(ReplicaMessage message);
}
