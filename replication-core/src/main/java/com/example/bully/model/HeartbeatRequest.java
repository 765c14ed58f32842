package com.example.bully.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public final class HeartbeatRequest implements ReplicaMessage {
    private int senderId;

    @Override
    public MessageType messageType() {
        return MessageType.HEARTBEAT;
    }
}
