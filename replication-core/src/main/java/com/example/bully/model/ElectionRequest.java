package com.example.bully.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public final class ElectionRequest implements ReplicaMessage {
    private int candidateId;

    @Override
    public MessageType messageType() {
        return MessageType.ELECTION;
    }
}
