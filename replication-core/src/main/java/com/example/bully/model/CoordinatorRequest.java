package com.example.bully.model;

import java.util.ArrayList;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public final class CoordinatorRequest implements ReplicaMessage {
    private int leaderId;
    private List<Commit> commitHistory = new ArrayList<>(); // full history of the new leader

    @Override
    public MessageType messageType() {
        return MessageType.COORDINATOR;
    }
}
