package com.example.bully.model;

import java.util.ArrayList;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public final class ReplicateRequest implements ReplicaMessage {
    private int leaderId;
    private List<Commit> commits = new ArrayList<>();

    @Override
    public MessageType messageType() {
        return MessageType.REPLICATE;
    }
}
