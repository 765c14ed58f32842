package com.example.bully.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public final class GetCommitsRequest implements ReplicaMessage {
    private int requesterId;
    private long latestCommitId; // fetch all commits strictly after this one

    @Override
    public MessageType messageType() {
        return MessageType.GET_COMMITS;
    }
}
