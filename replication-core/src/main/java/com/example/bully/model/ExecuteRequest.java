package com.example.bully.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public final class ExecuteRequest implements ReplicaMessage {
    private String command;
    /**
     * Set when a follower relays a client command to its leader.
     * A forwarded command is never forwarded a second time.
     */
    private boolean forwarded;

    @Override
    public MessageType messageType() {
        return MessageType.EXECUTE;
    }
}
