package com.example.bully.state;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Consistent point-in-time copy of a {@link LeaderView}
 */
@Getter
@AllArgsConstructor
@ToString
public class LeaderSnapshot {
    private final ReplicaRole role;
    private final Integer leaderId;

    public boolean hasLeader() {
        return leaderId != null;
    }
}
