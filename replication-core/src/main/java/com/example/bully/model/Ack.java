package com.example.bully.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response to Election, Coordinator, Heartbeat and Replicate calls.
 * Besides the acknowledgement itself it piggybacks the responder's view of
 * the leader and its latest commit id so that callers can detect lag.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Ack {
    private int replicaId;
    private boolean success;
    private Integer leaderId; // null when the responder knows no leader
    private long latestCommitId;
}
