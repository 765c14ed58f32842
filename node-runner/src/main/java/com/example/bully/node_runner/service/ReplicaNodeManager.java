package com.example.bully.node_runner.service;

import org.springframework.stereotype.Service;

import com.example.bully.node.ReplicaNode;
import com.example.bully.state.ReplicaRole;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

@Service
@Slf4j
public class ReplicaNodeManager {

    @Getter
    private final ReplicaNode replicaNode;

    public ReplicaNodeManager(ReplicaNode replicaNode) {
        this.replicaNode = replicaNode;
    }

    @PostConstruct
    public void start() {
        log.info("ReplicaNodeManager starting replica {}", replicaNode.getReplicaId());
        replicaNode.start();
    }

    @PreDestroy
    public void stop() {
        log.info("ReplicaNodeManager stopping replica {}", replicaNode.getReplicaId());
        replicaNode.stop();
    }

    public ReplicaRole getRole() {
        return replicaNode.getRole();
    }

    public Integer getLeaderId() {
        return replicaNode.getLeaderId();
    }

    public boolean isLeader() {
        return replicaNode.getRole() == ReplicaRole.LEADER;
    }
}
