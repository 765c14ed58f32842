package com.example.bully.state;

public enum ReplicaRole {
    UNKNOWN, // no known leader, initial state after every (re)start
    CANDIDATE,
    FOLLOWER,
    LEADER
}
