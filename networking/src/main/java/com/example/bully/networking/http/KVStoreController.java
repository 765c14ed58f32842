package com.example.bully.networking.http;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.example.bully.kvstore.KVStoreResult;
import com.example.bully.kvstore.command.DeleteCommand;
import com.example.bully.kvstore.command.ExistsCommand;
import com.example.bully.kvstore.command.GetCommand;
import com.example.bully.kvstore.command.KVCommand;
import com.example.bully.kvstore.command.PutCommand;
import com.example.bully.kvstore.util.JsonUtils;
import com.example.bully.node.ReplicaNode;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Client API. Writes may be sent to any replica: a follower forwards them to
 * the leader. Reads are answered from the local store and may be stale on a
 * lagging follower.
 */
@RestController
@RequestMapping("/api/v1/kv")
@RequiredArgsConstructor
@Slf4j
public class KVStoreController {
    private final ReplicaNode replicaNode;

    @PutMapping("/{key}")
    public ResponseEntity<KVStoreResult> put(@PathVariable String key, @RequestBody String value) {
        log.debug("Received PUT request - key: {}, value: {}", key, value);
        return execute(new PutCommand(key, value));
    }

    @DeleteMapping("/{key}")
    public ResponseEntity<KVStoreResult> delete(@PathVariable String key) {
        log.debug("Received DELETE request - key: {}", key);
        return execute(new DeleteCommand(key));
    }

    @GetMapping("/{key}")
    public ResponseEntity<KVStoreResult> get(@PathVariable String key) {
        log.debug("Received GET request - key: {}", key);
        return query(new GetCommand(key));
    }

    @GetMapping("/{key}/exists")
    public ResponseEntity<KVStoreResult> exists(@PathVariable String key) {
        return query(new ExistsCommand(key));
    }

    @GetMapping("/health")
    public ResponseEntity<HealthStatus> healthCheck() {
        HealthStatus status = new HealthStatus("OK", replicaNode.getReplicaId(), replicaNode.getRole().name(),
                replicaNode.getLeaderId());
        return ResponseEntity.ok(status);
    }

    private ResponseEntity<KVStoreResult> execute(KVCommand command) {
        String result = replicaNode.execute(command.serialize());
        return toResponse(JsonUtils.fromJson(result, KVStoreResult.class));
    }

    private ResponseEntity<KVStoreResult> query(KVCommand command) {
        String result = replicaNode.query(command.serialize());
        return toResponse(JsonUtils.fromJson(result, KVStoreResult.class));
    }

    private static ResponseEntity<KVStoreResult> toResponse(KVStoreResult result) {
        if (result.isSuccess()) {
            return ResponseEntity.ok(result);
        }
        // the only failure a well-formed command can produce is a missing key
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(result);
    }

    public static class HealthStatus {
        private final String status;
        private final int replicaId;
        private final String role;
        private final Integer leaderId;

        public HealthStatus(String status, int replicaId, String role, Integer leaderId) {
            this.status = status;
            this.replicaId = replicaId;
            this.role = role;
            this.leaderId = leaderId;
        }

        public String getStatus() {
            return status;
        }

        public int getReplicaId() {
            return replicaId;
        }

        public String getRole() {
            return role;
        }

        public Integer getLeaderId() {
            return leaderId;
        }
    }
}
