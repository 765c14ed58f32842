package com.example.bully.node_runner;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.context.TestPropertySource;

import com.example.bully.kvstore.KVStore;
import com.example.bully.model.Ack;
import com.example.bully.model.HeartbeatRequest;
import com.example.bully.node.ReplicaNode;
import com.example.bully.node_runner.service.ReplicaNodeManager;
import com.example.bully.state.ReplicaRole;

/**
 * A single replica has no peers to ask, so it elects itself and serves the
 * whole API on its own
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@TestPropertySource(properties = {
        "replica.id=1",
        "replica.heartbeatIntervalMs=100",
        "replica.coordinatorWaitMs=300",
        "replica.coordinatorWaitVarianceMs=100",
        "logging.level.com.example.bully=DEBUG"
})
public class NodeRunnerIntegrationTest {

    @Autowired
    private ReplicaNodeManager replicaNodeManager;

    @Autowired
    private KVStore kvStore;

    @Autowired
    private TestRestTemplate restTemplate;

    @DynamicPropertySource
    static void storage(DynamicPropertyRegistry registry) throws IOException {
        Path storageDir = Files.createTempDirectory("replica-it-");
        registry.add("replica.storageDir", storageDir::toString);
    }

    private void awaitLeadership() {
        await().atMost(Duration.ofSeconds(5))
                .until(() -> replicaNodeManager.getRole() == ReplicaRole.LEADER);
    }

    @Test
    public void testShouldStartupAndElectItself() {
        ReplicaNode replicaNode = replicaNodeManager.getReplicaNode();
        assertNotNull(replicaNode);
        assertEquals(1, replicaNode.getReplicaId());

        awaitLeadership();

        ResponseEntity<String> response = restTemplate.getForEntity("/api/v1/kv/health", String.class);
        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertTrue(response.getBody().contains("LEADER"));
    }

    @Test
    public void testPutThenGetThroughHttp() {
        awaitLeadership();

        ResponseEntity<String> put = restTemplate.exchange("/api/v1/kv/colour", HttpMethod.PUT,
                new HttpEntity<>("blue"), String.class);
        assertEquals(HttpStatus.OK, put.getStatusCode());
        assertEquals("blue", kvStore.getAllEntries().get("colour"));

        ResponseEntity<String> get = restTemplate.getForEntity("/api/v1/kv/colour", String.class);
        assertEquals(HttpStatus.OK, get.getStatusCode());
        assertTrue(get.getBody().contains("blue"));

        ResponseEntity<String> missing = restTemplate.getForEntity("/api/v1/kv/no-such-key", String.class);
        assertEquals(HttpStatus.NOT_FOUND, missing.getStatusCode());
    }

    @Test
    public void testReplicaEndpointAnswersHeartbeat() {
        awaitLeadership();

        Ack ack = restTemplate.postForObject("/replica/heartbeat", new HeartbeatRequest(2), Ack.class);
        assertNotNull(ack);
        assertTrue(ack.isSuccess());
        assertEquals(1, ack.getReplicaId());
        assertEquals(1, ack.getLeaderId());
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testDebugStateShowsCommits() {
        awaitLeadership();
        restTemplate.exchange("/api/v1/kv/debugged", HttpMethod.PUT, new HttpEntity<>("yes"), String.class);

        Map<String, Object> state = restTemplate.getForObject("/debug/state", Map.class);
        assertEquals("LEADER", state.get("role"));
        Map<String, Object> logInfo = (Map<String, Object>) state.get("log");
        assertTrue(((Number) logInfo.get("latestCommitId")).longValue() >= 1);
    }
}
