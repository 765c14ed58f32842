package com.example.bully.node_runner;

import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.TestPropertySource;

@SpringBootTest
@TestPropertySource(properties = {
		"replica.id=7",
		"replica.storageDir=target/test-replica-context",
		"replica.heartbeatIntervalMs=100"
})
class NodeRunnerApplicationTests {

	@Autowired
	private ApplicationContext context;

	@Test
	void contextLoads() {
		assertNotNull(context, "Application context should load");
		assertTrue(context.containsBean("replicaNodeManager"), "ReplicaNodeManager bean should exist");
		assertTrue(context.containsBean("replicaNode"), "ReplicaNode bean should exist");
		assertTrue(context.containsBean("replicaController"), "Replica RPC endpoints should be registered");
		assertTrue(context.containsBean("KVStoreController"), "Client API should be registered");
	}

}
