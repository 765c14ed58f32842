package com.example.bully.networking.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

import org.junit.jupiter.api.Test;

public class NetworkConfigTest {

    @Test
    void testConfiguredUrlWins() {
        NetworkConfig config = new NetworkConfig();
        config.addReplicaUrl(2, "http://localhost:8082/");

        assertEquals("http://localhost:8082", config.getReplicaUrl(2));
    }

    @Test
    void testMissingUrlIsResolvedAndCached() {
        NetworkConfig config = new NetworkConfig();

        assertEquals("http://replica-5:8080", config.getReplicaUrl(5));
        assertEquals("http://replica-5:8080", config.getReplicaUrls().get(5));
    }

    @Test
    void testCreateRestTemplate() {
        NetworkConfig config = new NetworkConfig();
        config.setConnectionTimeoutMs(250);
        config.setReadTimeoutMs(500);

        assertNotNull(config.createRestTemplate());
    }
}
