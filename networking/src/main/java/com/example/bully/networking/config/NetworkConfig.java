package com.example.bully.networking.config;

import java.util.HashMap;
import java.util.Map;

import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

@Getter
@Setter
@Slf4j
@NoArgsConstructor
public class NetworkConfig {
    private int connectionTimeoutMs = 1000;
    private int readTimeoutMs = 3000;

    // replica id -> base URL
    private Map<Integer, String> replicaUrls = new HashMap<>();

    public String getReplicaUrl(int replicaId) {
        String url = replicaUrls.get(replicaId);
        if (url == null) {
            url = resolveReplicaUrl(replicaId);
            replicaUrls.put(replicaId, url);
            log.info("Auto-resolved URL for replica {}: {}", replicaId, url);
        }
        return url;
    }

    /**
     * Address used for a replica that has no configured URL
     */
    public String resolveReplicaUrl(int replicaId) {
        return "http://replica-" + replicaId + ":8080";
    }

    public void addReplicaUrl(int replicaId, String url) {
        replicaUrls.put(replicaId, stripTrailingSlash(url));
    }

    public RestTemplate createRestTemplate() {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(connectionTimeoutMs);
        requestFactory.setReadTimeout(readTimeoutMs);
        return new RestTemplate(requestFactory);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
