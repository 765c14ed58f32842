package com.example.bully.networking.rpc;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import com.example.bully.exception.UnreachablePeerException;
import com.example.bully.model.Ack;
import com.example.bully.model.CoordinatorRequest;
import com.example.bully.model.ElectionRequest;
import com.example.bully.model.ExecuteRequest;
import com.example.bully.model.ExecuteResponse;
import com.example.bully.model.GetCommitsRequest;
import com.example.bully.model.GetCommitsResponse;
import com.example.bully.model.HeartbeatRequest;
import com.example.bully.model.ReplicaMessage;
import com.example.bully.model.ReplicateRequest;
import com.example.bully.networking.config.NetworkConfig;
import com.example.bully.rpc.ReplicaMessageHandler;
import com.example.bully.rpc.ReplicaRpcService;

import lombok.extern.slf4j.Slf4j;

/**
 * Replica RPCs as JSON over HTTP. Outgoing calls are POSTed to
 * {@code <peer url>/replica/<call>}; incoming calls arrive through
 * {@link com.example.bully.networking.http.ReplicaController} and are passed
 * to the registered handler.
 */
@Slf4j
public class HttpReplicaRpcService implements ReplicaRpcService {
    public static final String BASE_PATH = "/replica";

    private final RestTemplate restTemplate;
    private final NetworkConfig networkConfig;
    private final ExecutorService executor;
    private volatile ReplicaMessageHandler handler;
    private volatile boolean running = false;

    public HttpReplicaRpcService(NetworkConfig networkConfig) {
        this.networkConfig = networkConfig;
        this.restTemplate = networkConfig.createRestTemplate();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "http-rpc-worker");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public CompletableFuture<Ack> sendElection(int targetId, ElectionRequest request) {
        return post(targetId, "/election", request, Ack.class);
    }

    @Override
    public CompletableFuture<Ack> sendCoordinator(int targetId, CoordinatorRequest request) {
        return post(targetId, "/coordinator", request, Ack.class);
    }

    @Override
    public CompletableFuture<Ack> sendHeartbeat(int targetId, HeartbeatRequest request) {
        return post(targetId, "/heartbeat", request, Ack.class);
    }

    @Override
    public CompletableFuture<ExecuteResponse> sendExecute(int targetId, ExecuteRequest request) {
        return post(targetId, "/execute", request, ExecuteResponse.class);
    }

    @Override
    public CompletableFuture<GetCommitsResponse> sendGetCommits(int targetId, GetCommitsRequest request) {
        return post(targetId, "/get-commits", request, GetCommitsResponse.class);
    }

    @Override
    public CompletableFuture<Ack> sendReplicate(int targetId, ReplicateRequest request) {
        return post(targetId, "/replicate", request, Ack.class);
    }

    private <T> CompletableFuture<T> post(int targetId, String path, ReplicaMessage request, Class<T> responseType) {
        if (!running) {
            return CompletableFuture.failedFuture(new IllegalStateException("RPC service not started"));
        }
        return CompletableFuture.supplyAsync(() -> {
            String url = networkConfig.getReplicaUrl(targetId) + BASE_PATH + path;
            try {
                log.trace("Sending {} to {} at {}: {}", request.messageType(), targetId, url, request);
                T response = restTemplate.postForObject(url, request, responseType);
                if (response == null) {
                    throw new UnreachablePeerException("Replica " + targetId + " sent an empty response");
                }
                return response;
            } catch (ResourceAccessException e) {
                log.debug("Failed to send {} to {}: {}", request.messageType(), targetId, e.getMessage());
                throw new UnreachablePeerException(targetId, e);
            } catch (RestClientException e) {
                // a peer that is up but not serving replica calls counts as down
                log.warn("Error sending {} to {}: {}", request.messageType(), targetId, e.getMessage());
                throw new UnreachablePeerException(targetId, e);
            }
        }, executor);
    }

    @Override
    public void registerHandler(ReplicaMessageHandler handler) {
        this.handler = handler;
    }

    @Override
    public void start() {
        running = true;
        log.info("Http RPC service started");
    }

    @Override
    public void stop() {
        running = false;
        log.info("Http RPC service stopped");
    }

    /**
     * Releases the worker threads. The service cannot be restarted afterwards.
     */
    public void shutdown() {
        stop();
        executor.shutdownNow();
    }

    /**
     * Dispatches an incoming call to the local replica
     *
     * @throws IllegalStateException if the replica is stopped
     */
    public <T> T handle(ReplicaMessage message, Class<T> responseType) {
        ReplicaMessageHandler current = handler;
        if (!running || current == null) {
            throw new IllegalStateException("RPC service not ready to handle requests");
        }
        return responseType.cast(current.handle(message));
    }

    public boolean isRunning() {
        return running;
    }
}
