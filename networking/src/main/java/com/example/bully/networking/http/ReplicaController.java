package com.example.bully.networking.http;

import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.example.bully.model.Ack;
import com.example.bully.model.CoordinatorRequest;
import com.example.bully.model.ElectionRequest;
import com.example.bully.model.ExecuteRequest;
import com.example.bully.model.ExecuteResponse;
import com.example.bully.model.GetCommitsRequest;
import com.example.bully.model.GetCommitsResponse;
import com.example.bully.model.HeartbeatRequest;
import com.example.bully.model.ReplicateRequest;
import com.example.bully.networking.rpc.HttpReplicaRpcService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@RestController
@RequestMapping(HttpReplicaRpcService.BASE_PATH)
@RequiredArgsConstructor
@Slf4j
public class ReplicaController {
    private final HttpReplicaRpcService rpcService;

    @PostMapping("/election")
    public Ack election(@RequestBody ElectionRequest request) {
        log.debug("Received Election request: {}", request);
        return rpcService.handle(request, Ack.class);
    }

    @PostMapping("/coordinator")
    public Ack coordinator(@RequestBody CoordinatorRequest request) {
        log.debug("Received Coordinator announcement from {} with {} commits", request.getLeaderId(),
                request.getCommitHistory().size());
        return rpcService.handle(request, Ack.class);
    }

    @PostMapping("/heartbeat")
    public Ack heartbeat(@RequestBody HeartbeatRequest request) {
        return rpcService.handle(request, Ack.class);
    }

    @PostMapping("/execute")
    public ExecuteResponse execute(@RequestBody ExecuteRequest request) {
        log.debug("Received Execute request: {}", request);
        ExecuteResponse response = rpcService.handle(request, ExecuteResponse.class);
        log.debug("Sending Execute response: {}", response);
        return response;
    }

    @PostMapping("/get-commits")
    public GetCommitsResponse getCommits(@RequestBody GetCommitsRequest request) {
        log.debug("Received GetCommits request: {}", request);
        return rpcService.handle(request, GetCommitsResponse.class);
    }

    @PostMapping("/replicate")
    public Ack replicate(@RequestBody ReplicateRequest request) {
        log.debug("Received Replicate request from {} with {} commits", request.getLeaderId(),
                request.getCommits().size());
        return rpcService.handle(request, Ack.class);
    }
}
