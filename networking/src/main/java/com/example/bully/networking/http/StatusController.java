package com.example.bully.networking.http;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.example.bully.kvstore.KVStore;
import com.example.bully.log.CommitLog;
import com.example.bully.model.Commit;
import com.example.bully.node.ReplicaNode;
import com.example.bully.state.LeaderSnapshot;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@RestController
@RequestMapping("/debug")
@RequiredArgsConstructor
@Slf4j
public class StatusController {
    private final ReplicaNode replicaNode;
    private final KVStore kvStore;

    @GetMapping("/state")
    public Map<String, Object> getState(@RequestParam(defaultValue = "0") long since) {
        Map<String, Object> state = new HashMap<>();
        state.put("replicaId", replicaNode.getReplicaId());
        state.put("peers", replicaNode.getPeerIds());
        state.put("running", replicaNode.isRunning());
        state.put("timestamp", System.currentTimeMillis());

        LeaderSnapshot leader = replicaNode.getLeaderView().snapshot();
        state.put("role", leader.getRole().name());
        state.put("leaderId", leader.getLeaderId());

        CommitLog commitLog = replicaNode.getCommitLog();
        List<Commit> commits = commitLog.getSince(since);
        Map<String, Object> logInfo = new HashMap<>();
        logInfo.put("latestCommitId", commitLog.latestId());
        logInfo.put("halted", commitLog.isHalted());
        logInfo.put("commits", commits);
        state.put("log", logInfo);

        Map<String, String> entries = kvStore.getAllEntries();
        Map<String, Object> kvInfo = new HashMap<>();
        kvInfo.put("keyValuePairs", entries);
        kvInfo.put("totalKeys", entries.size());
        state.put("kvState", kvInfo);

        log.trace("Debug state requested: {} commits after {}", commits.size(), since);
        return state;
    }
}
