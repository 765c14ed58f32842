package com.example.bully.kvstore.statemachine;

import java.util.Map;

import com.example.bully.applier.StateApplier;
import com.example.bully.kvstore.KVStore;
import com.example.bully.kvstore.KVStoreResult;
import com.example.bully.kvstore.command.KVCommand;
import com.example.bully.kvstore.util.JsonUtils;
import com.fasterxml.jackson.core.type.TypeReference;

import lombok.extern.slf4j.Slf4j;

/**
 * Applies serialized {@link KVCommand}s to a {@link KVStore}. Results are
 * {@link KVStoreResult}s as JSON; snapshots are the store content as a JSON
 * object.
 */
@Slf4j
public class KVStoreStateMachine implements StateApplier {
    private static final TypeReference<Map<String, String>> ENTRIES_TYPE = new TypeReference<>() {
    };

    private final KVStore kvStore;

    public KVStoreStateMachine(KVStore kvStore) {
        this.kvStore = kvStore;
    }

    /**
     * @throws IllegalArgumentException if the command is malformed or read-only;
     *                                  reads are served by {@link #query(String)}
     */
    @Override
    public String apply(String command) {
        KVCommand kvCommand = KVCommand.deserialize(command);
        if (kvCommand.isReadOnly()) {
            throw new IllegalArgumentException("Read-only command cannot be applied: " + command);
        }
        KVStoreResult result = kvCommand.apply(kvStore);
        log.debug("Applied {} -> {}", command, result);
        return JsonUtils.toJson(result);
    }

    @Override
    public String query(String query) {
        KVCommand kvCommand = KVCommand.deserialize(query);
        if (!kvCommand.isReadOnly()) {
            throw new IllegalArgumentException("Query must be read-only: " + query);
        }
        return JsonUtils.toJson(kvCommand.apply(kvStore));
    }

    @Override
    public String takeSnapshot() {
        return JsonUtils.toJson(kvStore.getAllEntries());
    }

    @Override
    public void restoreSnapshot(String snapshot) {
        if (snapshot == null || snapshot.isEmpty()) {
            kvStore.replaceAll(Map.of());
            return;
        }
        Map<String, String> entries = JsonUtils.fromJson(snapshot, ENTRIES_TYPE);
        kvStore.replaceAll(entries);
        log.debug("Restored {} entries from snapshot", entries.size());
    }

    public KVStore getKVStore() {
        return kvStore;
    }
}
