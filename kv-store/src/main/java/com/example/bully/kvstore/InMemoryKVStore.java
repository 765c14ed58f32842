package com.example.bully.kvstore;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryKVStore implements KVStore {

    private final Map<String, String> store = new ConcurrentHashMap<>();

    @Override
    public KVStoreResult put(String key, String value) {
        if (key == null || value == null) {
            return KVStoreResult.failure("Key or value cannot be null", KVStoreOperation.PUT);
        }
        store.put(key, value);
        return KVStoreResult.success(KVStoreOperation.PUT);
    }

    @Override
    public KVStoreResult get(String key) {
        if (key == null) {
            return KVStoreResult.failure("Key cannot be null", KVStoreOperation.GET);
        }
        String value = store.get(key);
        if (value == null) {
            return KVStoreResult.failure("Key not found", KVStoreOperation.GET);
        }
        return KVStoreResult.success(value, KVStoreOperation.GET);
    }

    @Override
    public KVStoreResult delete(String key) {
        if (key == null) {
            return KVStoreResult.failure("Key cannot be null", KVStoreOperation.DELETE);
        }
        if (store.remove(key) != null) {
            return KVStoreResult.success(KVStoreOperation.DELETE);
        }
        return KVStoreResult.failure("Key not found", KVStoreOperation.DELETE);
    }

    @Override
    public KVStoreResult exists(String key) {
        if (key == null) {
            return KVStoreResult.failure("Key cannot be null", KVStoreOperation.EXISTS);
        }
        return KVStoreResult.success(String.valueOf(store.containsKey(key)), KVStoreOperation.EXISTS);
    }

    /**
     * @return a sorted copy, so snapshots of equal stores are equal strings
     */
    @Override
    public Map<String, String> getAllEntries() {
        return new TreeMap<>(store);
    }

    @Override
    public synchronized void replaceAll(Map<String, String> entries) {
        store.clear();
        store.putAll(entries);
    }
}
