package com.example.bully.kvstore;

import java.util.Map;

public interface KVStore {
    /**
     * Stores a value with a specified key
     * If the key already exists, its value is updated
     *
     * @param key   the key to store the value with
     * @param value the value to store
     */
    KVStoreResult put(String key, String value);

    /**
     * Retrieves the value associated with specified key
     *
     * @param key The key to retrieve the value for
     * @return a failed result if the key doesn't exist
     */
    KVStoreResult get(String key);

    /**
     * Removes a key-value pair with specified key
     *
     * @param key the key to remove
     * @return a failed result if the key doesn't exist
     */
    KVStoreResult delete(String key);

    /**
     * Check if specified key exists in the store
     *
     * @param key the key to check
     * @return successful result with value "true" or "false"
     */
    KVStoreResult exists(String key);

    Map<String, String> getAllEntries();

    /**
     * Replaces the whole content of the store, used when restoring a snapshot
     */
    void replaceAll(Map<String, String> entries);
}
