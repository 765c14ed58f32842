package com.example.bully.kvstore.command;

import com.example.bully.kvstore.KVStore;
import com.example.bully.kvstore.KVStoreOperation;
import com.example.bully.kvstore.KVStoreResult;

/**
 * Base interface for all KV store commands
 * Commands represent operations that can be applied to the KV store
 * and are stored in the commit log in their serialized form
 */
public interface KVCommand {

    KVStoreResult apply(KVStore store);

    String serialize();

    KVStoreOperation getOperation();

    String getKey();

    default boolean isReadOnly() {
        return getOperation().isReadOnly();
    }

    /**
     * Deserializes a command from its string representation
     * Format: OPERATION|KEY|VALUE (for PUT, the value may contain '|')
     * Format: OPERATION|KEY (for GET, DELETE, EXISTS)
     */
    static KVCommand deserialize(String serialized) {
        if (serialized == null) {
            throw new IllegalArgumentException("Command cannot be null");
        }
        String[] parts = serialized.split("\\|", 3);
        if (parts.length < 2 || parts[1].isEmpty()) {
            throw new IllegalArgumentException("Invalid command format: " + serialized);
        }
        KVStoreOperation operation;
        try {
            operation = KVStoreOperation.valueOf(parts[0]);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid operation type: " + parts[0]);
        }
        String key = parts[1];
        return switch (operation) {
            case PUT -> {
                if (parts.length != 3) {
                    throw new IllegalArgumentException("PUT command requires key and value");
                }
                yield new PutCommand(key, parts[2]);
            }
            case GET -> new GetCommand(key);
            case DELETE -> new DeleteCommand(key);
            case EXISTS -> new ExistsCommand(key);
        };
    }

    static void validateKey(String key) {
        if (key == null || key.isEmpty() || key.contains("|")) {
            throw new IllegalArgumentException("Key must be non-empty and must not contain '|'");
        }
    }
}
