package com.example.bully.kvstore;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of a KV command. Travels to the client as the JSON result of the
 * replicated command.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class KVStoreResult {
    private final boolean success;
    private final String value;
    private final String error;
    private final KVStoreOperation operation;

    @JsonCreator
    private KVStoreResult(@JsonProperty("success") boolean success, @JsonProperty("value") String value,
            @JsonProperty("error") String error, @JsonProperty("operation") KVStoreOperation operation) {
        this.success = success;
        this.value = value;
        this.error = error;
        this.operation = operation;
    }

    /**
     * Creates a successful result for operations that don't return a value
     * (PUT/DELETE)
     */
    public static KVStoreResult success(KVStoreOperation operation) {
        return new KVStoreResult(true, null, null, operation);
    }

    /**
     * Create a successful result with a return value (GET/EXISTS)
     */
    public static KVStoreResult success(String value, KVStoreOperation operation) {
        return new KVStoreResult(true, value, null, operation);
    }

    /**
     * Creates a failed result with an error message
     */
    public static KVStoreResult failure(String error, KVStoreOperation operation) {
        return new KVStoreResult(false, null, error, operation);
    }

    public boolean isSuccess() {
        return success;
    }

    public String getValue() {
        return value;
    }

    public String getError() {
        return error;
    }

    public KVStoreOperation getOperation() {
        return operation;
    }

    @Override
    public String toString() {
        return "KVStoreResult [success=" + success + ", value=" + value + ", error=" + error + ", operation="
                + operation + "]";
    }
}
