package com.example.bully.kvstore;

public enum KVStoreOperation {
    PUT(false),
    GET(true),
    DELETE(false),
    EXISTS(true);

    private final boolean readOnly;

    KVStoreOperation(boolean readOnly) {
        this.readOnly = readOnly;
    }

    /**
     * @return true if the operation never changes the store and can be served
     *         without going through the commit log
     */
    public boolean isReadOnly() {
        return readOnly;
    }
}
