package com.streamfirst.docsnap.domain;

/**
 * A snapshot was to be persisted but no snapshot store is configured. This signals a miswired
 * deployment, so it is thrown directly to the caller instead of failing a future.
 */
public class SnapshotStoreRequiredException extends DocumentSnapshotException {

    public SnapshotStoreRequiredException(String message) {
        super(message);
    }

    @Override
    public String errorCode() {
        return "SnapshotStoreRequiredError";
    }
}
