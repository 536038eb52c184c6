package com.streamfirst.docsnap.domain;

/**
 * Base class for failures raised while resolving or reconstructing document snapshots. The error
 * code is stable and can be matched by callers that relay errors across process boundaries.
 */
public abstract class DocumentSnapshotException extends RuntimeException {

    protected DocumentSnapshotException(String message) {
        super(message);
    }

    /** Stable, machine-readable error name. */
    public abstract String errorCode();

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + errorCode() + "): " + getMessage();
    }
}
