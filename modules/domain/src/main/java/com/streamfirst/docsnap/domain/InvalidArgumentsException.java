package com.streamfirst.docsnap.domain;

/**
 * The caller supplied insufficient or inconsistent identifying information, e.g. a missing document
 * id or a negative version.
 */
public class InvalidArgumentsException extends DocumentSnapshotException {

    public InvalidArgumentsException(String message) {
        super(message);
    }

    @Override
    public String errorCode() {
        return "InvalidArgumentsError";
    }
}
