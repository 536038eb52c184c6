package com.streamfirst.docsnap.domain;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Value;

import java.util.List;

/**
 * Immutable record of one committed mutation. Belongs to exactly one document and occupies exactly
 * one version slot of that document's append-only change log.
 */
@Value
@EqualsAndHashCode(of = {"documentId", "version"})
public class Change {
    @NonNull DocumentId documentId;

    /** Version produced by this change; the first change of a document has version 1 */
    long version;

    /** Operations in the order they were recorded */
    @NonNull List<ObjectOperation> ops;

    public Change(@NonNull DocumentId documentId, long version, @NonNull List<ObjectOperation> ops) {
        if (version < 1) {
            throw new IllegalArgumentException("Change version must be >= 1, got " + version);
        }
        this.documentId = documentId;
        this.version = version;
        this.ops = List.copyOf(ops);
    }

    @Override
    public String toString() {
        return "Change{" + documentId + "@" + version + ", ops=" + ops.size() + '}';
    }
}
