package com.streamfirst.docsnap.domain;

import lombok.NonNull;
import lombok.Value;

/**
 * Fully materialized document export at a specific version. Snapshots are a cache derived from the
 * change log and never a source of truth; once stored they are never edited.
 */
@Value
public class Snapshot {
    @NonNull DocumentId documentId;

    long version;

    /** Codec export of the document at {@link #version} */
    @NonNull String data;

    public Snapshot(@NonNull DocumentId documentId, long version, @NonNull String data) {
        if (version < 0) {
            throw new IllegalArgumentException("Snapshot version must be >= 0, got " + version);
        }
        this.documentId = documentId;
        this.version = version;
        this.data = data;
    }

    @Override
    public String toString() {
        return "Snapshot{" + documentId + "@" + version + ", " + data.length() + " chars}";
    }
}
