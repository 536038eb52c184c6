package com.streamfirst.docsnap.domain;

import lombok.NonNull;
import lombok.Value;
import lombok.With;

/**
 * Metadata pointer describing a document's current state: which schema it was created with and
 * the latest committed version.
 */
@Value
public class DocumentRecord {
    @NonNull DocumentId documentId;

    @NonNull String schemaName;

    /** Latest committed version; 0 for a document without changes */
    @With long version;

    public DocumentRecord(@NonNull DocumentId documentId, @NonNull String schemaName, long version) {
        if (version < 0) {
            throw new IllegalArgumentException("Document version must be >= 0, got " + version);
        }
        this.documentId = documentId;
        this.schemaName = schemaName;
        this.version = version;
    }
}
