package com.streamfirst.docsnap.ports;

import com.streamfirst.docsnap.domain.Change;
import com.streamfirst.docsnap.domain.DocumentId;

import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;

/**
 * Port for the append-only, per-document change log.
 *
 * <p>Implementations must answer a range query with a consistent, gap-free view of the changes
 * committed when the call started. Changes committed afterwards may or may not be included.
 */
public interface ChangeLogPort {

    /**
     * Fetches the changes of a document with {@code sinceVersion < version <= toVersion}.
     *
     * @param documentId the document identifier
     * @param sinceVersion exclusive lower bound; 0 starts at the first change
     * @param toVersion inclusive upper bound; empty means "through the latest change"
     * @return future completing with the changes in ascending version order
     */
    CompletableFuture<List<Change>> getChanges(
            DocumentId documentId, long sinceVersion, OptionalLong toVersion);

    /** Fetches the changes in {@code (sinceVersion, toVersion]}. */
    default CompletableFuture<List<Change>> getChanges(
            DocumentId documentId, long sinceVersion, long toVersion) {
        return getChanges(documentId, sinceVersion, OptionalLong.of(toVersion));
    }

    /** Fetches every change after {@code sinceVersion}. */
    default CompletableFuture<List<Change>> getChanges(DocumentId documentId, long sinceVersion) {
        return getChanges(documentId, sinceVersion, OptionalLong.empty());
    }
}
