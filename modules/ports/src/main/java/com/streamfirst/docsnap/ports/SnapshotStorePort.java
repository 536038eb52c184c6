package com.streamfirst.docsnap.ports;

import com.streamfirst.docsnap.domain.DocumentId;
import com.streamfirst.docsnap.domain.Snapshot;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Port for the optional snapshot cache. Snapshots are derived data: any of them can be rebuilt
 * from the change log, so implementations may evict them freely.
 */
public interface SnapshotStorePort {

    /**
     * Looks up a snapshot of a document.
     *
     * @param documentId the document identifier
     * @param version the requested version
     * @param findClosest when true, return the snapshot with the highest version {@code <= version};
     *     when false, only an exact match
     * @return future completing with the snapshot, or empty if none matches (not an error)
     */
    CompletableFuture<Optional<Snapshot>> getSnapshot(
            DocumentId documentId, long version, boolean findClosest);

    /** Finds the closest snapshot at or before {@code version}. */
    default CompletableFuture<Optional<Snapshot>> findClosestSnapshot(
            DocumentId documentId, long version) {
        return getSnapshot(documentId, version, true);
    }

    /**
     * Persists a snapshot. Creating the (documentId, version) entry is atomic; saving an equivalent
     * snapshot for an existing entry succeeds and the last write wins.
     *
     * @param snapshot the snapshot to store
     * @return future completing with the stored snapshot
     */
    CompletableFuture<Snapshot> saveSnapshot(Snapshot snapshot);
}
