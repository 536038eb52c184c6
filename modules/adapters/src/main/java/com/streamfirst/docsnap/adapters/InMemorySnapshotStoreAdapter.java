package com.streamfirst.docsnap.adapters;

import com.streamfirst.docsnap.domain.DocumentId;
import com.streamfirst.docsnap.domain.Snapshot;
import com.streamfirst.docsnap.ports.SnapshotStorePort;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * In-memory implementation of SnapshotStorePort. Snapshots are kept per document in a sorted map
 * so the closest-at-or-before lookup is a floor query.
 */
@Slf4j
public class InMemorySnapshotStoreAdapter implements SnapshotStorePort {

    private final Map<DocumentId, NavigableMap<Long, Snapshot>> snapshots =
            new ConcurrentHashMap<>();

    @Override
    public CompletableFuture<Optional<Snapshot>> getSnapshot(
            DocumentId documentId, long version, boolean findClosest) {
        NavigableMap<Long, Snapshot> versions = snapshots.get(documentId);
        if (versions == null) {
            return CompletableFuture.completedFuture(Optional.empty());
        }

        Optional<Snapshot> result =
                findClosest
                        ? Optional.ofNullable(versions.floorEntry(version)).map(Map.Entry::getValue)
                        : Optional.ofNullable(versions.get(version));
        log.debug(
                "Snapshot lookup for {}@{} (closest={}): {}",
                documentId,
                version,
                findClosest,
                result.map(s -> "found version " + s.getVersion()).orElse("none"));
        return CompletableFuture.completedFuture(result);
    }

    @Override
    public CompletableFuture<Snapshot> saveSnapshot(Snapshot snapshot) {
        snapshots
                .computeIfAbsent(snapshot.getDocumentId(), k -> new ConcurrentSkipListMap<>())
                .put(snapshot.getVersion(), snapshot);
        log.info("Stored snapshot {}", snapshot);
        return CompletableFuture.completedFuture(snapshot);
    }

    /** Lists the stored snapshot versions of a document in ascending order. */
    public List<Long> listVersions(DocumentId documentId) {
        NavigableMap<Long, Snapshot> versions = snapshots.get(documentId);
        return versions == null ? List.of() : List.copyOf(versions.keySet());
    }
}
