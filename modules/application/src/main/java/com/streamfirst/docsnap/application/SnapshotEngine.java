package com.streamfirst.docsnap.application;

import com.streamfirst.docsnap.domain.Change;
import com.streamfirst.docsnap.domain.Document;
import com.streamfirst.docsnap.domain.DocumentId;
import com.streamfirst.docsnap.domain.DocumentRecord;
import com.streamfirst.docsnap.domain.InvalidArgumentsException;
import com.streamfirst.docsnap.domain.Snapshot;
import com.streamfirst.docsnap.domain.SnapshotStoreRequiredException;
import com.streamfirst.docsnap.ports.ChangeLogPort;
import com.streamfirst.docsnap.ports.DocumentCodecPort;
import com.streamfirst.docsnap.ports.DocumentFactoryPort;
import com.streamfirst.docsnap.ports.DocumentStorePort;
import com.streamfirst.docsnap.ports.SnapshotStorePort;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Creates and retrieves snapshots of documents whose history lives in an append-only change log.
 *
 * <p>A snapshot for version V is the document state after replaying every change with version
 * {@code <= V}. When a snapshot store is configured, reconstruction starts from the closest stored
 * snapshot at or before V and only replays the delta; otherwise the full history is replayed.
 *
 * <p>The engine holds no mutable state besides its wiring. Every call resolves its collaborators
 * one at a time through a future pipeline, owns the document instance it builds, and fails as a
 * whole on the first collaborator error. Nothing is persisted unless the whole computation
 * succeeded.
 */
@Slf4j
public class SnapshotEngine {

    private final DocumentStorePort documentStore;
    private final ChangeLogPort changeLog;
    private final SnapshotStorePort snapshotStore;
    private final DocumentFactoryPort documentFactory;
    private final DocumentCodecPort codec;
    private final SnapshotFrequencyPolicy frequencyPolicy;
    private final ChangeApplicator changeApplicator = new ChangeApplicator();

    /**
     * @param snapshotStore optional; without it snapshots are always computed by full replay and
     *     cannot be persisted
     * @param frequency snapshot every {@code frequency}-th version in {@link #requestSnapshot};
     *     defaults to {@link SnapshotFrequencyPolicy#DEFAULT_FREQUENCY}
     */
    @Builder
    public SnapshotEngine(
            @NonNull DocumentStorePort documentStore,
            @NonNull ChangeLogPort changeLog,
            SnapshotStorePort snapshotStore,
            @NonNull DocumentFactoryPort documentFactory,
            @NonNull DocumentCodecPort codec,
            Integer frequency) {
        this.documentStore = documentStore;
        this.changeLog = changeLog;
        this.snapshotStore = snapshotStore;
        this.documentFactory = documentFactory;
        this.codec = codec;
        this.frequencyPolicy =
                new SnapshotFrequencyPolicy(
                        frequency != null ? frequency : SnapshotFrequencyPolicy.DEFAULT_FREQUENCY);
        log.info(
                "Snapshot engine ready (snapshot store: {}, {})",
                snapshotStore != null ? snapshotStore.getClass().getSimpleName() : "none",
                frequencyPolicy);
    }

    /**
     * Returns the snapshot of a document at its latest version. Read-only.
     *
     * @param documentId the document to materialize
     * @return future completing with the snapshot
     */
    public CompletableFuture<Snapshot> getSnapshot(DocumentId documentId) {
        return getSnapshot(documentId, OptionalLong.empty());
    }

    /**
     * Returns the snapshot of a document at exactly {@code version}. Read-only: a computed snapshot
     * is not persisted.
     *
     * @param documentId the document to materialize
     * @param version the version to materialize, {@code >= 0}
     * @return future completing with the snapshot, or failing with {@link
     *     InvalidArgumentsException} for a missing id or an out-of-range version
     */
    public CompletableFuture<Snapshot> getSnapshot(DocumentId documentId, long version) {
        return getSnapshot(documentId, OptionalLong.of(version));
    }

    /**
     * Variant taking an optional version; an empty version resolves to the document's latest.
     */
    public CompletableFuture<Snapshot> getSnapshot(DocumentId documentId, OptionalLong version) {
        Optional<InvalidArgumentsException> invalid = validate("getSnapshot", documentId, version);
        if (invalid.isPresent()) {
            return CompletableFuture.failedFuture(invalid.get());
        }
        return computeSnapshot(documentId, version)
                .whenComplete(
                        (snapshot, throwable) -> {
                            if (throwable != null) {
                                log.error(
                                        "Failed to compute snapshot of {}@{}",
                                        documentId,
                                        describe(version),
                                        unwrap(throwable));
                            }
                        });
    }

    /**
     * Hook for the change commit workflow, called once per committed change. Persists a snapshot of
     * the document's current version when a snapshot store is configured and {@code version} is a
     * multiple of the configured frequency; otherwise completes immediately without doing anything.
     *
     * @param documentId the document that received a change
     * @param version the version that was just committed
     * @return future completing when the snapshot (if any) has been persisted
     */
    public CompletableFuture<Void> requestSnapshot(DocumentId documentId, long version) {
        Optional<InvalidArgumentsException> invalid =
                validate("requestSnapshot", documentId, OptionalLong.of(version));
        if (invalid.isPresent()) {
            return CompletableFuture.failedFuture(invalid.get());
        }
        if (snapshotStore == null || !frequencyPolicy.shouldSnapshot(version)) {
            log.debug("Skipping snapshot of {} for committed version {}", documentId, version);
            return CompletableFuture.completedFuture(null);
        }
        return createSnapshot(documentId).thenApply(snapshot -> null);
    }

    /**
     * Computes the snapshot of a document at its latest version and persists it.
     *
     * @throws SnapshotStoreRequiredException immediately if no snapshot store is configured
     */
    public CompletableFuture<Snapshot> createSnapshot(DocumentId documentId) {
        return createSnapshot(documentId, OptionalLong.empty());
    }

    /**
     * Computes the snapshot of a document at {@code version} and persists it.
     *
     * @throws SnapshotStoreRequiredException immediately if no snapshot store is configured
     */
    public CompletableFuture<Snapshot> createSnapshot(DocumentId documentId, long version) {
        return createSnapshot(documentId, OptionalLong.of(version));
    }

    /**
     * Variant taking an optional version; an empty version resolves to the document's latest.
     *
     * @throws SnapshotStoreRequiredException immediately if no snapshot store is configured
     */
    public CompletableFuture<Snapshot> createSnapshot(DocumentId documentId, OptionalLong version) {
        if (snapshotStore == null) {
            throw new SnapshotStoreRequiredException(
                    "You must provide a snapshot store to be able to create snapshots");
        }
        Optional<InvalidArgumentsException> invalid = validate("createSnapshot", documentId, version);
        if (invalid.isPresent()) {
            return CompletableFuture.failedFuture(invalid.get());
        }
        return computeSnapshot(documentId, version)
                .thenCompose(snapshotStore::saveSnapshot)
                .whenComplete(
                        (snapshot, throwable) -> {
                            if (throwable == null) {
                                log.info("Created snapshot {}", snapshot);
                            } else {
                                log.error(
                                        "Failed to create snapshot of {}@{}",
                                        documentId,
                                        describe(version),
                                        unwrap(throwable));
                            }
                        });
    }

    public boolean isSnapshotStoreConfigured() {
        return snapshotStore != null;
    }

    public SnapshotFrequencyPolicy getFrequencyPolicy() {
        return frequencyPolicy;
    }

    /**
     * Resolves the target version from the document's metadata and rebuilds the document with the
     * strategy that fits the configuration.
     */
    private CompletableFuture<Snapshot> computeSnapshot(DocumentId documentId, OptionalLong version) {
        return documentStore
                .getDocument(documentId)
                .thenCompose(
                        record -> {
                            long target = version.orElse(record.getVersion());
                            if (target > record.getVersion()) {
                                return CompletableFuture.<Snapshot>failedFuture(
                                        new InvalidArgumentsException(
                                                "Version "
                                                        + target
                                                        + " of "
                                                        + documentId
                                                        + " does not exist, latest is "
                                                        + record.getVersion()));
                            }
                            ReconstructionStrategy strategy =
                                    ReconstructionStrategy.select(snapshotStore != null, target);
                            log.debug("Computing snapshot of {}@{} using {}", documentId, target, strategy);
                            return strategy == ReconstructionStrategy.INCREMENTAL
                                    ? computeIncremental(record, target)
                                    : computeFullReplay(record, target);
                        });
    }

    /**
     * Seeds the document from the closest stored snapshot at or before {@code version} and replays
     * the changes after it. An exact hit is returned as stored, without touching the change log.
     */
    private CompletableFuture<Snapshot> computeIncremental(DocumentRecord record, long version) {
        DocumentId documentId = record.getDocumentId();
        return snapshotStore
                .findClosestSnapshot(documentId, version)
                .thenCompose(
                        closest -> {
                            if (closest.isPresent() && closest.get().getVersion() > version) {
                                throw new IllegalStateException(
                                        "Snapshot store returned " + closest.get() + " for a lookup at " + version);
                            }
                            if (closest.isPresent() && closest.get().getVersion() == version) {
                                log.debug("Found stored snapshot of {}@{}", documentId, version);
                                return CompletableFuture.completedFuture(closest.get());
                            }

                            long knownVersion = closest.map(Snapshot::getVersion).orElse(0L);
                            Document document = documentFactory.createInstance(record.getSchemaName());
                            if (closest.isPresent()) {
                                document = codec.importDocument(document, closest.get().getData());
                            }
                            log.debug(
                                    "Replaying {} changes of {} on top of version {}",
                                    version - knownVersion,
                                    documentId,
                                    knownVersion);
                            return replay(document, documentId, knownVersion, version);
                        });
    }

    /** Rebuilds the document from an empty instance, replaying its history up to {@code version}. */
    private CompletableFuture<Snapshot> computeFullReplay(DocumentRecord record, long version) {
        Document document;
        try {
            document = documentFactory.createInstance(record.getSchemaName());
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        if (version == 0) {
            return CompletableFuture.completedFuture(export(document, record.getDocumentId(), 0));
        }
        return replay(document, record.getDocumentId(), 0, version);
    }

    /** Fetches the changes in {@code (sinceVersion, version]}, applies them and exports the result. */
    private CompletableFuture<Snapshot> replay(
            Document document, DocumentId documentId, long sinceVersion, long version) {
        return changeLog
                .getChanges(documentId, sinceVersion, version)
                .thenApply(
                        changes -> {
                            requireContiguous(documentId, changes, sinceVersion, version);
                            changeApplicator.apply(document, changes);
                            return export(document, documentId, version);
                        });
    }

    private Snapshot export(Document document, DocumentId documentId, long version) {
        return new Snapshot(documentId, version, codec.exportDocument(document));
    }

    /** The change log must hand out every version of the range exactly once, in order. */
    private static void requireContiguous(
            DocumentId documentId, List<Change> changes, long sinceVersion, long version) {
        long expected = sinceVersion + 1;
        for (Change change : changes) {
            if (change.getVersion() != expected) {
                throw new IllegalStateException(
                        "Change log returned version "
                                + change.getVersion()
                                + " of "
                                + documentId
                                + " where "
                                + expected
                                + " was expected");
            }
            expected++;
        }
        if (expected != version + 1) {
            throw new IllegalStateException(
                    "Change log is missing versions "
                            + expected
                            + ".."
                            + version
                            + " of "
                            + documentId);
        }
    }

    private static Optional<InvalidArgumentsException> validate(
            String operation, DocumentId documentId, OptionalLong version) {
        if (documentId == null) {
            log.warn("{} called without a documentId", operation);
            return Optional.of(new InvalidArgumentsException(operation + " requires a documentId"));
        }
        if (version.isPresent() && version.getAsLong() < 0) {
            log.warn(
                    "{} called with negative version {} for {}", operation, version.getAsLong(), documentId);
            return Optional.of(
                    new InvalidArgumentsException(
                            operation + " requires a version >= 0, got " + version.getAsLong()));
        }
        return Optional.empty();
    }

    private static Object describe(OptionalLong version) {
        return version.isPresent() ? version.getAsLong() : "latest";
    }

    private static Throwable unwrap(Throwable throwable) {
        return throwable instanceof CompletionException && throwable.getCause() != null
                ? throwable.getCause()
                : throwable;
    }
}
