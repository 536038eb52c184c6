package com.streamfirst.docsnap.adapters;

import com.streamfirst.docsnap.domain.Change;
import com.streamfirst.docsnap.domain.DocumentId;
import com.streamfirst.docsnap.ports.ChangeLogPort;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of ChangeLogPort for testing and development. Enforces the append-only,
 * gap-free version sequence per document: the change at list index {@code i} always has version
 * {@code i + 1}. Data is lost when the application stops.
 */
@Slf4j
public class InMemoryChangeLogAdapter implements ChangeLogPort {

    private final Map<DocumentId, List<Change>> changesByDocument = new ConcurrentHashMap<>();

    /**
     * Appends the next change of a document.
     *
     * @param change the change; its version must directly follow the latest logged version
     * @return the version the change occupies
     * @throws IllegalStateException if the version would leave a gap or reuse a slot
     */
    public long append(Change change) {
        List<Change> history =
                changesByDocument.computeIfAbsent(change.getDocumentId(), k -> new ArrayList<>());
        synchronized (history) {
            long expected = history.size() + 1L;
            if (change.getVersion() != expected) {
                throw new IllegalStateException(
                        "Change log for "
                                + change.getDocumentId()
                                + " expects version "
                                + expected
                                + " but got "
                                + change.getVersion());
            }
            history.add(change);
        }
        log.debug("Appended change {} to log", change);
        return change.getVersion();
    }

    @Override
    public CompletableFuture<List<Change>> getChanges(
            DocumentId documentId, long sinceVersion, OptionalLong toVersion) {
        if (sinceVersion < 0) {
            return CompletableFuture.failedFuture(
                    new IllegalArgumentException("sinceVersion must be >= 0, got " + sinceVersion));
        }
        if (toVersion.isPresent() && toVersion.getAsLong() < sinceVersion) {
            return CompletableFuture.failedFuture(
                    new IllegalArgumentException(
                            "toVersion " + toVersion.getAsLong() + " is before sinceVersion " + sinceVersion));
        }

        List<Change> history = changesByDocument.get(documentId);
        if (history == null) {
            log.debug("No changes logged for document {}", documentId);
            return CompletableFuture.completedFuture(List.of());
        }

        List<Change> result;
        synchronized (history) {
            int from = (int) Math.min(sinceVersion, history.size());
            int to = (int) Math.min(toVersion.orElse(history.size()), history.size());
            result = List.copyOf(history.subList(from, to));
        }
        log.debug(
                "Fetched {} changes for document {} in ({}, {}]",
                result.size(),
                documentId,
                sinceVersion,
                toVersion.isPresent() ? toVersion.getAsLong() : "latest");
        return CompletableFuture.completedFuture(result);
    }

    /** Gets the version of the latest logged change, 0 if the document has none. */
    public long getLatestVersion(DocumentId documentId) {
        List<Change> history = changesByDocument.get(documentId);
        if (history == null) {
            return 0;
        }
        synchronized (history) {
            return history.size();
        }
    }
}
