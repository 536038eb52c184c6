package com.streamfirst.docsnap.adapters;

import com.streamfirst.docsnap.domain.DocumentId;
import com.streamfirst.docsnap.domain.DocumentNotFoundException;
import com.streamfirst.docsnap.domain.DocumentRecord;
import com.streamfirst.docsnap.ports.DocumentStorePort;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of DocumentStorePort for testing and development. Besides the read
 * side used by the snapshot engine it offers the write side a commit workflow needs: creating a
 * document and advancing its version pointer.
 */
@Slf4j
public class InMemoryDocumentStoreAdapter implements DocumentStorePort {

    private final Map<DocumentId, DocumentRecord> documents = new ConcurrentHashMap<>();

    @Override
    public CompletableFuture<DocumentRecord> getDocument(DocumentId documentId) {
        DocumentRecord record = documents.get(documentId);
        if (record == null) {
            log.debug("No metadata found for document {}", documentId);
            return CompletableFuture.failedFuture(new DocumentNotFoundException(documentId));
        }
        return CompletableFuture.completedFuture(record);
    }

    /**
     * Registers a new document at version 0.
     *
     * @throws IllegalArgumentException if the document already exists
     */
    public DocumentRecord createDocument(DocumentId documentId, String schemaName) {
        DocumentRecord record = new DocumentRecord(documentId, schemaName, 0);
        if (documents.putIfAbsent(documentId, record) != null) {
            throw new IllegalArgumentException("Document " + documentId + " already exists");
        }
        log.info("Created document {} with schema {}", documentId, schemaName);
        return record;
    }

    /**
     * Moves a document's version pointer forward.
     *
     * @throws DocumentNotFoundException if the document is unknown
     * @throws IllegalStateException if {@code version} is not above the current version
     */
    public DocumentRecord updateVersion(DocumentId documentId, long version) {
        DocumentRecord updated =
                documents.compute(
                        documentId,
                        (id, current) -> {
                            if (current == null) {
                                throw new DocumentNotFoundException(id);
                            }
                            if (version <= current.getVersion()) {
                                throw new IllegalStateException(
                                        "Version of "
                                                + id
                                                + " must increase: current "
                                                + current.getVersion()
                                                + ", requested "
                                                + version);
                            }
                            return current.withVersion(version);
                        });
        log.debug("Document {} advanced to version {}", documentId, version);
        return updated;
    }
}
