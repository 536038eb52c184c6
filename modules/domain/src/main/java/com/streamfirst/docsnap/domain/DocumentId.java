package com.streamfirst.docsnap.domain;

import java.util.Objects;

/**
 * Opaque identifier of a document, stable for the document's whole lifetime.
 * Owned by the document metadata store; the snapshot engine never changes it.
 *
 * @param value the identifier (e.g., "doc-1", a UUID)
 */
public record DocumentId(String value) {
    public DocumentId {
        Objects.requireNonNull(value, "Document ID cannot be null");
        if (value.trim().isEmpty()) {
            throw new IllegalArgumentException("Document ID cannot be empty");
        }
    }

    public static DocumentId of(String value) {
        return new DocumentId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
