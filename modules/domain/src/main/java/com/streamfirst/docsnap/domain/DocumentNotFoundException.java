package com.streamfirst.docsnap.domain;

import lombok.Getter;

/** The metadata store holds no record for the requested document. */
@Getter
public class DocumentNotFoundException extends DocumentSnapshotException {

    private final DocumentId documentId;

    public DocumentNotFoundException(DocumentId documentId) {
        super("Document " + documentId + " not found");
        this.documentId = documentId;
    }

    @Override
    public String errorCode() {
        return "DocumentNotFoundError";
    }
}
