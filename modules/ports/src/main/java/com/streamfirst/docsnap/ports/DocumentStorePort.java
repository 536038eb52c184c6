package com.streamfirst.docsnap.ports;

import com.streamfirst.docsnap.domain.DocumentId;
import com.streamfirst.docsnap.domain.DocumentRecord;

import java.util.concurrent.CompletableFuture;

/**
 * Port for the document metadata store. Holds, per document, the schema it was created with and
 * its latest committed version. Read-only from the snapshot engine's point of view.
 */
public interface DocumentStorePort {

    /**
     * Looks up the metadata record of a document.
     *
     * @param documentId the document identifier
     * @return future completing with the record, or failing with {@link
     *     com.streamfirst.docsnap.domain.DocumentNotFoundException} if the id is unknown
     */
    CompletableFuture<DocumentRecord> getDocument(DocumentId documentId);
}
