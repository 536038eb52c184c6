package com.streamfirst.docsnap.ports;

import com.streamfirst.docsnap.domain.Document;

/**
 * Port for converting between live documents and their persisted snapshot representation. The
 * round trip must be lossless: importing an export into an empty document of the same schema and
 * exporting again yields identical data.
 */
public interface DocumentCodecPort {

    /**
     * Populates {@code document} from exported data.
     *
     * @param document an empty instance of the schema the data was exported from
     * @param data a previous {@link #exportDocument(Document)} result
     * @return the populated document
     */
    Document importDocument(Document document, String data);

    /** Serializes the full state of a document. */
    String exportDocument(Document document);
}
