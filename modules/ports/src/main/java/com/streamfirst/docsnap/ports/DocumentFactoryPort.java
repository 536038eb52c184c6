package com.streamfirst.docsnap.ports;

import com.streamfirst.docsnap.domain.Document;

/** Port for constructing empty document instances by schema name. */
public interface DocumentFactoryPort {

    /**
     * Creates an empty, mutable document of the named schema.
     *
     * @param schemaName the schema recorded on the document's metadata
     * @return a fresh instance owned by the caller
     * @throws com.streamfirst.docsnap.domain.SchemaNotFoundException if no such schema is registered
     */
    Document createInstance(String schemaName);
}
