package com.streamfirst.docsnap.domain;

import lombok.Getter;

/** The document factory has no schema registered under the requested name. */
@Getter
public class SchemaNotFoundException extends DocumentSnapshotException {

    private final String schemaName;

    public SchemaNotFoundException(String schemaName) {
        super("Schema " + schemaName + " not found");
        this.schemaName = schemaName;
    }

    @Override
    public String errorCode() {
        return "SchemaNotFoundError";
    }
}
