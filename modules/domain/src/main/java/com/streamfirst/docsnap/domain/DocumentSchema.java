package com.streamfirst.docsnap.domain;

import java.util.Objects;
import java.util.Set;

/**
 * Named document schema: the node types a document of this schema may contain.
 *
 * @param name schema name recorded on every {@link DocumentRecord} created with it
 * @param nodeTypes node types accepted by documents of this schema
 */
public record DocumentSchema(String name, Set<String> nodeTypes) {
    public DocumentSchema {
        Objects.requireNonNull(name, "Schema name cannot be null");
        Objects.requireNonNull(nodeTypes, "Schema node types cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Schema name cannot be empty");
        }
        if (nodeTypes.isEmpty()) {
            throw new IllegalArgumentException("Schema " + name + " must declare at least one node type");
        }
        nodeTypes = Set.copyOf(nodeTypes);
    }

    public static DocumentSchema of(String name, String... nodeTypes) {
        return new DocumentSchema(name, Set.of(nodeTypes));
    }

    public boolean supports(String nodeType) {
        return nodeTypes.contains(nodeType);
    }

    /** Creates an empty, mutable document of this schema. */
    public Document createDocument() {
        return new Document(this);
    }
}
