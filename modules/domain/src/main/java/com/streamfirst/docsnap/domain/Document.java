package com.streamfirst.docsnap.domain;

import lombok.Getter;
import lombok.NonNull;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Live, mutable document instance of a given schema.
 *
 * <p>An instance is created empty by a {@link DocumentSchema}, optionally seeded from a snapshot,
 * and then advanced by applying changes in increasing version order. It is not thread-safe: each
 * reconstruction owns its instance exclusively and discards it after export.
 *
 * <p>Mutations that cannot be applied to the current state fail with {@link IllegalStateException}
 * (or {@link IllegalArgumentException} for node types the schema does not declare).
 */
public final class Document {
    @Getter private final DocumentSchema schema;
    private final Map<String, DocumentNode> nodes = new TreeMap<>();

    Document(@NonNull DocumentSchema schema) {
        this.schema = schema;
    }

    public String getSchemaName() {
        return schema.name();
    }

    public void create(@NonNull String nodeId, @NonNull String nodeType, Map<String, Object> properties) {
        if (nodes.containsKey(nodeId)) {
            throw new IllegalStateException("Node " + nodeId + " already exists");
        }
        if (!schema.supports(nodeType)) {
            throw new IllegalArgumentException(
                    "Node type '" + nodeType + "' is not defined by schema '" + schema.name() + "'");
        }
        nodes.put(nodeId, new DocumentNode(nodeId, nodeType, properties == null ? Map.of() : properties));
    }

    public void delete(@NonNull String nodeId) {
        if (nodes.remove(nodeId) == null) {
            throw new IllegalStateException("Cannot delete unknown node " + nodeId);
        }
    }

    /** Sets a property; a {@code null} value removes it. */
    public void set(@NonNull String nodeId, @NonNull String property, Object value) {
        require(nodeId).put(property, value);
    }

    public void updateText(@NonNull String nodeId, @NonNull String property, @NonNull TextEdit edit) {
        DocumentNode node = require(nodeId);
        Object current = node.getProperty(property);
        if (!(current instanceof String text)) {
            throw new IllegalStateException(
                    "Property " + nodeId + "." + property + " is not a text property: " + current);
        }
        node.put(property, edit.applyTo(text));
    }

    public Optional<DocumentNode> get(String nodeId) {
        return Optional.ofNullable(nodes.get(nodeId));
    }

    public boolean contains(String nodeId) {
        return nodes.containsKey(nodeId);
    }

    public Set<String> nodeIds() {
        return Collections.unmodifiableSet(nodes.keySet());
    }

    /** Nodes ordered by id. */
    public Collection<DocumentNode> nodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    private DocumentNode require(String nodeId) {
        DocumentNode node = nodes.get(nodeId);
        if (node == null) {
            throw new IllegalStateException("Unknown node " + nodeId);
        }
        return node;
    }

    @Override
    public String toString() {
        return "Document{schema=" + schema.name() + ", nodes=" + nodes.size() + '}';
    }
}
