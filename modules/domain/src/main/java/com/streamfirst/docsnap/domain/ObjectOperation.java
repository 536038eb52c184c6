package com.streamfirst.docsnap.domain;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.Value;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Atomic, schema-aware mutation of a single document node. A change carries an ordered list of
 * these; the snapshot engine never looks inside them, only the change applicator does.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ObjectOperation {
    /** Kinds of node mutation. */
    public enum Type {
        /** Create a node of a given type with initial properties */
        CREATE,
        /** Remove a node */
        DELETE,
        /** Replace a single property value */
        SET,
        /** Edit a string property in place */
        UPDATE
    }

    @NonNull Type type;

    /** Id of the node this operation targets */
    @NonNull String nodeId;

    /** Node type, CREATE only */
    String nodeType;

    /** Initial properties, CREATE only */
    Map<String, Object> properties;

    /** Target property, SET and UPDATE only */
    String property;

    /** New property value, SET only (null clears the property) */
    Object value;

    /** Text edit, UPDATE only */
    TextEdit edit;

    public static ObjectOperation create(String nodeId, String nodeType, Map<String, Object> properties) {
        if (nodeType == null || nodeType.isBlank()) {
            throw new IllegalArgumentException("Node type is required to create node " + nodeId);
        }
        Map<String, Object> initial = new TreeMap<>();
        if (properties != null) {
            properties.forEach((name, value) -> PropertyValues.requireSnapshotSafe(nodeId + "." + name, value));
            initial.putAll(properties);
        }
        return new ObjectOperation(
                Type.CREATE,
                nodeId,
                nodeType,
                Collections.unmodifiableMap(initial),
                null,
                null,
                null);
    }

    public static ObjectOperation delete(String nodeId) {
        return new ObjectOperation(Type.DELETE, nodeId, null, null, null, null, null);
    }

    public static ObjectOperation set(String nodeId, String property, Object value) {
        requireProperty(nodeId, property);
        PropertyValues.requireSnapshotSafe(nodeId + "." + property, value);
        return new ObjectOperation(Type.SET, nodeId, null, null, property, value, null);
    }

    public static ObjectOperation update(String nodeId, String property, @NonNull TextEdit edit) {
        requireProperty(nodeId, property);
        return new ObjectOperation(Type.UPDATE, nodeId, null, null, property, null, edit);
    }

    private static void requireProperty(String nodeId, String property) {
        if (property == null || property.isBlank()) {
            throw new IllegalArgumentException("Property name is required for node " + nodeId);
        }
    }

    @Override
    public String toString() {
        return "ObjectOperation{" + type + " " + nodeId + (property != null ? "." + property : "") + '}';
    }
}
