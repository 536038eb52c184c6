package com.streamfirst.docsnap.domain;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NonNull;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/** A single node of a {@link Document}: an id, a schema node type and named property values. */
@Getter
public final class DocumentNode {
    private final String id;
    private final String type;

    @Getter(AccessLevel.NONE)
    private final Map<String, Object> properties = new TreeMap<>();

    DocumentNode(@NonNull String id, @NonNull String type, @NonNull Map<String, Object> properties) {
        this.id = id;
        this.type = type;
        properties.forEach(this::put);
    }

    /** Property values ordered by property name. */
    public Map<String, Object> getProperties() {
        return Collections.unmodifiableMap(properties);
    }

    public Object getProperty(String name) {
        return properties.get(name);
    }

    void put(String name, Object value) {
        if (value == null) {
            properties.remove(name);
        } else {
            PropertyValues.requireSnapshotSafe(id + "." + name, value);
            properties.put(name, value);
        }
    }

    @Override
    public String toString() {
        return "DocumentNode{" + id + ":" + type + ", " + properties + '}';
    }
}
