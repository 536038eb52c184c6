package com.streamfirst.docsnap.domain;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/**
 * Node property values are restricted to what a snapshot can carry unchanged: {@code null},
 * strings, booleans, integral numbers, finite floats and doubles, lists of values and maps with
 * string keys.
 */
final class PropertyValues {

    private PropertyValues() {
    }

    /**
     * @param path property path used in the error message
     * @throws IllegalArgumentException if the value, or anything nested in it, is not allowed
     */
    static void requireSnapshotSafe(String path, Object value) {
        if (value == null || value instanceof String || value instanceof Boolean) {
            return;
        }
        if (value instanceof Double d && !Double.isFinite(d)
                || value instanceof Float f && !Float.isFinite(f)) {
            throw new IllegalArgumentException("Property " + path + " must be a finite number, got " + value);
        }
        if (value instanceof Byte || value instanceof Short || value instanceof Integer
                || value instanceof Long || value instanceof BigInteger
                || value instanceof Double || value instanceof Float) {
            return;
        }
        if (value instanceof List<?> list) {
            for (int i = 0; i < list.size(); i++) {
                requireSnapshotSafe(path + "[" + i + "]", list.get(i));
            }
            return;
        }
        if (value instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!(entry.getKey() instanceof String key)) {
                    throw new IllegalArgumentException(
                            "Property " + path + " has a non-string key " + entry.getKey());
                }
                requireSnapshotSafe(path + "." + key, entry.getValue());
            }
            return;
        }
        throw new IllegalArgumentException(
                "Property " + path + " has unsupported type " + value.getClass().getName());
    }
}
