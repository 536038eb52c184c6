package com.streamfirst.docsnap.domain;

import java.util.Objects;

/**
 * Edit of a string property: delete {@code deleteCount} characters at {@code offset}, then insert
 * {@code insert} at the same offset.
 *
 * @param offset zero-based character offset
 * @param deleteCount number of characters removed at the offset
 * @param insert text inserted at the offset (may be empty)
 */
public record TextEdit(int offset, int deleteCount, String insert) {
    public TextEdit {
        Objects.requireNonNull(insert, "Inserted text cannot be null");
        if (offset < 0) {
            throw new IllegalArgumentException("Text edit offset must be >= 0, got " + offset);
        }
        if (deleteCount < 0) {
            throw new IllegalArgumentException("Text edit delete count must be >= 0, got " + deleteCount);
        }
    }

    public static TextEdit insert(int offset, String text) {
        return new TextEdit(offset, 0, text);
    }

    public static TextEdit delete(int offset, int count) {
        return new TextEdit(offset, count, "");
    }

    /**
     * Applies this edit to the given text.
     *
     * @throws IllegalStateException if the edited range lies outside the text
     */
    public String applyTo(String text) {
        if ((long) offset + deleteCount > text.length()) {
            throw new IllegalStateException(
                    "Text edit " + this + " out of range for text of length " + text.length());
        }
        return text.substring(0, offset) + insert + text.substring(offset + deleteCount);
    }
}
