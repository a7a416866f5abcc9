package com.refgraph.core.model;

import java.util.Objects;

/**
 * Immutable text buffer identified by a stable, slash-separated key.
 *
 * <p>Documents are never mutated in place. Pruning produces new versions through
 * the mutation interface instead.
 *
 * @param key artifact key (e.g. {@code objects/objects_SHD_03_1/PV/valve.xml})
 * @param text full document text
 */
public record Document(String key, String text) {

    /**
     * Compact constructor with validation.
     */
    public Document {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(text, "text must not be null");
        if (key.isBlank()) {
            throw new IllegalArgumentException("key must not be blank");
        }
    }

    public int length() {
        return text.length();
    }

    @Override
    public String toString() {
        return "Document[" + key + ", " + text.length() + " chars]";
    }
}
