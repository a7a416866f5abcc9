package com.refgraph.core.model;

import java.util.Objects;

/**
 * Canonical artifact key a reference points to, independent of how it was quoted.
 *
 * @param key normalized artifact key
 */
public record ReferenceTarget(String key) implements Comparable<ReferenceTarget> {

    /**
     * Compact constructor with validation.
     */
    public ReferenceTarget {
        Objects.requireNonNull(key, "key must not be null");
        if (key.isEmpty()) {
            throw new IllegalArgumentException("key must not be empty");
        }
    }

    @Override
    public int compareTo(ReferenceTarget other) {
        return key.compareTo(other.key);
    }

    @Override
    public String toString() {
        return key;
    }
}
