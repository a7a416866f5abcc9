package com.refgraph.core.model;

import java.util.Objects;

/**
 * Where a reference was found.
 *
 * @param documentKey referencing document
 * @param span matched text
 * @param line 1-based line number
 */
public record SourceLocation(String documentKey, Span span, int line) implements Comparable<SourceLocation> {

    /**
     * Compact constructor with validation.
     */
    public SourceLocation {
        Objects.requireNonNull(documentKey, "documentKey must not be null");
        Objects.requireNonNull(span, "span must not be null");
    }

    @Override
    public int compareTo(SourceLocation other) {
        int byKey = documentKey.compareTo(other.documentKey);
        return byKey != 0 ? byKey : span.compareTo(other.span);
    }

    @Override
    public String toString() {
        return documentKey + ":" + line;
    }
}
