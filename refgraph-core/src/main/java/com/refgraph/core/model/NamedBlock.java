package com.refgraph.core.model;

import java.util.Objects;

/**
 * A named syntactic unit inside a document, such as a class definition.
 *
 * @param name declared name
 * @param parent declared parent name, or {@code null} when none is given
 * @param header span of the declaration header up to and including the opening brace
 * @param body balanced brace block
 * @param extent full removable extent (header, body and a trailing semicolon if present)
 */
public record NamedBlock(String name, String parent, Span header, BlockSpan body, Span extent) {

    /**
     * Compact constructor with validation.
     */
    public NamedBlock {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(header, "header must not be null");
        Objects.requireNonNull(body, "body must not be null");
        Objects.requireNonNull(extent, "extent must not be null");
    }
}
