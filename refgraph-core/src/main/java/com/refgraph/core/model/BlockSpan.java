package com.refgraph.core.model;

/**
 * Extent of a balanced brace block.
 *
 * @param openPos offset of the opening brace
 * @param closePos offset of the matching closing brace
 */
public record BlockSpan(int openPos, int closePos) {

    /**
     * Compact constructor with validation.
     */
    public BlockSpan {
        if (openPos < 0 || closePos <= openPos) {
            throw new IllegalArgumentException("invalid block [" + openPos + ", " + closePos + "]");
        }
    }

    /**
     * Converts to a half-open span covering both braces.
     *
     * @return span from the opening brace through the closing brace
     */
    public Span toSpan() {
        return new Span(openPos, closePos + 1);
    }
}
