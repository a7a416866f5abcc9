package com.refgraph.core.model;

import java.util.Objects;

/**
 * A classified span of a document.
 *
 * <p>Regions produced by one scan partition the document: they never overlap and
 * together cover every character.
 *
 * @param span covered range
 * @param kind lexical classification
 * @param dialect quote dialect for {@link RegionKind#STRING_LITERAL}, {@code null} otherwise
 */
public record Region(Span span, RegionKind kind, QuoteDialect dialect) {

    /**
     * Compact constructor with validation.
     */
    public Region {
        Objects.requireNonNull(span, "span must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        if (kind == RegionKind.STRING_LITERAL && dialect == null) {
            throw new IllegalArgumentException("string literal region requires a dialect");
        }
        if (kind != RegionKind.STRING_LITERAL && dialect != null) {
            throw new IllegalArgumentException(kind + " region cannot carry a dialect");
        }
    }

    public static Region code(int start, int end) {
        return new Region(new Span(start, end), RegionKind.CODE, null);
    }

    public static Region string(int start, int end, QuoteDialect dialect) {
        return new Region(new Span(start, end), RegionKind.STRING_LITERAL, dialect);
    }

    public static Region lineComment(int start, int end) {
        return new Region(new Span(start, end), RegionKind.LINE_COMMENT, null);
    }

    public static Region blockComment(int start, int end) {
        return new Region(new Span(start, end), RegionKind.BLOCK_COMMENT, null);
    }

    public int start() {
        return span.start();
    }

    public int end() {
        return span.end();
    }
}
