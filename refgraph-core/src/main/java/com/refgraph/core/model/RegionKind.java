package com.refgraph.core.model;

/**
 * Lexical classification of a {@link Region}.
 */
public enum RegionKind {
    /** Executable text: anything that is not a string literal or a comment */
    CODE,
    /** A quoted literal in one of the {@link QuoteDialect}s */
    STRING_LITERAL,
    /** {@code //} up to, but not including, the line terminator */
    LINE_COMMENT,
    /** Delimited block comment, or everything after an unclosed opener */
    BLOCK_COMMENT;

    /**
     * Returns true for both comment kinds.
     *
     * @return true if text in this region is logically inert
     */
    public boolean isComment() {
        return this == LINE_COMMENT || this == BLOCK_COMMENT;
    }
}
