package com.refgraph.core.model;

import java.util.Optional;

/**
 * How a reference target is wrapped in the source text.
 *
 * <p>{@link #BARE} references are unquoted paths (typically XML element text); every other
 * constant corresponds to exactly one {@link QuoteDialect}.
 */
public enum TargetEncoding {
    BARE(null),
    PLAIN(QuoteDialect.PLAIN),
    BACKSLASH_ESCAPED(QuoteDialect.BACKSLASH_ESCAPED),
    MARKUP_ENTITY(QuoteDialect.MARKUP_ENTITY),
    SINGLE(QuoteDialect.SINGLE);

    private final QuoteDialect dialect;

    TargetEncoding(QuoteDialect dialect) {
        this.dialect = dialect;
    }

    /**
     * Returns the quote dialect wrapping the target, if any.
     *
     * @return dialect, or empty for {@link #BARE}
     */
    public Optional<QuoteDialect> quoteDialect() {
        return Optional.ofNullable(dialect);
    }

    /**
     * Maps a quote dialect to its encoding.
     *
     * @param dialect quote dialect
     * @return matching encoding
     */
    public static TargetEncoding of(QuoteDialect dialect) {
        for (TargetEncoding encoding : values()) {
            if (encoding.dialect == dialect) {
                return encoding;
            }
        }
        throw new IllegalArgumentException("No encoding for dialect " + dialect);
    }
}
