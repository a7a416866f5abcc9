package com.refgraph.core.model;

/**
 * The ways a string literal can be delimited in markup documents that embed script code.
 *
 * <p>The same logical literal {@code "abc"} may appear as:
 * <ul>
 *   <li>{@link #PLAIN} - {@code "abc"} (CDATA sections, standalone scripts)</li>
 *   <li>{@link #BACKSLASH_ESCAPED} - {@code \"abc\"} (script stored inside another string)</li>
 *   <li>{@link #MARKUP_ENTITY} - {@code &quot;abc&quot;} (script stored in an XML text node)</li>
 *   <li>{@link #SINGLE} - {@code 'abc'} (plain scripts only, never enabled for markup by default)</li>
 * </ul>
 *
 * <p>Detection order matters: {@link #BACKSLASH_ESCAPED} is tried before {@link #PLAIN} so
 * that an escaped quote is never read as a plain opener.
 */
public enum QuoteDialect {
    BACKSLASH_ESCAPED("\\\""),
    MARKUP_ENTITY("&quot;"),
    PLAIN("\""),
    SINGLE("'");

    private final String delimiter;

    QuoteDialect(String delimiter) {
        this.delimiter = delimiter;
    }

    /**
     * Returns the delimiter that both opens and closes a literal in this dialect.
     *
     * @return delimiter text
     */
    public String delimiter() {
        return delimiter;
    }

    /**
     * Checks whether this dialect's delimiter starts at the given offset.
     *
     * @param text text to inspect
     * @param offset position to test
     * @return true if the delimiter is present at {@code offset}
     */
    public boolean delimiterAt(CharSequence text, int offset) {
        int length = delimiter.length();
        if (offset < 0 || offset + length > text.length()) {
            return false;
        }
        for (int i = 0; i < length; i++) {
            if (text.charAt(offset + i) != delimiter.charAt(i)) {
                return false;
            }
        }
        return true;
    }
}
