package com.refgraph.core.scanner;

import com.refgraph.core.model.Diagnostic;
import com.refgraph.core.model.DiagnosticKind;
import com.refgraph.core.model.Document;
import com.refgraph.core.model.QuoteDialect;
import com.refgraph.core.model.Region;
import com.refgraph.core.model.Span;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Lexical scanner tracking string literals, comments and balanced braces.
 *
 * <p>The scanner is a single left-to-right pass over the text with an explicit state
 * machine. While in code, the following transitions are tried at each position, in order:
 * <ol>
 *   <li>{@code //} enters a line comment that ends before the next line terminator</li>
 *   <li>{@code /*} enters a block comment that ends after its closer, or at the end of the
 *       text when no closer exists</li>
 *   <li>a quote delimiter of an enabled {@link QuoteDialect} enters a string literal that ends
 *       after the same dialect's delimiter; inside it, a backslash and the character after it
 *       are consumed together</li>
 *   <li>any other character stays in code</li>
 * </ol>
 *
 * <p>The same state machine drives two modes:
 * <ul>
 *   <li>{@link #scan(String, String)} - a full {@link RegionMap} partition of the text</li>
 *   <li>{@link #findMatchingBrace(String, int)} - the offset of the brace closing the one at
 *       a given position, ignoring braces inside strings and comments</li>
 * </ul>
 *
 * <p>A markup scanner ({@link #forMarkup()}) also knows that a script embedded in markup ends
 * where the markup resumes: a comment never runs past a CDATA closer {@code ]]>} or a closing
 * tag {@code </name}. A block comment cut short this way is unmatched.
 *
 * <p>Malformed input never throws: every opener left without a closer is reported as an
 * {@link DiagnosticKind#UNMATCHED_DELIMITER} diagnostic and the rest of the text keeps the
 * open region's kind.
 *
 * <p>Instances are immutable and safe to share between threads.
 *
 * @see RegionMap
 * @see BraceMatch
 */
public final class LexicalScanner {

    private static final Logger log = LoggerFactory.getLogger(LexicalScanner.class);

    /**
     * Dialects recognized in markup documents. Single quotes are ordinary text there.
     */
    public static final Set<QuoteDialect> MARKUP_DIALECTS = Collections.unmodifiableSet(EnumSet.of(
        QuoteDialect.BACKSLASH_ESCAPED, QuoteDialect.MARKUP_ENTITY, QuoteDialect.PLAIN));

    // Detection order: an escaped quote must be seen before a plain one
    private static final QuoteDialect[] DETECTION_ORDER = {
        QuoteDialect.BACKSLASH_ESCAPED,
        QuoteDialect.MARKUP_ENTITY,
        QuoteDialect.PLAIN,
        QuoteDialect.SINGLE
    };

    private static final String CDATA_CLOSER = "]]>";
    private static final String END_TAG_OPENER = "</";

    private final Set<QuoteDialect> dialects;
    private final boolean markup;

    /**
     * Creates a scanner for plain script text recognizing the given quote dialects.
     *
     * @param dialects enabled dialects, must not be empty
     */
    public LexicalScanner(Set<QuoteDialect> dialects) {
        this(dialects, false);
    }

    /**
     * Creates a scanner recognizing the given quote dialects.
     *
     * @param dialects enabled dialects, must not be empty
     * @param markup whether comments end where surrounding markup resumes
     */
    public LexicalScanner(Set<QuoteDialect> dialects, boolean markup) {
        Objects.requireNonNull(dialects, "dialects must not be null");
        if (dialects.isEmpty()) {
            throw new IllegalArgumentException("at least one quote dialect is required");
        }
        this.dialects = Collections.unmodifiableSet(EnumSet.copyOf(dialects));
        this.markup = markup;
    }

    /**
     * Creates a scanner for markup documents ({@link #MARKUP_DIALECTS}).
     *
     * @return markup scanner
     */
    public static LexicalScanner forMarkup() {
        return forMarkup(false);
    }

    /**
     * Creates a scanner for markup documents.
     *
     * @param singleQuotes whether single-quoted strings are string literals as well
     * @return markup scanner
     */
    public static LexicalScanner forMarkup(boolean singleQuotes) {
        return new LexicalScanner(singleQuotes ? EnumSet.allOf(QuoteDialect.class) : MARKUP_DIALECTS, true);
    }

    /**
     * Creates a scanner for standalone scripts, which also treat single quotes as strings.
     *
     * @return script scanner
     */
    public static LexicalScanner forScripts() {
        return new LexicalScanner(EnumSet.allOf(QuoteDialect.class));
    }

    public Set<QuoteDialect> dialects() {
        return dialects;
    }

    public boolean isMarkup() {
        return markup;
    }

    // ==================== Region Partition ====================

    /**
     * Partitions a document into code, string and comment regions.
     *
     * @param document document to scan
     * @return region map covering the whole document
     */
    public RegionMap scan(Document document) {
        return scan(document.key(), document.text());
    }

    /**
     * Partitions text into code, string and comment regions.
     *
     * @param documentKey key used in diagnostics
     * @param text text to scan
     * @return region map covering the whole text
     */
    public RegionMap scan(String documentKey, String text) {
        PartitionVisitor visitor = new PartitionVisitor(documentKey);
        walk(text, 0, visitor);
        if (!visitor.diagnostics.isEmpty()) {
            log.debug("{}: {} unmatched delimiter(s)", documentKey, visitor.diagnostics.size());
        }
        return new RegionMap(documentKey, text, visitor.regions, visitor.diagnostics);
    }

    // ==================== Brace Matching ====================

    /**
     * Finds the brace closing the one at {@code openPos}.
     *
     * <p>The text at {@code openPos} is assumed to be code. Braces inside string literals
     * (any enabled dialect) and comments are ignored.
     *
     * @param text text to search
     * @param openPos offset of an opening brace
     * @return match; {@link BraceMatch#isMatched()} is false if the block is never closed
     * @throws IllegalArgumentException if there is no {@code '{'} at {@code openPos}
     */
    public BraceMatch findMatchingBrace(String text, int openPos) {
        if (openPos < 0 || openPos >= text.length() || text.charAt(openPos) != '{') {
            throw new IllegalArgumentException("no opening brace at offset " + openPos);
        }
        BraceVisitor visitor = new BraceVisitor();
        walk(text, openPos, visitor);
        return visitor.closePos >= 0 ? new BraceMatch(openPos, visitor.closePos) : BraceMatch.unmatched(openPos);
    }

    // ==================== State Machine ====================

    /**
     * Receives the events of one pass.
     */
    private interface Visitor {

        void region(Region region);

        /**
         * Called for each character in code state.
         *
         * @return true to stop the pass after this character
         */
        boolean codeChar(int offset, char c);

        void unmatched(int offset, String what);
    }

    private void walk(String text, int from, Visitor visitor) {
        int length = text.length();
        int codeStart = from;
        int i = from;

        while (i < length) {
            char c = text.charAt(i);

            if (c == '/' && i + 1 < length && text.charAt(i + 1) == '/') {
                emitCode(visitor, codeStart, i);
                int end = markupResumes(text, i + 2, lineTerminatorFrom(text, i + 2));
                visitor.region(Region.lineComment(i, end));
                i = end;
                codeStart = i;
                continue;
            }

            if (c == '/' && i + 1 < length && text.charAt(i + 1) == '*') {
                emitCode(visitor, codeStart, i);
                int close = text.indexOf("*/", i + 2);
                int limit = close < 0 ? length : close;
                int cut = markupResumes(text, i + 2, limit);
                if (cut < limit) {
                    close = -1;
                }
                int end = close < 0 ? cut : close + 2;
                visitor.region(Region.blockComment(i, end));
                if (close < 0) {
                    visitor.unmatched(i, "block comment");
                }
                i = end;
                codeStart = i;
                continue;
            }

            QuoteDialect dialect = dialectOpeningAt(text, i);
            if (dialect != null) {
                emitCode(visitor, codeStart, i);
                int close = stringEnd(text, i + dialect.delimiter().length(), dialect);
                int end = close < 0 ? length : close;
                visitor.region(Region.string(i, end, dialect));
                if (close < 0) {
                    visitor.unmatched(i, dialect.name().toLowerCase() + " string literal");
                }
                i = end;
                codeStart = i;
                continue;
            }

            if (visitor.codeChar(i, c)) {
                emitCode(visitor, codeStart, i + 1);
                return;
            }
            i++;
        }

        emitCode(visitor, codeStart, length);
    }

    private QuoteDialect dialectOpeningAt(String text, int offset) {
        for (QuoteDialect dialect : DETECTION_ORDER) {
            if (dialects.contains(dialect) && dialect.delimiterAt(text, offset)) {
                return dialect;
            }
        }
        return null;
    }

    /**
     * Returns the offset just past the closing delimiter, or -1 if the literal never closes.
     * The closer is tested before the escape rule because the backslash dialect's closer
     * itself begins with a backslash.
     */
    private static int stringEnd(String text, int from, QuoteDialect dialect) {
        int length = text.length();
        int i = from;
        while (i < length) {
            if (dialect.delimiterAt(text, i)) {
                return i + dialect.delimiter().length();
            }
            if (text.charAt(i) == '\\' && i + 1 < length) {
                i += 2;
                continue;
            }
            i++;
        }
        return -1;
    }

    private static int lineTerminatorFrom(String text, int from) {
        for (int i = from; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\n' || c == '\r') {
                return i;
            }
        }
        return text.length();
    }

    /**
     * Returns the offset in {@code [from, limit)} where markup resumes after an embedded script,
     * or {@code limit}.
     */
    private int markupResumes(String text, int from, int limit) {
        if (!markup) {
            return limit;
        }
        for (int i = from; i < limit; i++) {
            if (text.startsWith(CDATA_CLOSER, i)) {
                return i;
            }
            if (text.startsWith(END_TAG_OPENER, i) && i + 2 < text.length() && Character.isLetter(text.charAt(i + 2))) {
                return i;
            }
        }
        return limit;
    }

    private static void emitCode(Visitor visitor, int start, int end) {
        if (end > start) {
            visitor.region(Region.code(start, end));
        }
    }

    private static final class PartitionVisitor implements Visitor {

        private final String documentKey;
        private final List<Region> regions = new ArrayList<>();
        private final List<Diagnostic> diagnostics = new ArrayList<>();

        PartitionVisitor(String documentKey) {
            this.documentKey = documentKey;
        }

        @Override
        public void region(Region region) {
            regions.add(region);
        }

        @Override
        public boolean codeChar(int offset, char c) {
            return false;
        }

        @Override
        public void unmatched(int offset, String what) {
            diagnostics.add(new Diagnostic(
                DiagnosticKind.UNMATCHED_DELIMITER,
                documentKey,
                new Span(offset, offset + 1),
                "Unclosed " + what + " opened at offset " + offset + "; rest of document treated as inside it"));
        }
    }

    private static final class BraceVisitor implements Visitor {

        private int depth;
        private int closePos = -1;

        @Override
        public void region(Region region) {
            // regions are irrelevant when matching braces
        }

        @Override
        public boolean codeChar(int offset, char c) {
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    closePos = offset;
                    return true;
                }
            }
            return false;
        }

        @Override
        public void unmatched(int offset, String what) {
            // an unclosed string or comment leaves the brace unmatched, which the caller reports
        }
    }
}
