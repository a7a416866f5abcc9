package com.refgraph.core.model;

import java.util.Objects;

/**
 * A located match of a reference pattern.
 *
 * <p>The containing region kind is the region the match was opened from. A quoted reference
 * whose opening delimiter starts a string literal counts as opened from {@link RegionKind#CODE},
 * since string literals can only be entered from code.
 *
 * @param documentKey key of the document containing the match
 * @param span matched text, including any quote delimiters
 * @param line 1-based line of the match start
 * @param referenceKind pattern kind that produced the match (e.g. {@code panel}, {@code script})
 * @param rawTarget target text as written, without delimiters
 * @param target normalized target
 * @param encoding how the target was quoted
 * @param containingKind region kind the match was opened from
 * @param declaration whether the pattern marks a declaration (subject to deduplication)
 */
public record Occurrence(
    String documentKey,
    Span span,
    int line,
    String referenceKind,
    String rawTarget,
    ReferenceTarget target,
    TargetEncoding encoding,
    RegionKind containingKind,
    boolean declaration
) {
    /**
     * Compact constructor with validation.
     */
    public Occurrence {
        Objects.requireNonNull(documentKey, "documentKey must not be null");
        Objects.requireNonNull(span, "span must not be null");
        Objects.requireNonNull(referenceKind, "referenceKind must not be null");
        Objects.requireNonNull(rawTarget, "rawTarget must not be null");
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(encoding, "encoding must not be null");
        Objects.requireNonNull(containingKind, "containingKind must not be null");
        if (containingKind == RegionKind.STRING_LITERAL) {
            throw new IllegalArgumentException("occurrences never open inside a string literal");
        }
    }

    /**
     * Location of this occurrence for reporting.
     *
     * @return source location
     */
    public SourceLocation location() {
        return new SourceLocation(documentKey, span, line);
    }
}
