package com.refgraph.core.reference;

import com.refgraph.core.model.TargetEncoding;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * One textual shape of a cross-document reference.
 *
 * <p>The regex must define a named group {@code target} holding the path as written. The
 * match itself should cover the quote delimiters implied by {@link #encoding()}, so that a
 * quoted reference starts exactly at its string literal's opening delimiter.
 *
 * <p>Patterns sharing a {@link #kind()} describe the same logical reference. Within a kind,
 * a pattern earlier in the extractor's list wins over a later one that matches overlapping text.
 *
 * @param kind logical reference kind (e.g. {@code panel}, {@code script})
 * @param regex compiled shape
 * @param encoding quoting implied by the shape
 * @param prefix key prefix prepended during normalization unless already present
 * @param suffix suffix appended during normalization when missing, or empty for none
 * @param declaration whether a repeated active match of the same target in one document is redundant
 */
public record ReferencePattern(
    String kind,
    Pattern regex,
    TargetEncoding encoding,
    String prefix,
    String suffix,
    boolean declaration
) {
    /** Name of the capture group holding the target path */
    public static final String TARGET_GROUP = "target";

    /**
     * Compact constructor with validation.
     */
    public ReferencePattern {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(regex, "regex must not be null");
        Objects.requireNonNull(encoding, "encoding must not be null");
        if (kind.isBlank()) {
            throw new IllegalArgumentException("kind must not be blank");
        }
        if (!regex.pattern().contains("(?<" + TARGET_GROUP + ">")) {
            throw new IllegalArgumentException("pattern for kind '" + kind + "' lacks a (?<target>...) group: " + regex);
        }
        prefix = prefix == null ? "" : prefix;
        suffix = suffix == null ? "" : suffix;
    }

    /**
     * Creates a plain (non-declaration) pattern without prefix or suffix.
     *
     * @param kind reference kind
     * @param regex regex source with a {@code target} group
     * @param encoding implied quoting
     * @return pattern
     */
    public static ReferencePattern of(String kind, String regex, TargetEncoding encoding) {
        return new ReferencePattern(kind, Pattern.compile(regex), encoding, "", "", false);
    }

    public ReferencePattern withPrefix(String newPrefix) {
        return new ReferencePattern(kind, regex, encoding, newPrefix, suffix, declaration);
    }

    public ReferencePattern withSuffix(String newSuffix) {
        return new ReferencePattern(kind, regex, encoding, prefix, newSuffix, declaration);
    }

    public ReferencePattern asDeclaration() {
        return new ReferencePattern(kind, regex, encoding, prefix, suffix, true);
    }

    @Override
    public String toString() {
        return kind + "/" + encoding + " " + regex.pattern();
    }
}
