package com.refgraph.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Contiguous commented-out text holding one or more inactive occurrences.
 *
 * <p>A group is the unit the pruner removes: a run of whole comment lines, a whole-line
 * block comment, or a trailing comment after code.
 *
 * @param documentKey containing document
 * @param extent removable span (whole lines include their terminator)
 * @param firstLine 1-based first line
 * @param lastLine 1-based last line
 * @param occurrences inactive occurrences inside the extent
 */
public record InactiveGroup(
    String documentKey,
    Span extent,
    int firstLine,
    int lastLine,
    List<ClassifiedOccurrence> occurrences
) {
    /**
     * Compact constructor with validation.
     */
    public InactiveGroup {
        Objects.requireNonNull(documentKey, "documentKey must not be null");
        Objects.requireNonNull(extent, "extent must not be null");
        occurrences = occurrences == null ? List.of() : List.copyOf(occurrences);
        if (lastLine < firstLine) {
            throw new IllegalArgumentException("lastLine before firstLine");
        }
    }

    /**
     * Targets mentioned anywhere in this group.
     *
     * @return sorted targets
     */
    public Set<ReferenceTarget> targets() {
        Set<ReferenceTarget> targets = new TreeSet<>();
        occurrences.forEach(o -> targets.add(o.target()));
        return targets;
    }
}
