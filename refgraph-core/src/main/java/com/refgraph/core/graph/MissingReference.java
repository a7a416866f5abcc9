package com.refgraph.core.graph;

import com.refgraph.core.model.ReferenceTarget;
import com.refgraph.core.model.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeMap;

/**
 * A target with no backing document, with the locations referencing it.
 *
 * @param target missing target
 * @param sources active references to the target, sorted
 * @param upstream for each referencing document, the documents actively referencing it in turn,
 *                 in key order
 */
public record MissingReference(
    ReferenceTarget target,
    List<SourceLocation> sources,
    Map<String, SortedSet<String>> upstream
) {
    /**
     * Compact constructor with validation and defaults.
     */
    public MissingReference {
        Objects.requireNonNull(target, "target must not be null");
        sources = sources == null ? List.of() : List.copyOf(sources);
        upstream = upstream == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(upstream));
    }
}
