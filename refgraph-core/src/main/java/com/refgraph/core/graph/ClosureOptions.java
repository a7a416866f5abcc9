package com.refgraph.core.graph;

import java.util.List;

/**
 * Closure settings.
 *
 * @param maxIterations maximum number of expansion rounds before giving up, or
 *     {@link #AUTO_MAX_ITERATIONS} to allow one round per document
 * @param parallelism threads used to analyze documents ahead of expansion
 * @param ignoredTargets glob patterns of target keys that are neither expanded nor reported missing
 */
public record ClosureOptions(int maxIterations, int parallelism, List<String> ignoredTargets) {

    /**
     * Caps the rounds at the size of the document set. Every round but the last reaches at
     * least one document not reached before, so a closure never needs more.
     */
    public static final int AUTO_MAX_ITERATIONS = 0;

    /**
     * Compact constructor with validation and defaults.
     */
    public ClosureOptions {
        if (maxIterations < 0) {
            throw new IllegalArgumentException("maxIterations must not be negative, got " + maxIterations);
        }
        if (parallelism < 1) {
            parallelism = 1;
        }
        ignoredTargets = ignoredTargets == null ? List.of() : List.copyOf(ignoredTargets);
    }

    public static ClosureOptions defaults() {
        return new ClosureOptions(AUTO_MAX_ITERATIONS, 1, List.of());
    }

    public ClosureOptions withMaxIterations(int maxIterations) {
        return new ClosureOptions(maxIterations, parallelism, ignoredTargets);
    }

    /**
     * Resolves the round cap for a document set.
     *
     * @param documentCount number of documents in the set
     * @return effective cap, at least 1
     */
    public int roundCap(int documentCount) {
        return maxIterations == AUTO_MAX_ITERATIONS ? Math.max(1, documentCount) : maxIterations;
    }
}
