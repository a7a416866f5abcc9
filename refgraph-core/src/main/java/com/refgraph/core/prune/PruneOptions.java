package com.refgraph.core.prune;

import java.util.List;

/**
 * Pruning toggles.
 *
 * @param deleteOrphans delete orphan documents
 * @param removeDeadBlocks remove commented-out groups that only mention orphans
 * @param deduplicateDeclarations remove repeated declaration lines
 * @param apply perform the mutations; otherwise only plan them
 * @param candidates glob patterns limiting which orphans may be pruned; empty allows every orphan
 */
public record PruneOptions(
    boolean deleteOrphans,
    boolean removeDeadBlocks,
    boolean deduplicateDeclarations,
    boolean apply,
    List<String> candidates
) {
    /**
     * Compact constructor with defaults.
     */
    public PruneOptions {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }

    /**
     * Every action enabled, dry run, no candidate restriction.
     *
     * @return default options
     */
    public static PruneOptions dryRun() {
        return new PruneOptions(true, true, true, false, List.of());
    }

    public PruneOptions withApply(boolean apply) {
        return new PruneOptions(deleteOrphans, removeDeadBlocks, deduplicateDeclarations, apply, candidates);
    }

    public PruneOptions withCandidates(List<String> candidates) {
        return new PruneOptions(deleteOrphans, removeDeadBlocks, deduplicateDeclarations, apply, candidates);
    }
}
