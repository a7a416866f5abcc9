package com.refgraph.core.prune;

import com.refgraph.core.model.Diagnostic;

import java.util.List;

/**
 * Outcome of a pruning pass.
 *
 * @param planned every mutation the pass decided on
 * @param applied mutations actually performed; empty for a dry run
 * @param diagnostics conditions met while planning or applying
 * @param dryRun whether mutations were only planned
 */
public record PruneResult(
    List<PruneAction> planned,
    List<PruneAction> applied,
    List<Diagnostic> diagnostics,
    boolean dryRun
) {
    /**
     * Compact constructor with defaults.
     */
    public PruneResult {
        planned = planned == null ? List.of() : List.copyOf(planned);
        applied = applied == null ? List.of() : List.copyOf(applied);
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    public long plannedDeletions() {
        return planned.stream().filter(a -> a.type() == PruneAction.Type.DELETE_DOCUMENT).count();
    }

    public long appliedDeletions() {
        return applied.stream().filter(a -> a.type() == PruneAction.Type.DELETE_DOCUMENT).count();
    }

    public boolean isEmpty() {
        return planned.isEmpty();
    }
}
