package com.refgraph.core.prune;

import com.refgraph.core.document.ArtifactMutator;
import com.refgraph.core.model.Diagnostic;
import com.refgraph.core.model.DiagnosticKind;
import com.refgraph.core.model.Span;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Applies planned actions through an {@link ArtifactMutator}.
 *
 * <p>Span removals go first, highest offset first within each document, so earlier offsets stay
 * valid. Deletions follow. A failed mutation is recorded as
 * {@link DiagnosticKind#MUTATION_FAILED} and the remaining actions still run.
 */
final class ActionApplier {

    private static final Logger log = LoggerFactory.getLogger(ActionApplier.class);

    private static final Comparator<PruneAction> APPLY_ORDER = Comparator
        .comparing(PruneAction::type)
        .thenComparing(PruneAction::documentKey)
        .thenComparing(PruneAction::span, Comparator.nullsFirst(Comparator.<Span>reverseOrder()));

    private ActionApplier() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    static List<PruneAction> apply(List<PruneAction> planned, ArtifactMutator mutator, List<Diagnostic> diagnostics) {
        List<PruneAction> ordered = new ArrayList<>(planned);
        ordered.sort(APPLY_ORDER);

        List<PruneAction> applied = new ArrayList<>();
        for (PruneAction action : ordered) {
            try {
                switch (action.type()) {
                    case REMOVE_SPAN -> mutator.removeSpan(action.documentKey(), action.span());
                    case DELETE_DOCUMENT -> mutator.deleteDocument(action.documentKey());
                }
                applied.add(action);
                log.info("Applied: {}", action);
            } catch (IOException e) {
                log.warn("Failed: {}: {}", action, e.getMessage());
                diagnostics.add(new Diagnostic(
                    DiagnosticKind.MUTATION_FAILED,
                    action.documentKey(),
                    action.span(),
                    "Could not " + action + ": " + e.getMessage()));
            }
        }
        applied.sort(PruneAction.ORDER);
        return applied;
    }
}
