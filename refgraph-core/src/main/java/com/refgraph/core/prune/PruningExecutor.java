package com.refgraph.core.prune;

import com.refgraph.core.analysis.AnalysisCache;
import com.refgraph.core.analysis.DocumentAnalysis;
import com.refgraph.core.analysis.DocumentAnalyzer;
import com.refgraph.core.document.ArtifactMutator;
import com.refgraph.core.document.DocumentProvider;
import com.refgraph.core.graph.ClosureResult;
import com.refgraph.core.model.ClassifiedOccurrence;
import com.refgraph.core.model.Diagnostic;
import com.refgraph.core.model.DiagnosticKind;
import com.refgraph.core.model.InactiveGroup;
import com.refgraph.core.model.ReferenceTarget;
import com.refgraph.core.model.SourceLocation;
import com.refgraph.core.model.Span;
import com.refgraph.core.util.GlobMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Turns a closure result into deletions and span removals.
 *
 * <p>A pass runs in four steps:
 * <ol>
 *   <li><b>Candidates</b>: orphans matching {@link PruneOptions#candidates()}. Nothing is
 *       pruned from a closure that did not converge.</li>
 *   <li><b>Re-confirmation</b>: every document that survives is analyzed afresh. A candidate
 *       still actively referenced by a survivor is withdrawn and reported as
 *       {@link DiagnosticKind#STALE_CLASSIFICATION}; it then survives too, so its own references
 *       are checked in turn. If a survivor cannot be read, no candidate is confirmed.</li>
 *   <li><b>Planning</b>: commented-out groups in survivors that mention only confirmed orphans
 *       are removed, repeated declarations are removed, and confirmed orphans are deleted.
 *       Deleting an orphan that a survivor still mentions in a comment the pass leaves in place
 *       is reported as {@link DiagnosticKind#INACTIVE_ONLY_REFERENCE}.</li>
 *   <li><b>Application</b>: only with {@link PruneOptions#apply()}; otherwise the plan is the
 *       report.</li>
 * </ol>
 *
 * <p>A pass over documents that an earlier applied pass already pruned plans nothing.
 */
public final class PruningExecutor {

    private static final Logger log = LoggerFactory.getLogger(PruningExecutor.class);

    private final DocumentAnalyzer analyzer;
    private final DeclarationDeduplicator deduplicator = new DeclarationDeduplicator();

    public PruningExecutor(DocumentAnalyzer analyzer) {
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer must not be null");
    }

    /**
     * Plans and optionally applies a pruning pass.
     *
     * @param closure converged closure over the current document set
     * @param provider the same document set
     * @param mutator mutation interface, used only when applying
     * @param options toggles
     * @return planned and applied actions
     */
    public PruneResult execute(ClosureResult closure, DocumentProvider provider, ArtifactMutator mutator, PruneOptions options) {
        Objects.requireNonNull(closure, "closure must not be null");
        Objects.requireNonNull(provider, "provider must not be null");
        Objects.requireNonNull(options, "options must not be null");
        List<Diagnostic> diagnostics = new ArrayList<>();

        if (!closure.converged()) {
            log.warn("Closure did not converge; refusing to prune");
            diagnostics.add(Diagnostic.global(DiagnosticKind.CLOSURE_DID_NOT_CONVERGE,
                "Classification is partial; nothing pruned"));
            return new PruneResult(List.of(), List.of(), diagnostics, !options.apply());
        }

        SortedSet<String> candidates = candidates(closure, options);
        AnalysisCache fresh = new AnalysisCache(analyzer, provider);
        SortedSet<String> confirmed = confirm(candidates, provider, fresh, diagnostics);
        SortedSet<String> survivors = new TreeSet<>(provider.keys());
        if (options.deleteOrphans()) {
            survivors.removeAll(confirmed);
        }

        List<PruneAction> planned = new ArrayList<>();
        SortedMap<String, List<Span>> removedSpans = new TreeMap<>();

        if (options.removeDeadBlocks()) {
            for (String key : survivors) {
                fresh.get(key).ifPresent(a -> planDeadBlocks(a, confirmed, planned, removedSpans));
            }
        }
        if (options.deduplicateDeclarations()) {
            for (String key : survivors) {
                fresh.get(key).ifPresent(a -> deduplicator.plan(a).forEach(action -> plan(action, planned, removedSpans)));
            }
        }
        if (options.deleteOrphans()) {
            Set<String> commentOrphans = closure.commentOrphans();
            for (String key : confirmed) {
                String detail = commentOrphans.contains(key) ? "comment orphan" : "pure orphan";
                planned.add(PruneAction.deleteDocument(key, PruneAction.Reason.ORPHAN, detail));
                reportInactiveOnly(key, survivors, fresh, removedSpans, diagnostics);
            }
        }

        planned.sort(PruneAction.ORDER);
        List<PruneAction> applied = List.of();
        if (options.apply() && !planned.isEmpty()) {
            Objects.requireNonNull(mutator, "mutator must not be null when applying");
            applied = ActionApplier.apply(planned, mutator, diagnostics);
        }

        log.info("Pruning {}: {} action(s) planned, {} applied, {} diagnostic(s)",
            options.apply() ? "applied" : "dry run", planned.size(), applied.size(), diagnostics.size());
        return new PruneResult(planned, applied, diagnostics, !options.apply());
    }

    // ==================== Candidates ====================

    private static SortedSet<String> candidates(ClosureResult closure, PruneOptions options) {
        if (!options.deleteOrphans() && !options.removeDeadBlocks()) {
            return new TreeSet<>();
        }
        GlobMatcher scope = GlobMatcher.of(options.candidates());
        SortedSet<String> candidates = new TreeSet<>();
        for (String orphan : closure.orphans()) {
            if (scope.isEmpty() || scope.matches(orphan)) {
                candidates.add(orphan);
            }
        }
        return candidates;
    }

    private static SortedSet<String> confirm(
        SortedSet<String> candidates,
        DocumentProvider provider,
        AnalysisCache fresh,
        List<Diagnostic> diagnostics
    ) {
        SortedSet<String> confirmed = new TreeSet<>(candidates);
        if (confirmed.isEmpty()) {
            return confirmed;
        }

        Deque<String> worklist = new ArrayDeque<>();
        provider.keys().stream().filter(k -> !confirmed.contains(k)).forEach(worklist::add);

        while (!worklist.isEmpty()) {
            String survivor = worklist.poll();
            Optional<DocumentAnalysis> analysis = fresh.get(survivor);
            if (analysis.isEmpty()) {
                continue;
            }
            if (!analysis.get().isReadable()) {
                diagnostics.add(Diagnostic.of(DiagnosticKind.STALE_CLASSIFICATION, survivor,
                    "Cannot re-confirm orphans while a surviving document is unreadable; nothing deleted"));
                log.warn("{} is unreadable; withdrawing all {} orphan candidate(s)", survivor, confirmed.size());
                confirmed.clear();
                return confirmed;
            }
            for (ClassifiedOccurrence occurrence : analysis.get().activeOccurrences()) {
                String target = occurrence.target().key();
                if (confirmed.remove(target)) {
                    diagnostics.add(new Diagnostic(
                        DiagnosticKind.STALE_CLASSIFICATION,
                        target,
                        null,
                        "Classified orphan but actively referenced from " + occurrence.occurrence().location()
                            + "; not deleted"));
                    log.warn("{} is classified orphan but actively referenced from {}; not deleted",
                        target, occurrence.occurrence().location());
                    worklist.add(target);
                }
            }
        }
        return confirmed;
    }

    // ==================== Planning ====================

    private static void planDeadBlocks(
        DocumentAnalysis analysis,
        Set<String> confirmed,
        List<PruneAction> planned,
        Map<String, List<Span>> removedSpans
    ) {
        for (InactiveGroup group : analysis.inactiveGroups()) {
            boolean onlyOrphans = group.targets().stream().map(ReferenceTarget::key).allMatch(confirmed::contains);
            if (onlyOrphans) {
                plan(PruneAction.removeSpan(analysis.key(), group.extent(), PruneAction.Reason.DEAD_BLOCK,
                    analysis.document().text()), planned, removedSpans);
            }
        }
    }

    private static void plan(PruneAction action, List<PruneAction> planned, Map<String, List<Span>> removedSpans) {
        List<Span> spans = removedSpans.computeIfAbsent(action.documentKey(), k -> new ArrayList<>());
        for (Span existing : spans) {
            if (existing.overlaps(action.span())) {
                log.debug("Skipping {}: overlaps an earlier removal {}", action, existing);
                return;
            }
        }
        spans.add(action.span());
        planned.add(action);
    }

    private static void reportInactiveOnly(
        String orphan,
        Set<String> survivors,
        AnalysisCache fresh,
        Map<String, List<Span>> removedSpans,
        List<Diagnostic> diagnostics
    ) {
        ReferenceTarget target = new ReferenceTarget(orphan);
        SortedSet<SourceLocation> remaining = new TreeSet<>();
        for (String survivor : survivors) {
            Optional<DocumentAnalysis> analysis = fresh.get(survivor);
            if (analysis.isEmpty()) {
                continue;
            }
            List<Span> removed = removedSpans.getOrDefault(survivor, List.of());
            for (ClassifiedOccurrence occurrence : analysis.get().inactiveOccurrences()) {
                if (occurrence.target().equals(target)
                    && removed.stream().noneMatch(s -> s.contains(occurrence.span()))) {
                    remaining.add(occurrence.occurrence().location());
                }
            }
        }
        if (!remaining.isEmpty()) {
            log.warn("Deleting {} although commented-out references remain: {}", orphan, remaining);
            diagnostics.add(Diagnostic.of(DiagnosticKind.INACTIVE_ONLY_REFERENCE, orphan,
                "Deleted while only inactive references remain: " + remaining));
        }
    }
}
