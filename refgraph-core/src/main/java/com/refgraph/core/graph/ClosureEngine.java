package com.refgraph.core.graph;

import com.refgraph.core.analysis.AnalysisCache;
import com.refgraph.core.analysis.DocumentAnalysis;
import com.refgraph.core.analysis.DocumentAnalyzer;
import com.refgraph.core.document.DocumentProvider;
import com.refgraph.core.model.ClassifiedOccurrence;
import com.refgraph.core.model.Diagnostic;
import com.refgraph.core.model.DiagnosticKind;
import com.refgraph.core.model.NodeState;
import com.refgraph.core.model.ReferenceTarget;
import com.refgraph.core.model.SourceLocation;
import com.refgraph.core.util.GlobMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Computes which documents are reachable from a root set.
 *
 * <p>The closure is a worklist fixpoint over the {@link ReachabilityGraph}:
 * <ol>
 *   <li>roots with a backing document start {@link NodeState#REACHABLE}; the others are
 *       {@link NodeState#MISSING} and reported as {@link DiagnosticKind#MISSING_ROOT}</li>
 *   <li>each round expands the nodes reached in the previous round, in lexicographic order.
 *       Every active target becomes reachable if a document backs it, otherwise missing.
 *       A node is expanded at most once, so cycles terminate.</li>
 *   <li>a round that reaches nothing new ends the closure; every document never reached
 *       becomes {@link NodeState#ORPHAN}</li>
 * </ol>
 *
 * <p>The number of rounds is capped by {@link ClosureOptions#roundCap(int)}; by default one
 * round per document, which a terminating closure never exceeds. Hitting the cap yields a
 * partial result with a {@link DiagnosticKind#CLOSURE_DID_NOT_CONVERGE} diagnostic
 * and no orphans.
 *
 * <p>Expansion itself runs on the calling thread. With {@code parallelism > 1}, document
 * analysis is done up front on a worker pool.
 */
public final class ClosureEngine {

    private static final Logger log = LoggerFactory.getLogger(ClosureEngine.class);

    private final DocumentAnalyzer analyzer;
    private final ClosureOptions options;
    private final GlobMatcher ignored;

    public ClosureEngine(DocumentAnalyzer analyzer, ClosureOptions options) {
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.ignored = GlobMatcher.of(options.ignoredTargets());
    }

    /**
     * Keys of the document set matching root patterns.
     *
     * @param patterns glob patterns over document keys
     * @param provider document set
     * @return matching keys in lexicographic order
     */
    public static SortedSet<String> keysMatching(Collection<String> patterns, DocumentProvider provider) {
        GlobMatcher matcher = GlobMatcher.of(patterns);
        SortedSet<String> keys = new TreeSet<>();
        provider.keys().stream().filter(matcher::matches).forEach(keys::add);
        return keys;
    }

    /**
     * Runs the closure.
     *
     * @param roots root artifact keys
     * @param provider document set
     * @return classification of every document and missing target
     */
    public ClosureResult run(Collection<String> roots, DocumentProvider provider) {
        Objects.requireNonNull(roots, "roots must not be null");
        Objects.requireNonNull(provider, "provider must not be null");

        SortedSet<String> documentKeys = provider.keys();
        SortedSet<String> sortedRoots = new TreeSet<>(roots);
        SortedMap<String, NodeState> states = new TreeMap<>();
        documentKeys.forEach(key -> states.put(key, NodeState.UNVISITED));

        SortedMap<ReferenceTarget, SortedSet<SourceLocation>> missingSources = new TreeMap<>();
        SortedMap<String, DocumentAnalysis> analyses = new TreeMap<>();
        List<Diagnostic> diagnostics = new ArrayList<>();
        ReachabilityGraph graph = new ReachabilityGraph();

        AnalysisCache cache = new AnalysisCache(analyzer, provider);
        if (options.parallelism() > 1) {
            cache.preload(documentKeys, options.parallelism());
        }

        SortedSet<String> frontier = new TreeSet<>();
        for (String root : sortedRoots) {
            if (provider.exists(root)) {
                states.put(root, NodeState.REACHABLE);
                frontier.add(root);
            } else {
                states.put(root, NodeState.MISSING);
                diagnostics.add(Diagnostic.of(DiagnosticKind.MISSING_ROOT, root, "Root has no backing document"));
                log.warn("Root {} has no backing document", root);
            }
        }

        int roundCap = options.roundCap(documentKeys.size());
        int iterations = 0;
        boolean converged = true;
        while (!frontier.isEmpty()) {
            if (iterations >= roundCap) {
                converged = false;
                diagnostics.add(Diagnostic.global(DiagnosticKind.CLOSURE_DID_NOT_CONVERGE,
                    "Stopped after " + iterations + " round(s) with " + frontier.size()
                        + " node(s) still to expand; classification is partial"));
                log.warn("Closure did not converge within {} rounds", roundCap);
                break;
            }
            iterations++;

            SortedSet<String> next = new TreeSet<>();
            for (String key : frontier) {
                Optional<DocumentAnalysis> found = cache.get(key);
                if (found.isEmpty()) {
                    // vanished after listing
                    states.put(key, NodeState.MISSING);
                    continue;
                }
                DocumentAnalysis analysis = found.get();
                analyses.put(key, analysis);
                diagnostics.addAll(analysis.diagnostics());
                graph.addDocument(analysis);
                expand(analysis, provider, states, missingSources, next);
            }
            log.debug("Round {}: expanded {}, reached {} new", iterations, frontier.size(), next.size());
            frontier = next;
        }

        if (converged) {
            states.replaceAll((key, state) -> state == NodeState.UNVISITED ? NodeState.ORPHAN : state);
        }

        ClosureResult result = new ClosureResult(
            sortedRoots, states, missingSources, graph, analyses, converged, iterations, diagnostics);
        log.info("Closure {} after {} round(s): {} reachable, {} orphan, {} missing",
            converged ? "converged" : "stopped",
            iterations,
            result.reachable().size(),
            result.orphans().size(),
            result.missing().size());
        return result;
    }

    private void expand(
        DocumentAnalysis analysis,
        DocumentProvider provider,
        SortedMap<String, NodeState> states,
        SortedMap<ReferenceTarget, SortedSet<SourceLocation>> missingSources,
        SortedSet<String> next
    ) {
        for (ClassifiedOccurrence occurrence : analysis.activeOccurrences()) {
            String target = occurrence.target().key();
            if (ignored.matches(target)) {
                continue;
            }
            if (provider.exists(target)) {
                if (states.get(target) != NodeState.REACHABLE) {
                    states.put(target, NodeState.REACHABLE);
                    next.add(target);
                }
            } else {
                states.put(target, NodeState.MISSING);
                missingSources.computeIfAbsent(occurrence.target(), k -> new TreeSet<>())
                    .add(occurrence.occurrence().location());
            }
        }
    }
}
