package com.refgraph.core.graph;

import com.refgraph.core.analysis.DocumentAnalysis;
import com.refgraph.core.model.Diagnostic;
import com.refgraph.core.model.InactiveGroup;
import com.refgraph.core.model.NodeState;
import com.refgraph.core.model.ReferenceTarget;
import com.refgraph.core.model.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Classification produced by one closure run.
 *
 * <p>When the run did not converge the classification is partial: documents that were never
 * reached keep {@link NodeState#UNVISITED} instead of becoming orphans, and callers must not
 * prune from it.
 */
public final class ClosureResult {

    private final SortedSet<String> roots;
    private final SortedMap<String, NodeState> states;
    private final SortedMap<ReferenceTarget, SortedSet<SourceLocation>> missingSources;
    private final ReachabilityGraph graph;
    private final SortedMap<String, DocumentAnalysis> analyses;
    private final boolean converged;
    private final int iterations;
    private final List<Diagnostic> diagnostics;

    ClosureResult(
        SortedSet<String> roots,
        SortedMap<String, NodeState> states,
        SortedMap<ReferenceTarget, SortedSet<SourceLocation>> missingSources,
        ReachabilityGraph graph,
        SortedMap<String, DocumentAnalysis> analyses,
        boolean converged,
        int iterations,
        List<Diagnostic> diagnostics
    ) {
        this.roots = Collections.unmodifiableSortedSet(new TreeSet<>(roots));
        this.states = Collections.unmodifiableSortedMap(new TreeMap<>(states));
        this.missingSources = Collections.unmodifiableSortedMap(new TreeMap<>(missingSources));
        this.graph = graph;
        this.analyses = Collections.unmodifiableSortedMap(new TreeMap<>(analyses));
        this.converged = converged;
        this.iterations = iterations;
        this.diagnostics = List.copyOf(diagnostics);
    }

    public SortedSet<String> roots() {
        return roots;
    }

    /**
     * Classification of every known key: all documents plus every missing target.
     *
     * @return states in key order
     */
    public SortedMap<String, NodeState> states() {
        return states;
    }

    public NodeState stateOf(String key) {
        return states.getOrDefault(key, NodeState.UNVISITED);
    }

    public ReachabilityGraph graph() {
        return graph;
    }

    public boolean converged() {
        return converged;
    }

    public int iterations() {
        return iterations;
    }

    public List<Diagnostic> diagnostics() {
        return diagnostics;
    }

    /**
     * Analysis of an expanded document.
     *
     * @param key artifact key
     * @return analysis, or empty if the document was not expanded
     */
    public Optional<DocumentAnalysis> analysis(String key) {
        return Optional.ofNullable(analyses.get(key));
    }

    public SortedMap<String, DocumentAnalysis> analyses() {
        return analyses;
    }

    // ==================== Views ====================

    public SortedSet<String> reachable() {
        return keysIn(NodeState.REACHABLE);
    }

    public SortedSet<String> orphans() {
        return keysIn(NodeState.ORPHAN);
    }

    public SortedSet<String> missing() {
        return keysIn(NodeState.MISSING);
    }

    public SortedSet<String> unvisited() {
        return keysIn(NodeState.UNVISITED);
    }

    /**
     * Orphans still mentioned by commented-out references in reachable documents.
     *
     * @return keys in lexicographic order
     */
    public SortedSet<String> commentOrphans() {
        SortedSet<String> result = new TreeSet<>();
        for (String orphan : orphans()) {
            if (!graph.inactiveReferrers(new ReferenceTarget(orphan)).isEmpty()) {
                result.add(orphan);
            }
        }
        return Collections.unmodifiableSortedSet(result);
    }

    /**
     * Orphans with no reference at all from reachable documents.
     *
     * @return keys in lexicographic order
     */
    public SortedSet<String> pureOrphans() {
        SortedSet<String> result = new TreeSet<>(orphans());
        result.removeAll(commentOrphans());
        return Collections.unmodifiableSortedSet(result);
    }

    /**
     * Missing targets with their referencing locations and, one level up, the documents
     * referencing each source.
     *
     * @return missing references in target order
     */
    public List<MissingReference> missingReferences() {
        List<MissingReference> result = new ArrayList<>();
        for (Map.Entry<ReferenceTarget, SortedSet<SourceLocation>> entry : missingSources.entrySet()) {
            Map<String, SortedSet<String>> upstream = new TreeMap<>();
            for (SourceLocation source : entry.getValue()) {
                upstream.computeIfAbsent(source.documentKey(), graph::referringDocuments);
            }
            result.add(new MissingReference(entry.getKey(), new ArrayList<>(entry.getValue()), upstream));
        }
        return result;
    }

    /**
     * Inactive groups of every expanded document.
     *
     * @return groups in key, then document, order
     */
    public List<InactiveGroup> inactiveGroups() {
        return analyses.values().stream()
            .flatMap(a -> a.inactiveGroups().stream())
            .toList();
    }

    private SortedSet<String> keysIn(NodeState state) {
        SortedSet<String> result = new TreeSet<>();
        states.forEach((key, s) -> {
            if (s == state) {
                result.add(key);
            }
        });
        return Collections.unmodifiableSortedSet(result);
    }
}
