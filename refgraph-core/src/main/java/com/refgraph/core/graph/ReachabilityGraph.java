package com.refgraph.core.graph;

import com.refgraph.core.analysis.DocumentAnalysis;
import com.refgraph.core.model.ClassifiedOccurrence;
import com.refgraph.core.model.ReferenceTarget;
import com.refgraph.core.model.SourceLocation;

import java.util.Collections;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Directed reference graph between artifact keys.
 *
 * <p>Edges come from active occurrences only. Inactive occurrences are recorded separately as
 * incoming locations so orphans can be told apart by whether commented-out references to them
 * remain. Cycles are allowed.
 *
 * <p>The graph grows as the closure expands documents; it only holds edges of expanded
 * documents.
 */
public final class ReachabilityGraph {

    private final Map<String, SortedSet<ReferenceTarget>> outgoing = new TreeMap<>();
    private final Map<ReferenceTarget, SortedSet<SourceLocation>> activeIncoming = new TreeMap<>();
    private final Map<ReferenceTarget, SortedSet<SourceLocation>> inactiveIncoming = new TreeMap<>();

    /**
     * Adds the edges of an expanded document.
     *
     * @param analysis analysis of the expanded document
     */
    void addDocument(DocumentAnalysis analysis) {
        SortedSet<ReferenceTarget> targets = outgoing.computeIfAbsent(analysis.key(), k -> new TreeSet<>());
        for (ClassifiedOccurrence occurrence : analysis.occurrences()) {
            Map<ReferenceTarget, SortedSet<SourceLocation>> incoming = occurrence.isActive() ? activeIncoming : inactiveIncoming;
            incoming.computeIfAbsent(occurrence.target(), k -> new TreeSet<>()).add(occurrence.occurrence().location());
            if (occurrence.isActive()) {
                targets.add(occurrence.target());
            }
        }
    }

    /**
     * Expanded documents.
     *
     * @return keys in lexicographic order
     */
    public SortedSet<String> expandedNodes() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(outgoing.keySet()));
    }

    public SortedSet<ReferenceTarget> successors(String key) {
        return Collections.unmodifiableSortedSet(outgoing.getOrDefault(key, new TreeSet<>()));
    }

    public SortedSet<SourceLocation> activeReferrers(ReferenceTarget target) {
        return Collections.unmodifiableSortedSet(activeIncoming.getOrDefault(target, new TreeSet<>()));
    }

    public SortedSet<SourceLocation> inactiveReferrers(ReferenceTarget target) {
        return Collections.unmodifiableSortedSet(inactiveIncoming.getOrDefault(target, new TreeSet<>()));
    }

    /**
     * Documents that actively reference a key.
     *
     * @param key artifact key
     * @return referring document keys in lexicographic order
     */
    public SortedSet<String> referringDocuments(String key) {
        SortedSet<String> documents = new TreeSet<>();
        activeReferrers(new ReferenceTarget(key)).forEach(l -> documents.add(l.documentKey()));
        return documents;
    }

    public int edgeCount() {
        return outgoing.values().stream().mapToInt(SortedSet::size).sum();
    }
}
