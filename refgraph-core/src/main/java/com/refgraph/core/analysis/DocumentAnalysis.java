package com.refgraph.core.analysis;

import com.refgraph.core.model.ClassifiedOccurrence;
import com.refgraph.core.model.Diagnostic;
import com.refgraph.core.model.DiagnosticKind;
import com.refgraph.core.model.Document;
import com.refgraph.core.model.InactiveGroup;
import com.refgraph.core.model.ReferenceTarget;
import com.refgraph.core.scanner.RegionMap;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Everything learned from one document: regions, classified occurrences and inactive groups.
 *
 * @param document analyzed document
 * @param regions region partition of the document
 * @param occurrences classified occurrences in document order
 * @param inactiveGroups removable comment extents in document order
 * @param diagnostics scanner and extractor diagnostics for this document
 */
public record DocumentAnalysis(
    Document document,
    RegionMap regions,
    List<ClassifiedOccurrence> occurrences,
    List<InactiveGroup> inactiveGroups,
    List<Diagnostic> diagnostics
) {
    /**
     * Compact constructor with validation and defaults.
     */
    public DocumentAnalysis {
        Objects.requireNonNull(document, "document must not be null");
        Objects.requireNonNull(regions, "regions must not be null");
        occurrences = occurrences == null ? List.of() : List.copyOf(occurrences);
        inactiveGroups = inactiveGroups == null ? List.of() : List.copyOf(inactiveGroups);
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    public String key() {
        return document.key();
    }

    /**
     * Whether the document text could be read. Unreadable documents are analyzed as empty.
     *
     * @return false if an {@link DiagnosticKind#UNREADABLE_DOCUMENT} diagnostic is present
     */
    public boolean isReadable() {
        return diagnostics.stream().noneMatch(d -> d.kind() == DiagnosticKind.UNREADABLE_DOCUMENT);
    }

    public List<ClassifiedOccurrence> activeOccurrences() {
        return occurrences.stream().filter(ClassifiedOccurrence::isActive).toList();
    }

    public List<ClassifiedOccurrence> inactiveOccurrences() {
        return occurrences.stream().filter(o -> !o.isActive()).toList();
    }

    /**
     * Targets this document actively references.
     *
     * @return sorted targets
     */
    public Set<ReferenceTarget> activeTargets() {
        Set<ReferenceTarget> targets = new TreeSet<>();
        activeOccurrences().forEach(o -> targets.add(o.target()));
        return Collections.unmodifiableSet(targets);
    }

    /**
     * Checks whether this document actively references a target.
     *
     * @param target target to look for
     * @return true if at least one active occurrence points at it
     */
    public boolean activelyReferences(ReferenceTarget target) {
        return occurrences.stream().anyMatch(o -> o.isActive() && o.target().equals(target));
    }
}
