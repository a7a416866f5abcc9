package com.refgraph.core.scanner;

import com.refgraph.core.model.Diagnostic;
import com.refgraph.core.model.Region;
import com.refgraph.core.model.RegionKind;
import com.refgraph.core.model.Span;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The region partition of one document, produced by {@link LexicalScanner#scan(String, String)}.
 *
 * <p>Regions are sorted, contiguous and non-overlapping; their union is the whole text.
 * Lookups are binary searches over region starts.
 */
public final class RegionMap {

    private final String documentKey;
    private final String text;
    private final List<Region> regions;
    private final List<Diagnostic> diagnostics;
    private final LineIndex lines;

    RegionMap(String documentKey, String text, List<Region> regions, List<Diagnostic> diagnostics) {
        this.documentKey = Objects.requireNonNull(documentKey, "documentKey must not be null");
        this.text = Objects.requireNonNull(text, "text must not be null");
        this.regions = List.copyOf(regions);
        this.diagnostics = List.copyOf(diagnostics);
        this.lines = new LineIndex(text);
    }

    public String documentKey() {
        return documentKey;
    }

    public String text() {
        return text;
    }

    public List<Region> regions() {
        return regions;
    }

    /**
     * Conditions found while scanning, e.g. an unclosed block comment.
     *
     * @return scan diagnostics
     */
    public List<Diagnostic> diagnostics() {
        return diagnostics;
    }

    public LineIndex lines() {
        return lines;
    }

    /**
     * Returns the region covering an offset.
     *
     * @param offset character offset inside the text
     * @return covering region
     */
    public Region regionAt(int offset) {
        return regions.get(indexAt(offset));
    }

    /**
     * Returns every region sharing at least one character with a span.
     *
     * @param span span to inspect
     * @return overlapping regions in document order
     */
    public List<Region> overlapping(Span span) {
        List<Region> result = new ArrayList<>();
        if (span.isEmpty() || text.isEmpty()) {
            return result;
        }
        for (int i = indexAt(span.start()); i < regions.size(); i++) {
            Region region = regions.get(i);
            if (region.start() >= span.end()) {
                break;
            }
            result.add(region);
        }
        return result;
    }

    public RegionKind kindAt(int offset) {
        return regionAt(offset).kind();
    }

    /**
     * Checks whether a span contains nothing but code.
     *
     * @param span span to inspect
     * @return true if every overlapping region is {@link RegionKind#CODE}
     */
    public boolean isAllCode(Span span) {
        return overlapping(span).stream().allMatch(r -> r.kind() == RegionKind.CODE);
    }

    private int indexAt(int offset) {
        if (offset < 0 || offset >= text.length()) {
            throw new IndexOutOfBoundsException("offset " + offset + " outside [0, " + text.length() + ")");
        }
        int lo = 0;
        int hi = regions.size() - 1;
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            Region region = regions.get(mid);
            if (offset < region.start()) {
                hi = mid - 1;
            } else if (offset >= region.end()) {
                lo = mid + 1;
            } else {
                return mid;
            }
        }
        throw new IllegalStateException("regions do not cover offset " + offset);
    }

    public boolean hasUnmatchedDelimiters() {
        return !diagnostics.isEmpty();
    }
}
