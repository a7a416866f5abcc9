package com.refgraph.core.reference;

import com.refgraph.core.model.Diagnostic;
import com.refgraph.core.model.DiagnosticKind;
import com.refgraph.core.model.Occurrence;
import com.refgraph.core.model.QuoteDialect;
import com.refgraph.core.model.ReferenceTarget;
import com.refgraph.core.model.Region;
import com.refgraph.core.model.RegionKind;
import com.refgraph.core.model.Span;
import com.refgraph.core.scanner.LexicalScanner;
import com.refgraph.core.scanner.RegionMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * Finds reference occurrences in a scanned document.
 *
 * <p>Every pattern is matched against the whole text; a match is kept when it is opened from
 * code or from a comment:
 * <ul>
 *   <li>a match starting in a {@link RegionKind#CODE} or comment region is opened from that region</li>
 *   <li>a quoted match starting exactly at the opening delimiter of a string literal in the
 *       pattern's own dialect, and ending inside that literal, is opened from code</li>
 *   <li>a {@link QuoteDialect#MARKUP_ENTITY} or {@link QuoteDialect#BACKSLASH_ESCAPED} match
 *       inside a plain string literal belongs to a script stored in that literal, such as an
 *       XML attribute value. The literal's contents are scanned as script and the same two
 *       rules apply to them.</li>
 *   <li>any other match starting inside a string literal is discarded; it is text inside a
 *       string, not a reference</li>
 * </ul>
 *
 * <p>Comment matches are reported too. Deciding whether they count is the activity
 * classifier's job, which keeps this class independent of reachability policy.
 *
 * <p>Within one reference kind, patterns are tried in list order. A later match overlapping an
 * already accepted match of the same kind is dropped and reported as
 * {@link DiagnosticKind#AMBIGUOUS_OVERLAP}, unless it lies inside that match and names the same
 * target: a bare path inside a commented-out quoted path is the same reference.
 *
 * @see DefaultPatterns
 * @see TargetNormalizer
 */
public final class ReferenceExtractor {

    private static final Logger log = LoggerFactory.getLogger(ReferenceExtractor.class);

    // Quoting usable by a script stored inside a plain string literal
    private static final Set<QuoteDialect> EMBEDDED_DIALECTS =
        Collections.unmodifiableSet(EnumSet.of(QuoteDialect.BACKSLASH_ESCAPED, QuoteDialect.MARKUP_ENTITY));
    private static final LexicalScanner EMBEDDED_SCANNER = new LexicalScanner(EMBEDDED_DIALECTS);

    private final Map<String, List<ReferencePattern>> patternsByKind;

    /**
     * Creates an extractor.
     *
     * @param patterns patterns in priority order
     */
    public ReferenceExtractor(List<ReferencePattern> patterns) {
        Objects.requireNonNull(patterns, "patterns must not be null");
        Map<String, List<ReferencePattern>> byKind = new LinkedHashMap<>();
        for (ReferencePattern pattern : patterns) {
            byKind.computeIfAbsent(pattern.kind(), k -> new ArrayList<>()).add(pattern);
        }
        byKind.replaceAll((k, v) -> List.copyOf(v));
        this.patternsByKind = byKind;
    }

    public List<ReferencePattern> patterns() {
        List<ReferencePattern> all = new ArrayList<>();
        patternsByKind.values().forEach(all::addAll);
        return all;
    }

    /**
     * Extracts all occurrences opened from code or comments.
     *
     * @param regions region map of the document
     * @return occurrences in document order plus overlap diagnostics
     */
    public Extraction extract(RegionMap regions) {
        String text = regions.text();
        String documentKey = regions.documentKey();
        List<Occurrence> occurrences = new ArrayList<>();
        List<Diagnostic> diagnostics = new ArrayList<>();
        Map<Integer, RegionMap> embedded = new HashMap<>();

        for (Map.Entry<String, List<ReferencePattern>> entry : patternsByKind.entrySet()) {
            List<Occurrence> accepted = new ArrayList<>();
            for (ReferencePattern pattern : entry.getValue()) {
                Matcher matcher = pattern.regex().matcher(text);
                while (matcher.find()) {
                    Span span = new Span(matcher.start(), matcher.end());
                    if (span.isEmpty()) {
                        continue;
                    }
                    Optional<RegionKind> openedFrom = openedFrom(regions, span, pattern, embedded);
                    if (openedFrom.isEmpty()) {
                        continue;
                    }

                    String raw = matcher.group(ReferencePattern.TARGET_GROUP);
                    ReferenceTarget target;
                    try {
                        target = TargetNormalizer.normalize(raw, pattern);
                    } catch (IllegalArgumentException e) {
                        log.debug("{}: skipping unusable target '{}' at {}: {}", documentKey, raw, span, e.getMessage());
                        continue;
                    }

                    Occurrence overlapped = firstOverlap(accepted, span);
                    if (overlapped != null) {
                        if (overlapped.span().contains(span) && overlapped.target().equals(target)) {
                            log.debug("{}: {} repeats the reference at {}", documentKey, span, overlapped.span());
                            continue;
                        }
                        diagnostics.add(new Diagnostic(
                            DiagnosticKind.AMBIGUOUS_OVERLAP,
                            documentKey,
                            span,
                            "'" + pattern.kind() + "' match " + span + " (" + pattern.encoding()
                                + ") overlaps " + overlapped.span() + " (" + overlapped.encoding()
                                + "); kept the earlier pattern"));
                        continue;
                    }

                    accepted.add(new Occurrence(
                        documentKey,
                        span,
                        regions.lines().lineOf(span.start()),
                        pattern.kind(),
                        raw,
                        target,
                        pattern.encoding(),
                        openedFrom.get(),
                        pattern.declaration()));
                }
            }
            occurrences.addAll(accepted);
        }

        occurrences.sort(Comparator.comparing(Occurrence::span).thenComparing(Occurrence::referenceKind));
        log.debug("{}: {} occurrence(s)", documentKey, occurrences.size());
        return new Extraction(occurrences, diagnostics);
    }

    private static Optional<RegionKind> openedFrom(
        RegionMap regions,
        Span span,
        ReferencePattern pattern,
        Map<Integer, RegionMap> embedded
    ) {
        Region region = regions.regionAt(span.start());
        if (region.kind() != RegionKind.STRING_LITERAL) {
            return Optional.of(region.kind());
        }
        Optional<QuoteDialect> dialect = pattern.encoding().quoteDialect();
        if (dialect.isEmpty()) {
            return Optional.empty();
        }
        if (dialect.get() == region.dialect()) {
            return opensLiteral(region, span, 0) ? Optional.of(RegionKind.CODE) : Optional.empty();
        }
        if (region.dialect() != QuoteDialect.PLAIN || !EMBEDDED_DIALECTS.contains(dialect.get())) {
            return Optional.empty();
        }

        int offset = region.start() + QuoteDialect.PLAIN.delimiter().length();
        RegionMap script = embedded.computeIfAbsent(region.start(), start -> scanEmbedded(regions, region));
        int position = span.start() - offset;
        if (position < 0 || position >= script.text().length()) {
            return Optional.empty();
        }
        Region nested = script.regionAt(position);
        if (nested.kind() == RegionKind.STRING_LITERAL) {
            boolean literalIsTheReference = nested.dialect() == dialect.get() && opensLiteral(nested, span, offset);
            return literalIsTheReference ? Optional.of(RegionKind.CODE) : Optional.empty();
        }
        return Optional.of(nested.kind());
    }

    private static boolean opensLiteral(Region literal, Span span, int offset) {
        return literal.start() + offset == span.start() && span.end() <= literal.end() + offset;
    }

    /**
     * Scans the contents of a plain string literal, without its delimiters, as script.
     */
    private static RegionMap scanEmbedded(RegionMap regions, Region literal) {
        String text = regions.text();
        int start = literal.start() + QuoteDialect.PLAIN.delimiter().length();
        int end = literal.end();
        if (end > start && QuoteDialect.PLAIN.delimiterAt(text, end - 1)) {
            end--;
        }
        return EMBEDDED_SCANNER.scan(regions.documentKey(), text.substring(start, Math.max(start, end)));
    }

    private static Occurrence firstOverlap(List<Occurrence> accepted, Span span) {
        for (Occurrence occurrence : accepted) {
            if (occurrence.span().overlaps(span)) {
                return occurrence;
            }
        }
        return null;
    }

    /**
     * Result of one extraction.
     *
     * @param occurrences occurrences in document order
     * @param diagnostics overlap diagnostics
     */
    public record Extraction(List<Occurrence> occurrences, List<Diagnostic> diagnostics) {

        /**
         * Compact constructor with defaults.
         */
        public Extraction {
            occurrences = occurrences == null ? List.of() : List.copyOf(occurrences);
            diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
        }
    }
}
