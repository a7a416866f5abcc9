package com.refgraph.core.prune;

import com.refgraph.core.document.ArtifactMutator;
import com.refgraph.core.document.DocumentProvider;
import com.refgraph.core.model.Diagnostic;
import com.refgraph.core.model.DiagnosticKind;
import com.refgraph.core.model.Document;
import com.refgraph.core.model.Region;
import com.refgraph.core.model.RegionKind;
import com.refgraph.core.model.Span;
import com.refgraph.core.scanner.BraceMatch;
import com.refgraph.core.scanner.ClassBlockIndex;
import com.refgraph.core.scanner.LexicalScanner;
import com.refgraph.core.scanner.RegionMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;

/**
 * Removes conditional blocks guarding names that have no definition.
 *
 * <p>For each guard match opened from code whose name is unknown:
 * <ol>
 *   <li>whitespace and comments after the guard are skipped up to the opening brace</li>
 *   <li>the body is delimited with {@link LexicalScanner#findMatchingBrace(String, int)}; an
 *       unclosed body is reported as {@link DiagnosticKind#UNMATCHED_DELIMITER} and kept</li>
 *   <li>a guard alone on its line is removed with its indentation and line break</li>
 * </ol>
 *
 * <p>Guards followed by {@code else} are kept, since removing them would orphan the else branch,
 * and so are guards preceded by {@code else}, which would leave the else without a statement.
 * When candidate blocks nest or overlap, only the outermost is removed.
 */
public final class GuardedBlockPruner {

    private static final Logger log = LoggerFactory.getLogger(GuardedBlockPruner.class);

    private final LexicalScanner scanner;
    private final List<GuardRule> rules;

    public GuardedBlockPruner(LexicalScanner scanner, List<GuardRule> rules) {
        this.scanner = Objects.requireNonNull(scanner, "scanner must not be null");
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules must not be null"));
    }

    public static GuardedBlockPruner structGuards() {
        return new GuardedBlockPruner(LexicalScanner.forMarkup(), GuardRule.structGuards());
    }

    /**
     * Collects the names a governing script defines, plus protected names.
     *
     * @param script governing script
     * @param protectedNames names that are always considered defined
     * @return known names, sorted
     */
    public static Set<String> knownNames(Document script, Collection<String> protectedNames) {
        ClassBlockIndex index = ClassBlockIndex.of(script, LexicalScanner.forScripts());
        index.diagnostics().forEach(d -> log.warn("{}", d));
        Set<String> names = new TreeSet<>(index.names());
        names.addAll(protectedNames);
        return names;
    }

    /**
     * Plans the removals for one document.
     *
     * @param document document to inspect
     * @param knownNames defined names
     * @return planned removals and diagnostics
     */
    public Plan plan(Document document, Set<String> knownNames) {
        String text = document.text();
        RegionMap regions = scanner.scan(document);
        List<Diagnostic> diagnostics = new ArrayList<>();
        List<Candidate> candidates = new ArrayList<>();

        for (GuardRule rule : rules) {
            Matcher matcher = rule.pattern().matcher(text);
            while (matcher.find()) {
                if (regions.kindAt(matcher.start()) != RegionKind.CODE) {
                    continue;
                }
                String name = matcher.group(GuardRule.NAME_GROUP);
                if (knownNames.contains(name)) {
                    continue;
                }
                if (endsWithKeyword(text, matcher.start(), "else")) {
                    log.info("{}: guard for {} continues an else; left in place", document.key(), name);
                    continue;
                }
                int brace = skipToCode(regions, matcher.end());
                if (brace >= text.length() || text.charAt(brace) != '{') {
                    log.debug("{}: {} for {} has no braced body", document.key(), rule.description(), name);
                    continue;
                }
                BraceMatch match = scanner.findMatchingBrace(text, brace);
                if (!match.isMatched()) {
                    diagnostics.add(match.toDiagnostic(document.key()));
                    continue;
                }
                int after = skipToCode(regions, match.closePos() + 1);
                if (startsWithKeyword(text, after, "else")) {
                    log.info("{}: guard for {} has an else branch; left in place", document.key(), name);
                    continue;
                }
                candidates.add(new Candidate(extent(text, matcher.start(), match.closePos() + 1), name));
            }
        }

        candidates.sort(Comparator.comparingInt((Candidate c) -> c.span().start())
            .thenComparing(c -> c.span().end(), Comparator.reverseOrder()));
        List<PruneAction> actions = new ArrayList<>();
        List<Span> kept = new ArrayList<>();
        for (Candidate candidate : candidates) {
            if (kept.stream().anyMatch(s -> s.overlaps(candidate.span()))) {
                continue;
            }
            kept.add(candidate.span());
            actions.add(new PruneAction(PruneAction.Type.REMOVE_SPAN, document.key(), candidate.span(),
                PruneAction.Reason.UNKNOWN_GUARD, "guard " + candidate.name()));
        }
        return new Plan(actions, diagnostics);
    }

    /**
     * Plans, and optionally applies, removals across documents.
     *
     * @param keys documents to inspect
     * @param provider document set
     * @param knownNames defined names
     * @param mutator mutation interface, used only when applying
     * @param apply whether to apply
     * @return planned and applied actions
     */
    public PruneResult execute(
        Collection<String> keys,
        DocumentProvider provider,
        Set<String> knownNames,
        ArtifactMutator mutator,
        boolean apply
    ) {
        List<PruneAction> planned = new ArrayList<>();
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (String key : new TreeSet<>(keys)) {
            Optional<Document> document;
            try {
                document = provider.find(key);
            } catch (UncheckedIOException e) {
                log.warn("Cannot read {}: {}", key, e.getCause().getMessage());
                diagnostics.add(Diagnostic.of(DiagnosticKind.UNREADABLE_DOCUMENT, key, "Unreadable: " + e.getCause().getMessage()));
                continue;
            }
            document.ifPresent(d -> {
                Plan plan = plan(d, knownNames);
                planned.addAll(plan.actions());
                diagnostics.addAll(plan.diagnostics());
            });
        }

        planned.sort(PruneAction.ORDER);
        List<PruneAction> applied = List.of();
        if (apply && !planned.isEmpty()) {
            Objects.requireNonNull(mutator, "mutator must not be null when applying");
            applied = ActionApplier.apply(planned, mutator, diagnostics);
        }
        log.info("Guarded blocks: {} planned, {} applied in {} document(s)", planned.size(), applied.size(), keys.size());
        return new PruneResult(planned, applied, diagnostics, !apply);
    }

    private static int skipToCode(RegionMap regions, int from) {
        String text = regions.text();
        int i = from;
        while (i < text.length()) {
            if (Character.isWhitespace(text.charAt(i))) {
                i++;
                continue;
            }
            Region region = regions.regionAt(i);
            if (region.kind().isComment()) {
                i = region.end();
                continue;
            }
            break;
        }
        return i;
    }

    private static boolean startsWithKeyword(String text, int offset, String keyword) {
        int end = offset + keyword.length();
        return text.startsWith(keyword, offset)
            && (end >= text.length() || !Character.isJavaIdentifierPart(text.charAt(end)));
    }

    private static boolean endsWithKeyword(String text, int offset, String keyword) {
        int end = offset;
        while (end > 0 && Character.isWhitespace(text.charAt(end - 1))) {
            end--;
        }
        int start = end - keyword.length();
        return start >= 0
            && text.startsWith(keyword, start)
            && (start == 0 || !Character.isJavaIdentifierPart(text.charAt(start - 1)));
    }

    private static Span extent(String text, int guardStart, int blockEnd) {
        int start = guardStart;
        while (start > 0 && (text.charAt(start - 1) == ' ' || text.charAt(start - 1) == '\t')) {
            start--;
        }
        boolean aloneOnLine = start == 0 || text.charAt(start - 1) == '\n' || text.charAt(start - 1) == '\r';
        if (!aloneOnLine) {
            return new Span(guardStart, blockEnd);
        }
        int end = blockEnd;
        while (end < text.length() && (text.charAt(end) == ' ' || text.charAt(end) == '\t')) {
            end++;
        }
        if (text.startsWith("\r\n", end)) {
            return new Span(start, end + 2);
        }
        if (end < text.length() && (text.charAt(end) == '\n' || text.charAt(end) == '\r')) {
            return new Span(start, end + 1);
        }
        return end == text.length() ? new Span(start, end) : new Span(guardStart, blockEnd);
    }

    /**
     * Removals planned for one document.
     *
     * @param actions span removals
     * @param diagnostics unmatched bodies
     */
    public record Plan(List<PruneAction> actions, List<Diagnostic> diagnostics) {

        /**
         * Compact constructor with defaults.
         */
        public Plan {
            actions = actions == null ? List.of() : List.copyOf(actions);
            diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
        }
    }

    private record Candidate(Span span, String name) {
    }
}
