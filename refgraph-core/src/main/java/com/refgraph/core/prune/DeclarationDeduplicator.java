package com.refgraph.core.prune;

import com.refgraph.core.analysis.DocumentAnalysis;
import com.refgraph.core.model.ClassifiedOccurrence;
import com.refgraph.core.model.ReferenceTarget;
import com.refgraph.core.model.Region;
import com.refgraph.core.model.RegionKind;
import com.refgraph.core.model.Span;
import com.refgraph.core.model.TargetEncoding;
import com.refgraph.core.scanner.LineIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Plans the removal of repeated declarations within one document.
 *
 * <p>Among the active declaration occurrences of a document, the first per target is kept. Each
 * later one is removed with its whole line, but only when nothing else shares that line.
 *
 * <p>Declarations are compared within one script: same quoting and same container. A script
 * stored in an attribute value is its own container, so a declaration there never duplicates one
 * in a CDATA section or in another attribute.
 */
public final class DeclarationDeduplicator {

    private static final Logger log = LoggerFactory.getLogger(DeclarationDeduplicator.class);

    /**
     * Plans removals for one document.
     *
     * @param analysis analysis of the document
     * @return span removals in document order
     */
    public List<PruneAction> plan(DocumentAnalysis analysis) {
        String text = analysis.document().text();
        LineIndex lines = analysis.regions().lines();
        Set<DeclarationKey> declared = new HashSet<>();
        List<PruneAction> actions = new ArrayList<>();

        for (ClassifiedOccurrence occurrence : analysis.activeOccurrences()) {
            if (!occurrence.occurrence().declaration()) {
                continue;
            }
            if (declared.add(keyOf(analysis, occurrence))) {
                continue;
            }
            int line = occurrence.occurrence().line();
            Span span = occurrence.span();
            String before = text.substring(lines.lineStart(line), span.start());
            String after = text.substring(span.end(), Math.max(span.end(), lines.contentEnd(line)));
            if (!before.isBlank() || !after.isBlank()) {
                log.debug("{}:{}: duplicate declaration of {} shares its line, kept",
                    analysis.key(), line, occurrence.target());
                continue;
            }
            actions.add(PruneAction.removeSpan(
                analysis.key(), lines.fullLine(line), PruneAction.Reason.DUPLICATE_DECLARATION, text));
        }
        return actions;
    }

    private static DeclarationKey keyOf(DocumentAnalysis analysis, ClassifiedOccurrence occurrence) {
        Region outer = analysis.regions().regionAt(occurrence.span().start());
        int container = outer.kind() == RegionKind.STRING_LITERAL ? outer.start() : -1;
        return new DeclarationKey(occurrence.occurrence().encoding(), container, occurrence.target());
    }

    private record DeclarationKey(TargetEncoding encoding, int container, ReferenceTarget target) {
    }
}
