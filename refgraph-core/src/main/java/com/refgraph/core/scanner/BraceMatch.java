package com.refgraph.core.scanner;

import com.refgraph.core.model.BlockSpan;
import com.refgraph.core.model.Diagnostic;
import com.refgraph.core.model.DiagnosticKind;
import com.refgraph.core.model.Span;

import java.util.Optional;

/**
 * Outcome of brace matching from an opening brace.
 *
 * @param openPos offset of the opening brace
 * @param closePos offset of the matching closing brace, or -1 when unmatched
 */
public record BraceMatch(int openPos, int closePos) {

    public static BraceMatch unmatched(int openPos) {
        return new BraceMatch(openPos, -1);
    }

    public boolean isMatched() {
        return closePos >= 0;
    }

    /**
     * Converts a successful match to a block span.
     *
     * @return block span, or empty when unmatched
     */
    public Optional<BlockSpan> block() {
        return isMatched() ? Optional.of(new BlockSpan(openPos, closePos)) : Optional.empty();
    }

    /**
     * Builds the diagnostic for an unmatched brace.
     *
     * @param documentKey document the brace belongs to
     * @return unmatched-delimiter diagnostic
     */
    public Diagnostic toDiagnostic(String documentKey) {
        return new Diagnostic(
            DiagnosticKind.UNMATCHED_DELIMITER,
            documentKey,
            new Span(openPos, openPos + 1),
            "No closing brace for '{' at offset " + openPos);
    }
}
