package com.refgraph.core.model;

/**
 * Recoverable conditions surfaced in reports.
 *
 * <p>None of these abort a run; each is scoped to one document or to the closure.
 */
public enum DiagnosticKind {
    /** A string, comment or brace opener has no closer before the end of the document */
    UNMATCHED_DELIMITER,
    /** The closure hit its iteration cap; the classification is partial */
    CLOSURE_DID_NOT_CONVERGE,
    /** Two patterns of the same kind matched overlapping text; the earlier pattern won */
    AMBIGUOUS_OVERLAP,
    /** Re-confirmation before deletion disagreed with the closure result; nothing was deleted */
    STALE_CLASSIFICATION,
    /** A deleted artifact was still mentioned inside comments of a surviving document */
    INACTIVE_ONLY_REFERENCE,
    /** A document could not be read or decoded */
    UNREADABLE_DOCUMENT,
    /** A declared root has no backing document */
    MISSING_ROOT,
    /** A mutation could not be applied */
    MUTATION_FAILED
}
