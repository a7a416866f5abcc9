package com.refgraph.core.prune;

import com.refgraph.core.model.Span;

import java.util.Comparator;
import java.util.Objects;

/**
 * One mutation planned or applied by the pruning phase.
 *
 * @param type deletion of a whole document, or removal of a span from one
 * @param documentKey affected document
 * @param span removed text; {@code null} for document deletions
 * @param reason why the mutation is needed
 * @param detail human-readable detail (e.g. the first line of the removed text)
 */
public record PruneAction(Type type, String documentKey, Span span, Reason reason, String detail) {

    /**
     * Span removals in document order, then deletions in key order.
     */
    public static final Comparator<PruneAction> ORDER = Comparator
        .comparing(PruneAction::type)
        .thenComparing(PruneAction::documentKey)
        .thenComparing(PruneAction::span, Comparator.nullsFirst(Comparator.naturalOrder()));

    private static final int MAX_DETAIL = 80;

    /**
     * Kind of mutation.
     */
    public enum Type {
        REMOVE_SPAN,
        DELETE_DOCUMENT
    }

    /**
     * Why a mutation was planned.
     */
    public enum Reason {
        /** Document unreachable from every root */
        ORPHAN,
        /** Commented-out block referencing only orphans */
        DEAD_BLOCK,
        /** Repeated declaration of an already declared target */
        DUPLICATE_DECLARATION,
        /** Conditional block guarding a name with no definition */
        UNKNOWN_GUARD
    }

    /**
     * Compact constructor with validation.
     */
    public PruneAction {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(documentKey, "documentKey must not be null");
        Objects.requireNonNull(reason, "reason must not be null");
        if ((type == Type.REMOVE_SPAN) != (span != null)) {
            throw new IllegalArgumentException("span is required for, and only for, span removals");
        }
        detail = detail == null ? "" : detail;
    }

    public static PruneAction deleteDocument(String documentKey, Reason reason, String detail) {
        return new PruneAction(Type.DELETE_DOCUMENT, documentKey, null, reason, detail);
    }

    /**
     * Plans a span removal, using the first line of the removed text as detail.
     *
     * @param documentKey affected document
     * @param span span to remove
     * @param reason reason
     * @param text current document text
     * @return action
     */
    public static PruneAction removeSpan(String documentKey, Span span, Reason reason, String text) {
        return new PruneAction(Type.REMOVE_SPAN, documentKey, span, reason, excerpt(span.slice(text)));
    }

    static String excerpt(String removed) {
        String line = removed.strip();
        int newline = line.indexOf('\n');
        if (newline >= 0) {
            line = line.substring(0, newline).stripTrailing() + " ...";
        }
        return line.length() > MAX_DETAIL ? line.substring(0, MAX_DETAIL) + "..." : line;
    }

    @Override
    public String toString() {
        return switch (type) {
            case DELETE_DOCUMENT -> "delete " + documentKey + " (" + reason + ")";
            case REMOVE_SPAN -> "remove " + documentKey + " " + span + " (" + reason + "): " + detail;
        };
    }
}
