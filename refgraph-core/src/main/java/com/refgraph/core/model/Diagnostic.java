package com.refgraph.core.model;

import java.util.Objects;

/**
 * A reported condition.
 *
 * @param kind condition kind
 * @param documentKey affected document, or {@code null} for run-wide conditions
 * @param span affected text, or {@code null} when not tied to a location
 * @param message human-readable detail
 */
public record Diagnostic(DiagnosticKind kind, String documentKey, Span span, String message) {

    /**
     * Compact constructor with validation.
     */
    public Diagnostic {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    public static Diagnostic of(DiagnosticKind kind, String documentKey, String message) {
        return new Diagnostic(kind, documentKey, null, message);
    }

    public static Diagnostic global(DiagnosticKind kind, String message) {
        return new Diagnostic(kind, null, null, message);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(kind.name());
        if (documentKey != null) {
            sb.append(' ').append(documentKey);
        }
        if (span != null) {
            sb.append(' ').append(span);
        }
        return sb.append(": ").append(message).toString();
    }
}
