package com.refgraph.core.document;

import com.refgraph.core.model.Span;

import java.io.IOException;

/**
 * Mutation interface used by the pruning phase.
 *
 * <p>Callers in dry-run mode never invoke it; they report the planned actions instead.
 */
public interface ArtifactMutator {

    /**
     * Deletes a document. Deleting a document that no longer exists is a no-op.
     *
     * @param key artifact key
     * @throws IOException if the deletion fails
     */
    void deleteDocument(String key) throws IOException;

    /**
     * Removes a span of text from a document.
     *
     * <p>Spans refer to the document's current text. Callers removing several spans from one
     * document apply them from the highest offset down.
     *
     * @param key artifact key
     * @param span span to remove
     * @throws IOException if the document cannot be read or rewritten
     */
    void removeSpan(String key, Span span) throws IOException;
}
