package com.refgraph.core.document;

import com.refgraph.core.model.Document;

import java.util.Optional;
import java.util.SortedSet;

/**
 * Source of documents for one run, addressed by artifact key.
 *
 * <p>A key with no backing document is "not found", never an error. Failure to read an existing
 * document is reported as {@link java.io.UncheckedIOException}.
 */
public interface DocumentProvider {

    /**
     * All keys in the document set.
     *
     * @return keys in lexicographic order
     */
    SortedSet<String> keys();

    /**
     * Loads a document.
     *
     * @param key artifact key
     * @return document, or empty if the key has no backing document
     * @throws java.io.UncheckedIOException if the document exists but cannot be read
     */
    Optional<Document> find(String key);

    /**
     * Existence predicate.
     *
     * @param key artifact key
     * @return true if a document backs the key
     */
    default boolean exists(String key) {
        return keys().contains(key);
    }
}
