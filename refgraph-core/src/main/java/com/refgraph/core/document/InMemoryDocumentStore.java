package com.refgraph.core.document;

import com.refgraph.core.model.Document;
import com.refgraph.core.model.Span;

import java.io.FileNotFoundException;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Document set held in memory. Used by tests and by callers that load documents themselves.
 */
public final class InMemoryDocumentStore implements DocumentProvider, ArtifactMutator {

    private final Map<String, String> texts = new TreeMap<>();

    public InMemoryDocumentStore() {
    }

    public InMemoryDocumentStore(Map<String, String> texts) {
        this.texts.putAll(texts);
    }

    /**
     * Adds or replaces a document.
     *
     * @param key artifact key
     * @param text document text
     * @return this store
     */
    public synchronized InMemoryDocumentStore put(String key, String text) {
        Document document = new Document(key, text);
        texts.put(document.key(), document.text());
        return this;
    }

    /**
     * Current text of a document.
     *
     * @param key artifact key
     * @return text, or {@code null} if absent
     */
    public synchronized String text(String key) {
        return texts.get(key);
    }

    @Override
    public synchronized SortedSet<String> keys() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(texts.keySet()));
    }

    @Override
    public synchronized Optional<Document> find(String key) {
        String text = texts.get(key);
        return text == null ? Optional.empty() : Optional.of(new Document(key, text));
    }

    @Override
    public synchronized boolean exists(String key) {
        return texts.containsKey(key);
    }

    @Override
    public synchronized void deleteDocument(String key) {
        texts.remove(key);
    }

    @Override
    public synchronized void removeSpan(String key, Span span) throws FileNotFoundException {
        String text = texts.get(key);
        if (text == null) {
            throw new FileNotFoundException("No document " + key);
        }
        if (span.end() > text.length()) {
            throw new IllegalArgumentException("span " + span + " outside " + key + " (" + text.length() + " chars)");
        }
        texts.put(key, text.substring(0, span.start()) + text.substring(span.end()));
    }
}
