package com.refgraph.core.document;

import com.refgraph.core.model.Document;
import com.refgraph.core.model.Span;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AccessDeniedException;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;

/**
 * In-memory store whose chosen documents fail to read or to change.
 */
public final class FailingDocumentStore implements DocumentProvider, ArtifactMutator {

    private final InMemoryDocumentStore delegate;
    private final Set<String> unreadable = new HashSet<>();
    private final Set<String> immutable = new HashSet<>();

    public FailingDocumentStore(InMemoryDocumentStore delegate) {
        this.delegate = delegate;
    }

    public FailingDocumentStore unreadable(String key) {
        unreadable.add(key);
        return this;
    }

    public FailingDocumentStore immutable(String key) {
        immutable.add(key);
        return this;
    }

    @Override
    public SortedSet<String> keys() {
        return delegate.keys();
    }

    @Override
    public Optional<Document> find(String key) {
        if (unreadable.contains(key)) {
            throw new UncheckedIOException(new AccessDeniedException(key));
        }
        return delegate.find(key);
    }

    @Override
    public void deleteDocument(String key) throws IOException {
        if (immutable.contains(key)) {
            throw new AccessDeniedException(key);
        }
        delegate.deleteDocument(key);
    }

    @Override
    public void removeSpan(String key, Span span) throws IOException {
        if (immutable.contains(key)) {
            throw new AccessDeniedException(key);
        }
        delegate.removeSpan(key, span);
    }
}
