package com.refgraph.core.analysis;

import com.refgraph.core.document.DocumentProvider;
import com.refgraph.core.model.Diagnostic;
import com.refgraph.core.model.DiagnosticKind;
import com.refgraph.core.model.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Per-run cache of document analyses, keyed by artifact key.
 *
 * <p>Each document is loaded and analyzed at most once per cache. Entries are never
 * invalidated; a new run uses a new cache. A document that exists but cannot be read is cached
 * as an analysis of empty text carrying an {@link DiagnosticKind#UNREADABLE_DOCUMENT}
 * diagnostic, so one bad file never aborts a run.
 *
 * <p>Analyses of different documents are independent, so {@link #preload(Collection, int)} may
 * compute them on several threads. Lookups are thread-safe.
 */
public final class AnalysisCache {

    private static final Logger log = LoggerFactory.getLogger(AnalysisCache.class);

    private final DocumentAnalyzer analyzer;
    private final DocumentProvider provider;
    private final Map<String, Optional<DocumentAnalysis>> entries = new ConcurrentHashMap<>();

    public AnalysisCache(DocumentAnalyzer analyzer, DocumentProvider provider) {
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer must not be null");
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
    }

    /**
     * Returns the analysis of a document, computing it on first access.
     *
     * @param key artifact key
     * @return analysis, or empty if no document backs the key
     */
    public Optional<DocumentAnalysis> get(String key) {
        return entries.computeIfAbsent(key, this::load);
    }

    /**
     * Analyzes a batch of documents ahead of use.
     *
     * @param keys keys to analyze
     * @param parallelism number of worker threads; 1 or less analyzes on the calling thread
     */
    public void preload(Collection<String> keys, int parallelism) {
        if (parallelism <= 1 || keys.size() < 2) {
            keys.forEach(this::get);
            return;
        }
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(parallelism, keys.size()));
        try {
            CompletableFuture<?>[] futures = keys.stream()
                .map(key -> CompletableFuture.runAsync(() -> get(key), executor))
                .toArray(CompletableFuture[]::new);
            CompletableFuture.allOf(futures).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        } finally {
            executor.shutdown();
        }
        log.debug("Preloaded {} analyses on {} threads", keys.size(), parallelism);
    }

    /**
     * Diagnostics of every cached analysis, in key order.
     *
     * @return diagnostics
     */
    public List<Diagnostic> diagnostics() {
        return entries.entrySet().stream()
            .sorted(Map.Entry.comparingByKey())
            .flatMap(e -> e.getValue().stream())
            .flatMap(a -> a.diagnostics().stream())
            .toList();
    }

    public int size() {
        return entries.size();
    }

    private Optional<DocumentAnalysis> load(String key) {
        Optional<Document> document;
        try {
            document = provider.find(key);
        } catch (UncheckedIOException e) {
            log.warn("Cannot read {}: {}", key, e.getCause().getMessage());
            Document empty = new Document(key, "");
            DocumentAnalysis blank = analyzer.analyze(empty);
            return Optional.of(new DocumentAnalysis(
                empty,
                blank.regions(),
                List.of(),
                List.of(),
                List.of(Diagnostic.of(DiagnosticKind.UNREADABLE_DOCUMENT, key,
                    "Unreadable: " + e.getCause().getMessage()))));
        }
        return document.map(analyzer::analyze);
    }
}
