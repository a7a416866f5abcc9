package com.refgraph.core.document;

import com.refgraph.core.model.Document;
import com.refgraph.core.model.Span;
import com.refgraph.core.util.GlobMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * Document set backed by a directory tree.
 *
 * <p>Keys are paths relative to the root, always separated by {@code /}. The key set is listed
 * once, on first use, and kept in step with deletions made through this store.
 *
 * <p>Reads fall back from UTF-8 to windows-1251 ({@link TextDecoding}). Rewrites are UTF-8 and
 * change nothing but the removed span. Deleting a document also removes directories left empty
 * below the root.
 */
public final class FileSystemDocumentStore implements DocumentProvider, ArtifactMutator {

    private static final Logger log = LoggerFactory.getLogger(FileSystemDocumentStore.class);

    private final Path root;
    private final GlobMatcher include;
    private final GlobMatcher exclude;
    private SortedSet<String> keys;

    /**
     * Creates a store.
     *
     * @param root root directory
     * @param include key patterns to include; empty includes everything
     * @param exclude key patterns to exclude
     */
    public FileSystemDocumentStore(Path root, List<String> include, List<String> exclude) {
        this.root = Objects.requireNonNull(root, "root must not be null").toAbsolutePath().normalize();
        this.include = GlobMatcher.of(include == null ? List.of() : include);
        this.exclude = GlobMatcher.of(exclude == null ? List.of() : exclude);
    }

    public Path root() {
        return root;
    }

    @Override
    public synchronized SortedSet<String> keys() {
        if (keys == null) {
            keys = listKeys();
        }
        return Collections.unmodifiableSortedSet(new TreeSet<>(keys));
    }

    @Override
    public synchronized boolean exists(String key) {
        if (keys == null) {
            keys = listKeys();
        }
        return keys.contains(key);
    }

    @Override
    public Optional<Document> find(String key) {
        if (!exists(key)) {
            return Optional.empty();
        }
        try {
            return Optional.of(new Document(key, read(resolve(key))));
        } catch (NoSuchFileException e) {
            log.debug("{} vanished since listing", key);
            return Optional.empty();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + key, e);
        }
    }

    @Override
    public synchronized void deleteDocument(String key) throws IOException {
        Path path = resolve(key);
        if (Files.deleteIfExists(path)) {
            log.debug("Deleted {}", key);
        }
        if (keys != null) {
            keys.remove(key);
        }
        deleteEmptyParents(path.getParent());
    }

    @Override
    public synchronized void removeSpan(String key, Span span) throws IOException {
        Path path = resolve(key);
        String text = read(path);
        if (span.end() > text.length()) {
            throw new IOException("Span " + span + " outside " + key + " (" + text.length() + " chars)");
        }
        Files.writeString(path, text.substring(0, span.start()) + text.substring(span.end()), StandardCharsets.UTF_8);
        log.debug("Removed {} from {}", span, key);
    }

    private SortedSet<String> listKeys() {
        SortedSet<String> result = new TreeSet<>();
        if (!Files.isDirectory(root)) {
            log.warn("Document root {} is not a directory", root);
            return result;
        }
        try (Stream<Path> paths = Files.walk(root)) {
            paths.filter(Files::isRegularFile)
                .map(this::keyOf)
                .filter(key -> include.isEmpty() || include.matches(key))
                .filter(key -> !exclude.matches(key))
                .forEach(result::add);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list " + root, e);
        }
        log.debug("Listed {} document(s) under {}", result.size(), root);
        return result;
    }

    private String keyOf(Path path) {
        return root.relativize(path).toString().replace('\\', '/');
    }

    private Path resolve(String key) {
        Path path = root.resolve(key).normalize();
        if (!path.startsWith(root)) {
            throw new IllegalArgumentException("Key escapes the document root: " + key);
        }
        return path;
    }

    private static String read(Path path) throws IOException {
        return TextDecoding.decode(Files.readAllBytes(path));
    }

    private void deleteEmptyParents(Path directory) throws IOException {
        Path current = directory;
        while (current != null && current.startsWith(root) && !current.equals(root)) {
            try (Stream<Path> children = Files.list(current)) {
                if (children.findAny().isPresent()) {
                    return;
                }
            } catch (NoSuchFileException e) {
                current = current.getParent();
                continue;
            }
            try {
                Files.delete(current);
                log.debug("Removed empty directory {}", root.relativize(current));
            } catch (DirectoryNotEmptyException e) {
                log.debug("{} is no longer empty", current);
                return;
            }
            current = current.getParent();
        }
    }
}
