package com.refgraph.core.util;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Matches slash-separated artifact keys against a set of glob patterns.
 *
 * <p>A key matches when any pattern matches. A {@code **}{@code /} segment also matches zero
 * directories, so {@code **}{@code /*.xml} accepts {@code top.xml} and
 * {@code mnemo/**}{@code /*.xml} accepts {@code mnemo/main.xml}.
 */
public final class GlobMatcher {

    // Java's PathMatcher ** does not match zero directories
    private static final String ANY_DIRS = "**/";
    private static final String ANY_DIRS_OR_NONE = "{**/,}";

    private final List<String> patterns;
    private final List<PathMatcher> matchers;

    private GlobMatcher(List<String> patterns) {
        this.patterns = List.copyOf(patterns);
        this.matchers = this.patterns.stream().map(GlobMatcher::compile).toList();
    }

    /**
     * Creates a matcher for the given patterns.
     *
     * @param patterns glob patterns, may be empty
     * @return matcher
     */
    public static GlobMatcher of(Collection<String> patterns) {
        Objects.requireNonNull(patterns, "patterns must not be null");
        return new GlobMatcher(List.copyOf(patterns));
    }

    public static GlobMatcher of(String... patterns) {
        return new GlobMatcher(List.of(patterns));
    }

    public List<String> patterns() {
        return patterns;
    }

    public boolean isEmpty() {
        return patterns.isEmpty();
    }

    /**
     * Checks a key against the patterns.
     *
     * @param key slash-separated key
     * @return true if any pattern matches
     */
    public boolean matches(String key) {
        Path path = Paths.get(key);
        for (PathMatcher matcher : matchers) {
            if (matcher.matches(path)) {
                return true;
            }
        }
        return false;
    }

    private static PathMatcher compile(String pattern) {
        String glob = pattern.replace("/" + ANY_DIRS, "/" + ANY_DIRS_OR_NONE);
        if (glob.startsWith(ANY_DIRS)) {
            glob = ANY_DIRS_OR_NONE + glob.substring(ANY_DIRS.length());
        }
        return FileSystems.getDefault().getPathMatcher("glob:" + glob);
    }

    @Override
    public String toString() {
        return "GlobMatcher" + patterns;
    }
}
