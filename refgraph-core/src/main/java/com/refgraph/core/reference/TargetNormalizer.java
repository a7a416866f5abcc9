package com.refgraph.core.reference;

import com.refgraph.core.model.ReferenceTarget;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Locale;

/**
 * Turns a raw target as written into a canonical artifact key.
 *
 * <p>Steps, in order:
 * <ol>
 *   <li>decode the XML entities {@code &amp; &lt; &gt; &quot; &apos;} and numeric references</li>
 *   <li>use {@code /} as the only separator and collapse repeated separators</li>
 *   <li>drop {@code .} segments and resolve {@code ..} segments</li>
 *   <li>prepend the pattern's prefix unless the path already starts with it</li>
 *   <li>append the pattern's suffix when the path does not already end with it (case-insensitive)</li>
 * </ol>
 *
 * <p>The result depends only on the text between the delimiters, so every quoting of the
 * same path yields the same key.
 */
public final class TargetNormalizer {

    private TargetNormalizer() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Normalizes a raw target for a pattern.
     *
     * @param raw target text as written
     * @param pattern pattern that matched it
     * @return canonical target
     * @throws IllegalArgumentException if nothing remains after normalization
     */
    public static ReferenceTarget normalize(String raw, ReferencePattern pattern) {
        return normalize(raw, pattern.prefix(), pattern.suffix());
    }

    /**
     * Normalizes a raw target.
     *
     * @param raw target text as written
     * @param prefix key prefix, may be empty
     * @param suffix required suffix, may be empty
     * @return canonical target
     * @throws IllegalArgumentException if nothing remains after normalization
     */
    public static ReferenceTarget normalize(String raw, String prefix, String suffix) {
        String path = canonicalPath(decodeEntities(raw));
        String canonicalPrefix = prefix.isEmpty() ? "" : canonicalPath(prefix) + "/";
        if (!canonicalPrefix.isEmpty() && !path.startsWith(canonicalPrefix)) {
            path = canonicalPrefix + path;
        }
        if (!suffix.isEmpty() && !path.toLowerCase(Locale.ROOT).endsWith(suffix.toLowerCase(Locale.ROOT))) {
            path = path + suffix;
        }
        if (path.isEmpty()) {
            throw new IllegalArgumentException("target normalizes to an empty key: '" + raw + "'");
        }
        return new ReferenceTarget(path);
    }

    /**
     * Canonical slash-separated form of a path.
     *
     * @param path path with any separators
     * @return path without leading, trailing, repeated, {@code .} or {@code ..} segments
     */
    public static String canonicalPath(String path) {
        Deque<String> segments = new ArrayDeque<>();
        for (String segment : path.replace('\\', '/').split("/")) {
            if (segment.isEmpty() || segment.equals(".")) {
                continue;
            }
            if (segment.equals("..")) {
                if (!segments.isEmpty() && !segments.peekLast().equals("..")) {
                    segments.removeLast();
                } else {
                    segments.addLast(segment);
                }
                continue;
            }
            segments.addLast(segment);
        }
        return String.join("/", segments);
    }

    static String decodeEntities(String text) {
        if (text.indexOf('&') < 0) {
            return text;
        }
        StringBuilder sb = new StringBuilder(text.length());
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            int semi = c == '&' ? text.indexOf(';', i) : -1;
            if (semi > i + 1 && semi - i <= 10) {
                String decoded = decodeEntity(text.substring(i + 1, semi));
                if (decoded != null) {
                    sb.append(decoded);
                    i = semi + 1;
                    continue;
                }
            }
            sb.append(c);
            i++;
        }
        return sb.toString();
    }

    private static String decodeEntity(String name) {
        String named = switch (name) {
            case "amp" -> "&";
            case "lt" -> "<";
            case "gt" -> ">";
            case "quot" -> "\"";
            case "apos" -> "'";
            default -> null;
        };
        if (named != null || !name.startsWith("#")) {
            return named;
        }
        try {
            int codePoint = name.startsWith("#x") || name.startsWith("#X")
                ? Integer.parseInt(name.substring(2), 16)
                : Integer.parseInt(name.substring(1));
            return new String(Character.toChars(codePoint));
        } catch (IllegalArgumentException e) {
            // not a valid character reference; kept verbatim
            return null;
        }
    }
}
