package com.refgraph.core.scanner;

import com.refgraph.core.model.BlockSpan;
import com.refgraph.core.model.Diagnostic;
import com.refgraph.core.model.Document;
import com.refgraph.core.model.NamedBlock;
import com.refgraph.core.model.RegionKind;
import com.refgraph.core.model.Span;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Index of the class definitions in a script document.
 *
 * <p>A definition is {@code class Name [: Parent] { ... }} optionally followed by {@code ;}.
 * Headers inside comments or strings are ignored, and each body is delimited with
 * {@link LexicalScanner#findMatchingBrace(String, int)} so that braces inside string
 * literals (e.g. {@code "{54,205,45}"}) cannot cut a class short or swallow its neighbours.
 *
 * <p>Definitions whose body is never closed are skipped and reported as diagnostics.
 */
public final class ClassBlockIndex {

    private static final Pattern CLASS_HEADER =
        Pattern.compile("\\bclass\\s+(\\w+)\\s*(?::\\s*(\\w+))?\\s*\\{");

    private final List<NamedBlock> blocks;
    private final List<Diagnostic> diagnostics;

    private ClassBlockIndex(List<NamedBlock> blocks, List<Diagnostic> diagnostics) {
        this.blocks = List.copyOf(blocks);
        this.diagnostics = List.copyOf(diagnostics);
    }

    /**
     * Builds the index for a script document.
     *
     * @param document script document
     * @param scanner scanner used for regions and brace matching
     * @return class index
     */
    public static ClassBlockIndex of(Document document, LexicalScanner scanner) {
        String text = document.text();
        RegionMap regions = scanner.scan(document);
        List<NamedBlock> blocks = new ArrayList<>();
        List<Diagnostic> diagnostics = new ArrayList<>();

        Matcher matcher = CLASS_HEADER.matcher(text);
        int searchFrom = 0;
        while (matcher.find(searchFrom)) {
            int start = matcher.start();
            int bracePos = matcher.end() - 1;
            searchFrom = matcher.end();

            if (regions.kindAt(start) != RegionKind.CODE || regions.kindAt(bracePos) != RegionKind.CODE) {
                continue;
            }

            BraceMatch match = scanner.findMatchingBrace(text, bracePos);
            Optional<BlockSpan> body = match.block();
            if (body.isEmpty()) {
                diagnostics.add(match.toDiagnostic(document.key()));
                continue;
            }

            int end = body.get().closePos() + 1;
            int next = end;
            while (next < text.length() && (text.charAt(next) == ' ' || text.charAt(next) == '\t' || text.charAt(next) == '\r')) {
                next++;
            }
            if (next < text.length() && text.charAt(next) == ';') {
                end = next + 1;
            }

            blocks.add(new NamedBlock(
                matcher.group(1),
                matcher.group(2),
                new Span(start, bracePos + 1),
                body.get(),
                new Span(start, end)));
            // classes do not nest; resume after the body
            searchFrom = end;
        }

        return new ClassBlockIndex(blocks, diagnostics);
    }

    public List<NamedBlock> blocks() {
        return blocks;
    }

    public List<Diagnostic> diagnostics() {
        return diagnostics;
    }

    /**
     * Declared class names in document order.
     *
     * @return class names
     */
    public Set<String> names() {
        Set<String> names = new LinkedHashSet<>();
        blocks.forEach(b -> names.add(b.name()));
        return Collections.unmodifiableSet(names);
    }

    /**
     * Finds a class by name.
     *
     * @param name class name
     * @return block, or empty if not defined
     */
    public Optional<NamedBlock> find(String name) {
        return blocks.stream().filter(b -> b.name().equals(name)).findFirst();
    }
}
