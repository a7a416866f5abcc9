package com.refgraph.core.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.refgraph.core.graph.ClosureResult;
import com.refgraph.core.graph.MissingReference;
import com.refgraph.core.model.Diagnostic;
import com.refgraph.core.model.InactiveGroup;
import com.refgraph.core.model.SourceLocation;
import com.refgraph.core.prune.PruneAction;
import com.refgraph.core.prune.PruneResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes classification and pruning reports as JSON.
 *
 * <p>The report is built as ordered maps so the output is stable across runs.
 */
public final class JsonReportWriter {

    private static final Logger log = LoggerFactory.getLogger(JsonReportWriter.class);
    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private JsonReportWriter() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Serializes a closure result.
     *
     * @param result closure result
     * @return JSON text
     */
    public static String toJson(ClosureResult result) {
        return write(closureView(result));
    }

    /**
     * Serializes a pruning result.
     *
     * @param result pruning result
     * @return JSON text
     */
    public static String toJson(PruneResult result) {
        return write(pruneView(result));
    }

    /**
     * Writes a closure report to a file.
     *
     * @param result closure result
     * @param output target file; parent directories are created
     * @throws IOException if writing fails
     */
    public static void write(ClosureResult result, Path output) throws IOException {
        writeFile(toJson(result), output);
    }

    /**
     * Writes a pruning report to a file.
     *
     * @param result pruning result
     * @param output target file; parent directories are created
     * @throws IOException if writing fails
     */
    public static void write(PruneResult result, Path output) throws IOException {
        writeFile(toJson(result), output);
    }

    private static void writeFile(String json, Path output) throws IOException {
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(output, json, StandardCharsets.UTF_8);
        log.info("Wrote JSON report to {}", output);
    }

    static Map<String, Object> closureView(ClosureResult result) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("converged", result.converged());
        summary.put("iterations", result.iterations());
        summary.put("roots", result.roots().size());
        summary.put("reachable", result.reachable().size());
        summary.put("orphan", result.orphans().size());
        summary.put("missing", result.missing().size());

        Map<String, Object> orphans = new LinkedHashMap<>();
        orphans.put("comment", List.copyOf(result.commentOrphans()));
        orphans.put("pure", List.copyOf(result.pureOrphans()));

        List<Map<String, Object>> missing = new ArrayList<>();
        for (MissingReference reference : result.missingReferences()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("target", reference.target().key());
            entry.put("sources", reference.sources().stream().map(JsonReportWriter::location).toList());
            Map<String, Object> upstream = new LinkedHashMap<>();
            reference.upstream().forEach((source, referrers) -> upstream.put(source, List.copyOf(referrers)));
            entry.put("upstream", upstream);
            missing.add(entry);
        }

        List<Map<String, Object>> groups = new ArrayList<>();
        for (InactiveGroup group : result.inactiveGroups()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("document", group.documentKey());
            entry.put("start", group.extent().start());
            entry.put("end", group.extent().end());
            entry.put("firstLine", group.firstLine());
            entry.put("lastLine", group.lastLine());
            entry.put("targets", group.targets().stream().map(t -> t.key()).toList());
            groups.add(entry);
        }

        Map<String, Object> states = new LinkedHashMap<>();
        result.states().forEach((key, state) -> states.put(key, state.name()));

        Map<String, Object> view = new LinkedHashMap<>();
        view.put("summary", summary);
        view.put("roots", List.copyOf(result.roots()));
        view.put("states", states);
        view.put("orphans", orphans);
        view.put("missing", missing);
        view.put("inactiveGroups", groups);
        view.put("diagnostics", diagnostics(result.diagnostics()));
        return view;
    }

    static Map<String, Object> pruneView(PruneResult result) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("dryRun", result.dryRun());
        view.put("planned", result.planned().stream().map(JsonReportWriter::action).toList());
        view.put("applied", result.applied().stream().map(JsonReportWriter::action).toList());
        view.put("diagnostics", diagnostics(result.diagnostics()));
        return view;
    }

    private static Map<String, Object> location(SourceLocation location) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("document", location.documentKey());
        entry.put("line", location.line());
        entry.put("start", location.span().start());
        entry.put("end", location.span().end());
        return entry;
    }

    private static Map<String, Object> action(PruneAction action) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("type", action.type().name());
        entry.put("document", action.documentKey());
        if (action.span() != null) {
            entry.put("start", action.span().start());
            entry.put("end", action.span().end());
        }
        entry.put("reason", action.reason().name());
        entry.put("detail", action.detail());
        return entry;
    }

    private static List<Map<String, Object>> diagnostics(List<Diagnostic> diagnostics) {
        List<Map<String, Object>> result = new ArrayList<>();
        for (Diagnostic diagnostic : diagnostics) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("kind", diagnostic.kind().name());
            if (diagnostic.documentKey() != null) {
                entry.put("document", diagnostic.documentKey());
            }
            if (diagnostic.span() != null) {
                entry.put("start", diagnostic.span().start());
                entry.put("end", diagnostic.span().end());
            }
            entry.put("message", diagnostic.message());
            result.add(entry);
        }
        return result;
    }

    private static String write(Map<String, Object> view) {
        try {
            return MAPPER.writeValueAsString(view);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Cannot serialize report", e);
        }
    }
}
