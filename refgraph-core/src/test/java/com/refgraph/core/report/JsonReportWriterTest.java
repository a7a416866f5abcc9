package com.refgraph.core.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.refgraph.core.analysis.DocumentAnalyzer;
import com.refgraph.core.document.InMemoryDocumentStore;
import com.refgraph.core.graph.ClosureEngine;
import com.refgraph.core.graph.ClosureOptions;
import com.refgraph.core.graph.ClosureResult;
import com.refgraph.core.prune.PruneOptions;
import com.refgraph.core.prune.PruneResult;
import com.refgraph.core.prune.PruningExecutor;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link JsonReportWriter}.
 */
class JsonReportWriterTest {

    private static final String MAIN = "panels/vision/main.xml";
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path tempDir;

    private final DocumentAnalyzer analyzer = DocumentAnalyzer.defaults();
    private final InMemoryDocumentStore store = new InMemoryDocumentStore()
        .put(MAIN, "open(\"objects/objects_A/gone.xml\");\n")
        .put("panels/objects/objects_A/d.xml", "");

    @Test
    void write_closureResult_producesReadableReport() throws IOException {
        ClosureResult result = new ClosureEngine(analyzer, ClosureOptions.defaults()).run(Set.of(MAIN), store);
        Path output = tempDir.resolve("reports/closure.json");

        JsonReportWriter.write(result, output);

        JsonNode json = MAPPER.readTree(output.toFile());
        assertThat(json.at("/summary/converged").asBoolean()).isTrue();
        assertThat(json.at("/summary/reachable").asInt()).isEqualTo(1);
        assertThat(json.at("/states/panels~1objects~1objects_A~1d.xml").asText()).isEqualTo("ORPHAN");
        assertThat(json.at("/orphans/pure/0").asText()).isEqualTo("panels/objects/objects_A/d.xml");
        assertThat(json.at("/missing/0/target").asText()).isEqualTo("panels/objects/objects_A/gone.xml");
        assertThat(json.at("/missing/0/sources/0/line").asInt()).isEqualTo(1);
    }

    @Test
    void toJson_pruneResult_listsActions() throws IOException {
        ClosureResult closure = new ClosureEngine(analyzer, ClosureOptions.defaults()).run(Set.of(MAIN), store);
        PruneResult prune = new PruningExecutor(analyzer).execute(closure, store, store, PruneOptions.dryRun());

        JsonNode json = MAPPER.readTree(JsonReportWriter.toJson(prune));

        assertThat(json.get("dryRun").asBoolean()).isTrue();
        assertThat(json.get("planned")).hasSize(1);
        assertThat(json.get("applied")).isEmpty();
    }

    @Test
    void toJson_sameResult_isStable() {
        ClosureResult result = new ClosureEngine(analyzer, ClosureOptions.defaults()).run(Set.of(MAIN), store);

        assertThat(JsonReportWriter.toJson(result)).isEqualTo(JsonReportWriter.toJson(result));
    }
}
