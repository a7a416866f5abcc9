package com.refgraph.core.prune;

import com.refgraph.core.document.InMemoryDocumentStore;
import com.refgraph.core.model.DiagnosticKind;
import com.refgraph.core.model.Document;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link GuardedBlockPruner}.
 */
class GuardedBlockPrunerTest {

    private static final String PANEL = "panels/objects/objects_A/pump.xml";

    private final GuardedBlockPruner pruner = GuardedBlockPruner.structGuards();

    @Test
    void knownNames_scriptClassesPlusProtected_areMerged() {
        Document script = new Document("scripts/libs/struct.ctl", """
            class PUMP { string c = "}"; };
            // class OLD { }
            class VALVE : PUMP { }
            """);

        Set<String> names = GuardedBlockPruner.knownNames(script, List.of("SPECIAL"));

        assertThat(names).containsExactly("PUMP", "SPECIAL", "VALVE");
    }

    @Test
    void execute_unknownGuards_removedKnownAndElseKept() {
        // Given
        String text = """
            main()
            {
              if (settings["struct"] == "PUMP") {
                draw("{pump}");
              }
              if (settings["struct"] == "OLD")
              {
                draw("}");
              }
              x = 1; if (settings["struct"] == "GONE") { y(); } z = 2;
              // if (settings["struct"] == "COMMENTED") { a(); }
              if (settings["struct"] == "ELSE") { b(); } else { c(); }
            }
            """;
        InMemoryDocumentStore store = new InMemoryDocumentStore().put(PANEL, text);

        // When
        PruneResult result = pruner.execute(List.of(PANEL), store, Set.of("PUMP"), store, true);

        // Then
        assertThat(result.planned()).extracting(PruneAction::detail).containsExactly("guard OLD", "guard GONE");
        assertThat(store.text(PANEL)).isEqualTo("""
            main()
            {
              if (settings["struct"] == "PUMP") {
                draw("{pump}");
              }
              x = 1;  z = 2;
              // if (settings["struct"] == "COMMENTED") { a(); }
              if (settings["struct"] == "ELSE") { b(); } else { c(); }
            }
            """);
    }

    @Test
    void plan_entityQuotedGuard_isRemovedWholeLine() {
        String text = "a();\n  if (settings[&quot;struct&quot;] == &quot;OLD&quot;) { draw(&quot;}&quot;); }\nb();\n";

        GuardedBlockPruner.Plan plan = pruner.plan(new Document(PANEL, text), Set.of());

        assertThat(plan.actions()).singleElement().satisfies(action ->
            assertThat(action.span().slice(text)).isEqualTo(
                "  if (settings[&quot;struct&quot;] == &quot;OLD&quot;) { draw(&quot;}&quot;); }\n"));
    }

    @Test
    void plan_nestedUnknownGuards_removesOutermostOnly() {
        String text = """
            if (settings["struct"] == "OUTER") {
              if (settings["struct"] == "INNER") { x(); }
            }
            """;

        GuardedBlockPruner.Plan plan = pruner.plan(new Document(PANEL, text), Set.of());

        assertThat(plan.actions()).singleElement().satisfies(action -> {
            assertThat(action.detail()).isEqualTo("guard OUTER");
            assertThat(action.span().slice(text)).isEqualTo(text);
        });
    }

    @Test
    void plan_guardAfterElse_isKept() {
        // Given
        String text = """
            if (a) { b(); } else if (settings["struct"] == "Gone") { x(); }
              c();
            """;
        InMemoryDocumentStore store = new InMemoryDocumentStore().put(PANEL, text);

        // When
        PruneResult result = pruner.execute(List.of(PANEL), store, Set.of(), store, true);

        // Then
        assertThat(result.planned()).isEmpty();
        assertThat(store.text(PANEL)).isEqualTo(text);
    }

    @Test
    void plan_identifierEndingInElse_doesNotKeepGuard() {
        String text = "noelse\nif (settings[\"struct\"] == \"OLD\") { x(); }\n";

        GuardedBlockPruner.Plan plan = pruner.plan(new Document(PANEL, text), Set.of());

        assertThat(plan.actions()).extracting(PruneAction::detail).containsExactly("guard OLD");
    }

    @Test
    void plan_unclosedBody_isReportedAndKept() {
        String text = "if (settings[\"struct\"] == \"OLD\") { draw();\n";

        GuardedBlockPruner.Plan plan = pruner.plan(new Document(PANEL, text), Set.of());

        assertThat(plan.actions()).isEmpty();
        assertThat(plan.diagnostics()).extracting(d -> d.kind()).containsExactly(DiagnosticKind.UNMATCHED_DELIMITER);
    }

    @Test
    void execute_dryRun_leavesDocumentUntouched() {
        String text = "if (settings[\"struct\"] == \"OLD\") { x(); }\n";
        InMemoryDocumentStore store = new InMemoryDocumentStore().put(PANEL, text);

        PruneResult result = pruner.execute(List.of(PANEL), store, Set.of(), store, false);

        assertThat(result.planned()).hasSize(1);
        assertThat(result.applied()).isEmpty();
        assertThat(store.text(PANEL)).isEqualTo(text);
    }
}
