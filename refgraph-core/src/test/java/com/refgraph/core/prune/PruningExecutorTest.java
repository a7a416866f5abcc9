package com.refgraph.core.prune;

import com.refgraph.core.analysis.DocumentAnalyzer;
import com.refgraph.core.document.FailingDocumentStore;
import com.refgraph.core.document.InMemoryDocumentStore;
import com.refgraph.core.graph.ClosureEngine;
import com.refgraph.core.graph.ClosureOptions;
import com.refgraph.core.graph.ClosureResult;
import com.refgraph.core.model.Diagnostic;
import com.refgraph.core.model.DiagnosticKind;
import com.refgraph.core.model.NodeState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Tests for {@link PruningExecutor}.
 */
class PruningExecutorTest {

    private static final String MAIN = "panels/vision/main.xml";
    private static final String A = "panels/objects/objects_A/a.xml";
    private static final String C = "panels/objects/objects_A/c.xml";
    private static final String D = "panels/objects/objects_A/d.xml";
    private static final String LIB = "scripts/libs/std/Struct.ctl";

    private static final String MAIN_TEXT = """
        addSymbol("objects/objects_A/a.xml");
        // addSymbol("objects/objects_A/c.xml");
        #uses "std/Struct"
        #uses "std/Struct"
        """;

    private final DocumentAnalyzer analyzer = DocumentAnalyzer.defaults();
    private final ClosureEngine engine = new ClosureEngine(analyzer, ClosureOptions.defaults());
    private final PruningExecutor executor = new PruningExecutor(analyzer);

    private InMemoryDocumentStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryDocumentStore()
            .put(MAIN, MAIN_TEXT)
            .put(A, "")
            .put(C, "")
            .put(D, "")
            .put(LIB, "");
    }

    private ClosureResult closure() {
        return engine.run(Set.of(MAIN), store);
    }

    @Test
    void execute_dryRun_plansEverythingAndChangesNothing() {
        // When
        PruneResult result = executor.execute(closure(), store, store, PruneOptions.dryRun());

        // Then
        assertThat(result.dryRun()).isTrue();
        assertThat(result.applied()).isEmpty();
        assertThat(result.planned()).extracting(PruneAction::reason).containsExactly(
            PruneAction.Reason.DEAD_BLOCK,
            PruneAction.Reason.DUPLICATE_DECLARATION,
            PruneAction.Reason.ORPHAN,
            PruneAction.Reason.ORPHAN);
        assertThat(result.planned()).filteredOn(a -> a.type() == PruneAction.Type.DELETE_DOCUMENT)
            .extracting(PruneAction::documentKey, PruneAction::detail)
            .containsExactly(
                tuple(C, "comment orphan"),
                tuple(D, "pure orphan"));
        assertThat(store.text(MAIN)).isEqualTo(MAIN_TEXT);
        assertThat(store.keys()).contains(C, D);
    }

    @Test
    void execute_apply_removesBlocksAndOrphans_secondPassIsEmpty() {
        // When
        PruneResult first = executor.execute(closure(), store, store, PruneOptions.dryRun().withApply(true));

        // Then
        assertThat(first.applied()).hasSameSizeAs(first.planned());
        assertThat(first.appliedDeletions()).isEqualTo(2);
        assertThat(store.keys()).containsExactly(A, MAIN, LIB);
        assertThat(store.text(MAIN)).isEqualTo("""
            addSymbol("objects/objects_A/a.xml");
            #uses "std/Struct"
            """);

        PruneResult second = executor.execute(closure(), store, store, PruneOptions.dryRun().withApply(true));
        assertThat(second.isEmpty()).isTrue();
        assertThat(second.diagnostics()).isEmpty();
    }

    @Test
    void execute_orphanReferencedSinceClosure_isWithdrawnAsStale() {
        // Given: the classification predates an edit that makes A reference C
        ClosureResult stale = closure();
        store.put(A, "addSymbol(\"objects/objects_A/c.xml\");");

        // When
        PruneResult result = executor.execute(stale, store, store, PruneOptions.dryRun().withApply(true));

        // Then
        assertThat(store.keys()).contains(C).doesNotContain(D);
        assertThat(result.diagnostics()).extracting(Diagnostic::kind).containsExactly(DiagnosticKind.STALE_CLASSIFICATION);
        assertThat(result.planned()).noneMatch(a -> a.reason() == PruneAction.Reason.DEAD_BLOCK);
    }

    @Test
    void execute_withoutDeadBlockRemoval_reportsInactiveOnlyReference() {
        PruneOptions options = new PruneOptions(true, false, false, false, List.of());

        PruneResult result = executor.execute(closure(), store, store, options);

        assertThat(result.plannedDeletions()).isEqualTo(2);
        assertThat(result.diagnostics())
            .singleElement()
            .satisfies(d -> {
                assertThat(d.kind()).isEqualTo(DiagnosticKind.INACTIVE_ONLY_REFERENCE);
                assertThat(d.documentKey()).isEqualTo(C);
            });
    }

    @Test
    void execute_candidatePatterns_limitDeletions() {
        PruneOptions options = PruneOptions.dryRun().withCandidates(List.of("**/d.xml"));

        PruneResult result = executor.execute(closure(), store, store, options);

        assertThat(result.planned()).filteredOn(a -> a.type() == PruneAction.Type.DELETE_DOCUMENT)
            .extracting(PruneAction::documentKey)
            .containsExactly(D);
        assertThat(result.planned()).noneMatch(a -> a.reason() == PruneAction.Reason.DEAD_BLOCK);
    }

    @Test
    void execute_unconvergedClosure_refusesToPrune() {
        ClosureResult partial = new ClosureEngine(analyzer, ClosureOptions.defaults().withMaxIterations(1))
            .run(Set.of(MAIN), store.put(A, "addSymbol(\"objects/objects_A/d.xml\");"));

        PruneResult result = executor.execute(partial, store, store, PruneOptions.dryRun().withApply(true));

        assertThat(result.planned()).isEmpty();
        assertThat(result.diagnostics()).extracting(Diagnostic::kind).containsExactly(DiagnosticKind.CLOSURE_DID_NOT_CONVERGE);
        assertThat(store.keys()).contains(C, D);
    }

    @Test
    void execute_unreadableSurvivor_deletesNothing() {
        FailingDocumentStore failing = new FailingDocumentStore(store);
        ClosureResult result = engine.run(Set.of(MAIN), failing);
        failing.unreadable(A);

        PruneResult pruned = executor.execute(result, failing, failing, PruneOptions.dryRun().withApply(true));

        assertThat(pruned.plannedDeletions()).isZero();
        assertThat(store.keys()).contains(C, D);
        assertThat(pruned.diagnostics()).extracting(Diagnostic::kind).contains(DiagnosticKind.STALE_CLASSIFICATION);
    }

    @Test
    void execute_failedMutation_isReportedAndOthersStillApplied() {
        FailingDocumentStore failing = new FailingDocumentStore(store).immutable(D);

        PruneResult result = executor.execute(closure(), failing, failing, PruneOptions.dryRun().withApply(true));

        assertThat(result.diagnostics()).extracting(Diagnostic::kind).containsExactly(DiagnosticKind.MUTATION_FAILED);
        assertThat(result.applied()).hasSize(result.planned().size() - 1);
        assertThat(store.keys()).contains(D).doesNotContain(C);
    }

    @Test
    @DisplayName("Removing a trailing comment inside one-line CDATA keeps the section closer")
    void execute_apply_trailingCommentInCdata_keepsCdataCloser() {
        // Given
        store.put(MAIN, """
            <script><![CDATA[main(){ f(); } // open("objects/objects_A/c.xml")]]></script>
            """);

        // When
        ClosureResult result = closure();
        executor.execute(result, store, store, PruneOptions.dryRun().withApply(true));

        // Then
        assertThat(result.stateOf(C)).isEqualTo(NodeState.ORPHAN);
        assertThat(store.text(MAIN)).isEqualTo("""
            <script><![CDATA[main(){ f(); }]]></script>
            """);
        assertThat(store.keys()).doesNotContain(C);
    }

    @Test
    void execute_apply_referencesInAttributeScripts_keepTargets() {
        // Given
        store.put(MAIN, """
            <panel>
              <widget value="RootPanelOn(&quot;objects/objects_A/a.xml&quot;)"/>
              <widget value="RootPanelOn(\\"objects/objects_A/c.xml\\")"/>
              <widget value="// RootPanelOn(&quot;objects/objects_A/d.xml&quot;)"/>
            </panel>
            """);

        // When
        ClosureResult result = closure();
        executor.execute(result, store, store, PruneOptions.dryRun().withApply(true));

        // Then
        assertThat(result.stateOf(A)).isEqualTo(NodeState.REACHABLE);
        assertThat(result.stateOf(C)).isEqualTo(NodeState.REACHABLE);
        assertThat(result.stateOf(D)).isEqualTo(NodeState.ORPHAN);
        assertThat(store.keys()).contains(A, C).doesNotContain(D);
    }
}
