package com.refgraph.core.prune;

import com.refgraph.core.analysis.DocumentAnalysis;
import com.refgraph.core.analysis.DocumentAnalyzer;
import com.refgraph.core.model.Document;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link DeclarationDeduplicator}.
 */
class DeclarationDeduplicatorTest {

    private final DocumentAnalyzer analyzer = DocumentAnalyzer.defaults();
    private final DeclarationDeduplicator deduplicator = new DeclarationDeduplicator();

    private List<PruneAction> plan(String text) {
        DocumentAnalysis analysis = analyzer.analyze(new Document("panels/vision/main.xml", text));
        return deduplicator.plan(analysis);
    }

    @Test
    void plan_repeatedUsesInSameQuoting_removesLaterLines() {
        String text = """
            #uses &quot;std/Struct&quot;
            #uses &quot;std/Util&quot;
              #uses &quot;std/Struct.ctl&quot;
            #uses \\"std/Struct\\"
            """;

        List<PruneAction> actions = plan(text);

        assertThat(actions).extracting(a -> a.span().slice(text)).containsExactly(
            "  #uses &quot;std/Struct.ctl&quot;\n");
        assertThat(actions).allMatch(a -> a.reason() == PruneAction.Reason.DUPLICATE_DECLARATION);
    }

    @Test
    void plan_duplicateSharingLine_isKept() {
        String text = "#uses \"std/Struct\"\nx(); #uses \"std/Struct\"\n";

        assertThat(plan(text)).isEmpty();
    }

    @Test
    void plan_commentedDuplicate_isNotADeclaration() {
        String text = "#uses \"std/Struct\"\n// #uses \"std/Struct\"\n";

        assertThat(plan(text)).isEmpty();
    }

    @Test
    void plan_sameUsesInCdataAndAttribute_bothKept() {
        // Given
        String text = """
            <script><![CDATA[
            #uses "std/Struct"
            ]]></script>
            <widget value="
            #uses &quot;std/Struct&quot;
            "/>
            """;

        // When
        List<PruneAction> actions = plan(text);

        // Then
        assertThat(actions).isEmpty();
    }

    @Test
    void plan_sameUsesInTwoAttributes_bothKept() {
        String text = """
            <widget value="
            #uses &quot;std/Struct&quot;
            "/>
            <widget value="
            #uses &quot;std/Struct&quot;
            "/>
            """;

        assertThat(plan(text)).isEmpty();
    }
}
