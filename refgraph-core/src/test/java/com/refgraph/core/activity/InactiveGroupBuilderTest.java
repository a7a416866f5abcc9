package com.refgraph.core.activity;

import com.refgraph.core.analysis.DocumentAnalysis;
import com.refgraph.core.analysis.DocumentAnalyzer;
import com.refgraph.core.model.Document;
import com.refgraph.core.model.InactiveGroup;
import com.refgraph.core.model.ReferenceTarget;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link InactiveGroupBuilder}, driven through {@link DocumentAnalyzer}.
 */
class InactiveGroupBuilderTest {

    private final DocumentAnalyzer analyzer = DocumentAnalyzer.defaults();

    private static String slice(String text, InactiveGroup group) {
        return group.extent().slice(text);
    }

    @Test
    void build_mixedCommentShapes_groupsEachShape() {
        String text = String.join("\n",
            "a();",
            "// open(\"objects/objects_A/x.xml\");",
            "// second line",
            "//",
            "// open(\"objects/objects_A/y.xml\");",
            "b(); // open(\"objects/objects_A/z.xml\");",
            "/* open(\"objects/objects_A/w.xml\"); */",
            "c(); /* \"objects/objects_A/v.xml\" */ d();",
            "");

        DocumentAnalysis analysis = analyzer.analyze(new Document("panels/vision/main.xml", text));
        List<InactiveGroup> groups = analysis.inactiveGroups();

        assertThat(groups).hasSize(5);
        assertThat(slice(text, groups.get(0))).isEqualTo("// open(\"objects/objects_A/x.xml\");\n// second line\n");
        assertThat(groups.get(0).firstLine()).isEqualTo(2);
        assertThat(groups.get(0).lastLine()).isEqualTo(3);
        assertThat(slice(text, groups.get(1))).isEqualTo("// open(\"objects/objects_A/y.xml\");\n");
        assertThat(slice(text, groups.get(2))).isEqualTo(" // open(\"objects/objects_A/z.xml\");");
        assertThat(slice(text, groups.get(3))).isEqualTo("/* open(\"objects/objects_A/w.xml\"); */\n");
        assertThat(slice(text, groups.get(4))).isEqualTo("/* \"objects/objects_A/v.xml\" */");
    }

    @Test
    void build_adjacentCommentedReferences_formOneGroup() {
        String text = """
                // add("objects/objects_A/x.xml",
                //     "objects/objects_A/y.xml");
            keep();
            """;

        List<InactiveGroup> groups = analyzer.analyze(new Document("panels/vision/main.xml", text)).inactiveGroups();

        assertThat(groups).singleElement().satisfies(group -> {
            assertThat(group.occurrences()).hasSize(2);
            assertThat(group.targets()).containsExactly(
                new ReferenceTarget("panels/objects/objects_A/x.xml"),
                new ReferenceTarget("panels/objects/objects_A/y.xml"));
            assertThat(group.extent().slice(text)).doesNotContain("keep");
        });
    }

    @Test
    void build_activeReferencesOnly_noGroups() {
        String text = "open(\"objects/objects_A/x.xml\"); // fine\n";

        assertThat(analyzer.analyze(new Document("panels/vision/main.xml", text)).inactiveGroups()).isEmpty();
    }

    @Test
    void build_groups_neverOverlap() {
        String text = """
            // "objects/objects_A/a.xml" /* "objects/objects_A/b.xml" */
            /* "objects/objects_A/c.xml"
               "objects/objects_A/d.xml" */ // "objects/objects_A/e.xml"
            """;

        List<InactiveGroup> groups = analyzer.analyze(new Document("panels/vision/main.xml", text)).inactiveGroups();

        for (int i = 1; i < groups.size(); i++) {
            assertThat(groups.get(i).extent().start()).isGreaterThanOrEqualTo(groups.get(i - 1).extent().end());
        }
        assertThat(groups.stream().mapToInt(g -> g.occurrences().size()).sum()).isEqualTo(5);
    }
}
