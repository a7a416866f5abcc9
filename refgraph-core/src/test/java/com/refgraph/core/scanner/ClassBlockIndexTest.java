package com.refgraph.core.scanner;

import com.refgraph.core.model.Document;
import com.refgraph.core.model.NamedBlock;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ClassBlockIndex}.
 */
class ClassBlockIndexTest {

    private static ClassBlockIndex index(String text) {
        return ClassBlockIndex.of(new Document("scripts/libs/struct.ctl", text), LexicalScanner.forScripts());
    }

    @Test
    void of_classesWithBracesInStrings_findsEveryClassWhole() {
        String text = """
            class PUMP : BASE {
              string color = "{54,205,45}";
            };
            class VALVE {
              char c = '}';
            }
            """;

        ClassBlockIndex index = index(text);

        assertThat(index.names()).containsExactly("PUMP", "VALVE");
        NamedBlock pump = index.find("PUMP").orElseThrow();
        assertThat(pump.parent()).isEqualTo("BASE");
        assertThat(pump.extent().slice(text)).startsWith("class PUMP").endsWith("};");
        NamedBlock valve = index.find("VALVE").orElseThrow();
        assertThat(valve.parent()).isNull();
        assertThat(valve.extent().slice(text)).endsWith("}");
    }

    @Test
    void of_classHeaderInComment_isIgnored() {
        String text = """
            // class OLD { }
            /* class GONE { } */
            class LIVE { }
            """;

        assertThat(index(text).names()).containsExactly("LIVE");
    }

    @Test
    void of_unclosedClass_isReportedAndSkipped() {
        ClassBlockIndex index = index("class OK { }\nclass BROKEN { int x;\n");

        assertThat(index.names()).containsExactly("OK");
        assertThat(index.diagnostics()).hasSize(1);
    }

    @Test
    void find_unknownName_returnsEmpty() {
        assertThat(index("class A { }").find("B")).isEmpty();
    }
}
