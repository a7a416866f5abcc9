package com.refgraph.core.scanner;

import com.refgraph.core.model.Span;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link LineIndex}.
 */
class LineIndexTest {

    @Test
    void lineOf_mixedTerminators_countsEachOnce() {
        LineIndex lines = new LineIndex("a\r\nb\rc\nd");

        assertThat(lines.lineCount()).isEqualTo(4);
        assertThat(lines.lineOf(0)).isEqualTo(1);
        assertThat(lines.lineOf(3)).isEqualTo(2);
        assertThat(lines.lineOf(5)).isEqualTo(3);
        assertThat(lines.lineOf(7)).isEqualTo(4);
    }

    @Test
    void fullLine_includesTerminator_contentDoesNot() {
        LineIndex lines = new LineIndex("first\r\nsecond");

        assertThat(lines.fullLine(1)).isEqualTo(new Span(0, 7));
        assertThat(lines.content(1)).isEqualTo("first");
        assertThat(lines.fullLine(2)).isEqualTo(new Span(7, 13));
    }

    @Test
    void firstNonBlank_blankLine_returnsMinusOne() {
        LineIndex lines = new LineIndex("  \n  x");

        assertThat(lines.firstNonBlank(1)).isEqualTo(-1);
        assertThat(lines.firstNonBlank(2)).isEqualTo(5);
    }
}
