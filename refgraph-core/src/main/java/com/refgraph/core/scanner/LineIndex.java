package com.refgraph.core.scanner;

import com.refgraph.core.model.Span;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Maps character offsets to 1-based line numbers and back.
 *
 * <p>Recognizes {@code \n}, {@code \r\n} and a lone {@code \r} as line terminators.
 */
public final class LineIndex {

    private final String text;
    private final int[] lineStarts;

    public LineIndex(String text) {
        this.text = text;
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\r') {
                if (i + 1 < text.length() && text.charAt(i + 1) == '\n') {
                    i++;
                }
                starts.add(i + 1);
            } else if (c == '\n') {
                starts.add(i + 1);
            }
        }
        this.lineStarts = starts.stream().mapToInt(Integer::intValue).toArray();
    }

    /**
     * Number of lines. A trailing terminator opens one final empty line.
     *
     * @return line count, at least 1
     */
    public int lineCount() {
        return lineStarts.length;
    }

    /**
     * Returns the line containing an offset.
     *
     * @param offset character offset (may equal the text length)
     * @return 1-based line number
     */
    public int lineOf(int offset) {
        if (offset < 0 || offset > text.length()) {
            throw new IndexOutOfBoundsException("offset " + offset + " outside [0, " + text.length() + "]");
        }
        int idx = Arrays.binarySearch(lineStarts, offset);
        return idx >= 0 ? idx + 1 : -idx - 1;
    }

    public int lineStart(int line) {
        checkLine(line);
        return lineStarts[line - 1];
    }

    /**
     * Offset of the line terminator (or end of text) ending the given line.
     *
     * @param line 1-based line number
     * @return exclusive end of the line content
     */
    public int contentEnd(int line) {
        checkLine(line);
        int end = line < lineStarts.length ? lineStarts[line] : text.length();
        while (end > lineStarts[line - 1] && isTerminator(text.charAt(end - 1))) {
            end--;
        }
        return end;
    }

    /**
     * Span of a line including its terminator.
     *
     * @param line 1-based line number
     * @return full line span
     */
    public Span fullLine(int line) {
        checkLine(line);
        int end = line < lineStarts.length ? lineStarts[line] : text.length();
        return new Span(lineStarts[line - 1], end);
    }

    /**
     * Line content without its terminator.
     *
     * @param line 1-based line number
     * @return line text
     */
    public String content(int line) {
        return text.substring(lineStart(line), contentEnd(line));
    }

    /**
     * First non-blank offset on a line.
     *
     * @param line 1-based line number
     * @return offset of the first non-whitespace character, or -1 for a blank line
     */
    public int firstNonBlank(int line) {
        int end = contentEnd(line);
        for (int i = lineStart(line); i < end; i++) {
            if (!Character.isWhitespace(text.charAt(i))) {
                return i;
            }
        }
        return -1;
    }

    private void checkLine(int line) {
        if (line < 1 || line > lineStarts.length) {
            throw new IndexOutOfBoundsException("line " + line + " outside [1, " + lineStarts.length + "]");
        }
    }

    private static boolean isTerminator(char c) {
        return c == '\n' || c == '\r';
    }
}
