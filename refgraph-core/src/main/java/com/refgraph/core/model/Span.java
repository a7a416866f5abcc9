package com.refgraph.core.model;

/**
 * Half-open character range {@code [start, end)} over a document's text.
 *
 * @param start first offset covered (inclusive)
 * @param end offset just past the last covered character (exclusive)
 */
public record Span(int start, int end) implements Comparable<Span> {

    /**
     * Compact constructor with validation.
     */
    public Span {
        if (start < 0) {
            throw new IllegalArgumentException("start must not be negative: " + start);
        }
        if (end < start) {
            throw new IllegalArgumentException("end " + end + " is before start " + start);
        }
    }

    /**
     * Number of characters covered.
     *
     * @return span length
     */
    public int length() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }

    /**
     * Checks whether an offset lies inside this span.
     *
     * @param offset character offset
     * @return true if {@code start <= offset < end}
     */
    public boolean contains(int offset) {
        return offset >= start && offset < end;
    }

    /**
     * Checks whether another span lies entirely inside this one.
     *
     * @param other span to test
     * @return true if {@code other} is covered by this span
     */
    public boolean contains(Span other) {
        return other.start >= start && other.end <= end;
    }

    /**
     * Checks whether two spans share at least one character.
     *
     * @param other span to test
     * @return true if the spans overlap
     */
    public boolean overlaps(Span other) {
        return start < other.end && other.start < end;
    }

    /**
     * Extracts the covered text.
     *
     * @param text document text
     * @return substring covered by this span
     */
    public String slice(CharSequence text) {
        return text.subSequence(start, end).toString();
    }

    @Override
    public int compareTo(Span other) {
        int byStart = Integer.compare(start, other.start);
        return byStart != 0 ? byStart : Integer.compare(end, other.end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
