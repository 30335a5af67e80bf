package com.hdltree;

/**
 * A region of source text. Offsets are character indexes, end exclusive.
 * Lines are 1-based and columns 0-based.
 */
public record Span(int start, int end, int line, int column, int endLine, int endColumn) {

    public static Span empty(int offset, int line, int column) {
        return new Span(offset, offset, line, column, line, column);
    }

    /**
     * The smallest span covering both arguments, which must be in source order.
     */
    public static Span cover(Span first, Span last) {
        return new Span(first.start, last.end, first.line, first.column, last.endLine, last.endColumn);
    }

    public int length() {
        return end - start;
    }

    public boolean contains(Span other) {
        return start <= other.start && other.end <= end;
    }

    public boolean overlaps(Span other) {
        return start < other.end && other.start < end;
    }

    /**
     * {@code line:column} of the start, with a 1-based column as editors show it.
     */
    public String position() {
        return line + ":" + (column + 1);
    }

    @Override
    public String toString() {
        return "[" + start + ".." + end + ") " + position();
    }
}
