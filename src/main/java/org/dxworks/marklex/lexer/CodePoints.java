package org.dxworks.marklex.lexer;

/**
 * A line indexed by Unicode code point rather than UTF-16 char, so that offsets
 * recorded by the automata never split a surrogate pair.
 */
final class CodePoints {

    static final int NONE = -1;

    private final int[] points;

    CodePoints(String text) {
        this.points = text.codePoints().toArray();
    }

    int length() {
        return points.length;
    }

    int at(int index) {
        return points[index];
    }

    /**
     * @return the code point at {@code index}, or {@link #NONE} past the end
     */
    int peek(int index) {
        return index >= 0 && index < points.length ? points[index] : NONE;
    }

    String slice(int begin, int end) {
        if (begin < 0) begin = 0;
        if (end > points.length) end = points.length;
        if (begin >= end) return "";
        return new String(points, begin, end - begin);
    }

    String from(int begin) {
        return slice(begin, points.length);
    }

    /**
     * @return the offset of the terminating newline, or the length when there is none
     */
    int contentEnd() {
        return points.length > 0 && points[points.length - 1] == '\n' ? points.length - 1 : points.length;
    }
}
