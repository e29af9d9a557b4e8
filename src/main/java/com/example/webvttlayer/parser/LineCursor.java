package com.example.webvttlayer.parser;

/**
 * Scan position within one segment {@code [position, limit)} of a line.
 * The grammar routines advance it as they consume characters; the limit
 * marks where the segment ends so no sentinel is written into the text.
 */
final class LineCursor {

    private final String line;
    private final int limit;
    private int position;

    LineCursor(String line, int position, int limit) {
        if (position < 0 || limit > line.length() || position > limit) {
            throw new IllegalArgumentException(
                    "Segment [" + position + ", " + limit + ") outside line of length " + line.length());
        }
        this.line = line;
        this.position = position;
        this.limit = limit;
    }

    int position() {
        return position;
    }

    int limit() {
        return limit;
    }

    boolean atEnd() {
        return position >= limit;
    }

    /**
     * Character at the cursor, or {@code -1} at the end of the segment.
     */
    int peek() {
        return position < limit ? line.charAt(position) : -1;
    }

    void advance() {
        if (position >= limit) {
            throw new IllegalStateException("Cursor already at end of segment");
        }
        position++;
    }

    void skipWhitespace() {
        while (position < limit && isWhitespace(line.charAt(position))) {
            position++;
        }
    }

    static boolean isWhitespace(int c) {
        return c == ' ' || c == '\t';
    }
}
