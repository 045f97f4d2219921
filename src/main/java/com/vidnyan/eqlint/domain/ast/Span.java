package com.vidnyan.eqlint.domain.ast;

/**
 * Half-open character range {@code [start, end)} in a source file.
 */
public record Span(int start, int end) {

    public static final Span EMPTY = new Span(0, 0);

    public Span {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
    }

    /**
     * Source text covered by this span.
     */
    public String textIn(String source) {
        return source.substring(start, Math.min(end, source.length()));
    }
}
