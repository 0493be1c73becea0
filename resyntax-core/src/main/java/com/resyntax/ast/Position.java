package com.resyntax.ast;

/**
 * Half-open {@code [begin, end)} span of a node inside {@link Regexp#source()}.
 * Offsets are {@code char} indexes.
 */
public record Position(int begin, int end) {

    public Position {
        if (begin < 0 || end < begin) {
            throw new IllegalArgumentException("invalid span [" + begin + ", " + end + ")");
        }
    }

    public static Position of(int begin, int end) {
        return new Position(begin, end);
    }

    public int length() {
        return end - begin;
    }

    public boolean contains(Position other) {
        return begin <= other.begin && other.end <= end;
    }

    @Override
    public String toString() {
        return "[" + begin + ", " + end + ")";
    }
}
