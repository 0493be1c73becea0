package com.resyntax.ast;

import java.nio.CharBuffer;
import java.util.Objects;

/**
 * Root of a regexp AST. Owns the pattern text that every node's
 * {@link Position} indexes into.
 */
public record Regexp(String source, Expr expr) {

    public Regexp {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(expr, "expr must not be null");
    }

    /**
     * Returns the source text spanned by {@code e}.
     *
     * @throws IndexOutOfBoundsException if the span lies outside the source
     */
    public String textOf(Expr e) {
        return source.substring(e.begin(), e.end());
    }

    /**
     * Same as {@link #textOf(Expr)} but returns a view over the source
     * instead of a copy.
     *
     * @throws IndexOutOfBoundsException if the span lies outside the source
     */
    public CharSequence spanOf(Expr e) {
        return CharBuffer.wrap(source, e.begin(), e.end());
    }
}
