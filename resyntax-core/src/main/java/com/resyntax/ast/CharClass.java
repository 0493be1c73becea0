package com.resyntax.ast;

import java.util.List;
import java.util.Objects;

/**
 * Bracketed character class, {@code [abc]} or negated {@code [^abc]}.
 * Elements may include {@link CharRange} and {@link PosixClass} nodes.
 */
public record CharClass(Position pos, boolean negated, List<Expr> elements) implements Expr {

    public CharClass {
        Objects.requireNonNull(pos, "pos must not be null");
        elements = List.copyOf(elements);
    }

    @Override
    public Operation op() {
        return negated ? Operation.NEG_CHAR_CLASS : Operation.CHAR_CLASS;
    }

    @Override
    public List<Expr> args() {
        return elements;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitCharClass(this);
    }
}
