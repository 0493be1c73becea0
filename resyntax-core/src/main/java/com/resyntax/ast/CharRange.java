package com.resyntax.ast;

import java.util.List;
import java.util.Objects;

/**
 * Inclusive range inside a character class, e.g. {@code 0-9}.
 * Bounds are {@link Char} or {@link Escape} nodes.
 */
public record CharRange(Position pos, Expr lower, Expr upper) implements Expr {

    public CharRange {
        Objects.requireNonNull(pos, "pos must not be null");
        Objects.requireNonNull(lower, "lower must not be null");
        Objects.requireNonNull(upper, "upper must not be null");
    }

    @Override
    public Operation op() {
        return Operation.CHAR_RANGE;
    }

    @Override
    public List<Expr> args() {
        return List.of(lower, upper);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitCharRange(this);
    }
}
