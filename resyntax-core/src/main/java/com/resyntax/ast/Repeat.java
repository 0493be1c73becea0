package com.resyntax.ast;

import java.util.List;
import java.util.Objects;

/**
 * Counted repetition {@code x{min,max}}. {@code count} spans the raw body
 * between the braces, e.g. {@code 3,5}.
 */
public record Repeat(Position pos, Expr expr, StringArg count) implements Expr {

    public Repeat {
        Objects.requireNonNull(pos, "pos must not be null");
        Objects.requireNonNull(expr, "expr must not be null");
        Objects.requireNonNull(count, "count must not be null");
    }

    @Override
    public Operation op() {
        return Operation.REPEAT;
    }

    @Override
    public List<Expr> args() {
        return List.of(expr, count);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitRepeat(this);
    }
}
