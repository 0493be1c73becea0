package com.resyntax.ast;

import java.util.List;
import java.util.Objects;

/** Makes the enclosed quantifier non-greedy: {@code x*?}. */
public record NonGreedy(Position pos, Expr expr) implements Expr {

    public NonGreedy {
        Objects.requireNonNull(pos, "pos must not be null");
        Objects.requireNonNull(expr, "expr must not be null");
    }

    @Override
    public Operation op() {
        return Operation.NON_GREEDY;
    }

    @Override
    public List<Expr> args() {
        return List.of(expr);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitNonGreedy(this);
    }
}
