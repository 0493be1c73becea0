package com.resyntax.ast;

import java.util.List;
import java.util.Objects;

/** Makes the enclosed quantifier possessive: {@code x*+}. */
public record Possessive(Position pos, Expr expr) implements Expr {

    public Possessive {
        Objects.requireNonNull(pos, "pos must not be null");
        Objects.requireNonNull(expr, "expr must not be null");
    }

    @Override
    public Operation op() {
        return Operation.POSSESSIVE;
    }

    @Override
    public List<Expr> args() {
        return List.of(expr);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitPossessive(this);
    }
}
