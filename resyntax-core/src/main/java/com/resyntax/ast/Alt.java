package com.resyntax.ast;

import java.util.List;
import java.util.Objects;

/**
 * Alternation {@code x|y}. Branches keep their left-to-right order.
 */
public record Alt(Position pos, List<Expr> branches) implements Expr {

    public Alt {
        Objects.requireNonNull(pos, "pos must not be null");
        branches = List.copyOf(branches);
    }

    @Override
    public Operation op() {
        return Operation.ALT;
    }

    @Override
    public List<Expr> args() {
        return branches;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitAlt(this);
    }
}
