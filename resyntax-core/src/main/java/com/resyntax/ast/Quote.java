package com.resyntax.ast;

import java.util.List;
import java.util.Objects;

/** A {@code \Q...\E} block. The span covers the whole block, markers included. */
public record Quote(Position pos) implements Expr {

    public Quote {
        Objects.requireNonNull(pos, "pos must not be null");
    }

    @Override
    public Operation op() {
        return Operation.QUOTE;
    }

    @Override
    public List<Expr> args() {
        return List.of();
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitQuote(this);
    }
}
