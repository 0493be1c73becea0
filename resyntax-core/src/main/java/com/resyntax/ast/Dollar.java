package com.resyntax.ast;

import java.util.List;
import java.util.Objects;

public record Dollar(Position pos) implements Expr {

    public Dollar {
        Objects.requireNonNull(pos, "pos must not be null");
    }

    @Override
    public Operation op() {
        return Operation.DOLLAR;
    }

    @Override
    public List<Expr> args() {
        return List.of();
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitDollar(this);
    }
}
