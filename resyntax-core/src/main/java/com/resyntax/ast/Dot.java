package com.resyntax.ast;

import java.util.List;
import java.util.Objects;

public record Dot(Position pos) implements Expr {

    public Dot {
        Objects.requireNonNull(pos, "pos must not be null");
    }

    @Override
    public Operation op() {
        return Operation.DOT;
    }

    @Override
    public List<Expr> args() {
        return List.of();
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitDot(this);
    }
}
