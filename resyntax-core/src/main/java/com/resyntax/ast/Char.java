package com.resyntax.ast;

import java.util.List;
import java.util.Objects;

public record Char(Position pos) implements Expr {

    public Char {
        Objects.requireNonNull(pos, "pos must not be null");
    }

    @Override
    public Operation op() {
        return Operation.CHAR;
    }

    @Override
    public List<Expr> args() {
        return List.of();
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitChar(this);
    }
}
