package com.resyntax.ast;

import java.util.List;
import java.util.Objects;

public record Capture(Position pos, Expr expr) implements Expr {

    public Capture {
        Objects.requireNonNull(pos, "pos must not be null");
        Objects.requireNonNull(expr, "expr must not be null");
    }

    @Override
    public Operation op() {
        return Operation.CAPTURE;
    }

    @Override
    public List<Expr> args() {
        return List.of(expr);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitCapture(this);
    }
}
