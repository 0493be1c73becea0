package com.resyntax.ast;

import java.util.List;
import java.util.Objects;

public record PosixClass(Position pos) implements Expr {

    public PosixClass {
        Objects.requireNonNull(pos, "pos must not be null");
    }

    @Override
    public Operation op() {
        return Operation.POSIX_CLASS;
    }

    @Override
    public List<Expr> args() {
        return List.of();
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitPosixClass(this);
    }
}
