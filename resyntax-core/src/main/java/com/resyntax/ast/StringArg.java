package com.resyntax.ast;

import java.util.List;
import java.util.Objects;

/**
 * Text argument of another node: a repeat count, a group name or group flags.
 * Carries the {@link Operation#STRING} tag.
 */
public record StringArg(Position pos) implements Expr {

    public StringArg {
        Objects.requireNonNull(pos, "pos must not be null");
    }

    @Override
    public Operation op() {
        return Operation.STRING;
    }

    @Override
    public List<Expr> args() {
        return List.of();
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitString(this);
    }
}
