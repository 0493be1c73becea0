package com.resyntax.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code (?flags)} form, e.g. {@code (?i-m)}. Changes the flags of the
 * enclosing group and has no body.
 */
public record FlagOnlyGroup(Position pos, StringArg flags) implements Expr {

    public FlagOnlyGroup {
        Objects.requireNonNull(pos, "pos must not be null");
        Objects.requireNonNull(flags, "flags must not be null");
    }

    @Override
    public Operation op() {
        return Operation.FLAG_ONLY_GROUP;
    }

    @Override
    public List<Expr> args() {
        return List.of(flags);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitFlagOnlyGroup(this);
    }
}
