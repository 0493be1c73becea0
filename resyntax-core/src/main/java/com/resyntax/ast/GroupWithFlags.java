package com.resyntax.ast;

import java.util.List;
import java.util.Objects;

/**
 * Non-capturing group with flags {@code (?i:re)}.
 */
public record GroupWithFlags(Position pos, Expr expr, StringArg flags) implements Expr {

    public GroupWithFlags {
        Objects.requireNonNull(pos, "pos must not be null");
        Objects.requireNonNull(expr, "expr must not be null");
        Objects.requireNonNull(flags, "flags must not be null");
    }

    @Override
    public Operation op() {
        return Operation.GROUP_WITH_FLAGS;
    }

    @Override
    public List<Expr> args() {
        return List.of(expr, flags);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitGroupWithFlags(this);
    }
}
