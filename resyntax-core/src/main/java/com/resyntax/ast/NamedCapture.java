package com.resyntax.ast;

import java.util.List;
import java.util.Objects;

/**
 * Named capturing group {@code (?P<name>re)}.
 */
public record NamedCapture(Position pos, Expr expr, StringArg name) implements Expr {

    public NamedCapture {
        Objects.requireNonNull(pos, "pos must not be null");
        Objects.requireNonNull(expr, "expr must not be null");
        Objects.requireNonNull(name, "name must not be null");
    }

    @Override
    public Operation op() {
        return Operation.NAMED_CAPTURE;
    }

    @Override
    public List<Expr> args() {
        return List.of(expr, name);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitNamedCapture(this);
    }
}
