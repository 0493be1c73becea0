package com.resyntax.ast;

import java.util.List;
import java.util.Objects;

/**
 * Concatenation of expressions. A concat with no items is the empty pattern.
 */
public record Concat(Position pos, List<Expr> items) implements Expr {

    public Concat {
        Objects.requireNonNull(pos, "pos must not be null");
        items = List.copyOf(items);
    }

    public static Concat empty(Position pos) {
        return new Concat(pos, List.of());
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    @Override
    public Operation op() {
        return Operation.CONCAT;
    }

    @Override
    public List<Expr> args() {
        return items;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitConcat(this);
    }
}
