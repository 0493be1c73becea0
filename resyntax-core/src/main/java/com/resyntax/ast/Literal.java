package com.resyntax.ast;

import java.util.List;
import java.util.Objects;

/**
 * Run of consecutive literal characters. The span covers the whole run.
 */
public record Literal(Position pos, List<Char> chars) implements Expr {

    public Literal {
        Objects.requireNonNull(pos, "pos must not be null");
        chars = List.copyOf(chars);
    }

    @Override
    public Operation op() {
        return Operation.LITERAL;
    }

    @Override
    public List<Expr> args() {
        return List.copyOf(chars);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }
}
