package com.resyntax.ast;

import java.util.List;
import java.util.Objects;

/**
 * Node whose tag has no typed variant: a sentinel, or a code from a newer
 * producer. Such trees stay printable but never validate.
 */
public record Unknown(Position pos, int code, List<Expr> args) implements Expr {

    public Unknown {
        Objects.requireNonNull(pos, "pos must not be null");
        Operation known = Operation.fromCode(code).orElse(Operation.NONE);
        if (!known.isSentinel()) {
            throw new IllegalArgumentException("code " + code + " is " + known + ", use its typed node");
        }
        args = List.copyOf(args);
    }

    /**
     * @return the sentinel this code names, or {@link Operation#NONE} for codes outside the enum
     */
    @Override
    public Operation op() {
        return Operation.fromCode(code).orElse(Operation.NONE);
    }

    @Override
    public int code() {
        return code;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitUnknown(this);
    }
}
