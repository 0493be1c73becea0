package com.resyntax.ast;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Backslash escape. The span covers the full escape text, backslash included.
 */
public record Escape(Position pos, Kind kind) implements Expr {

    public Escape {
        Objects.requireNonNull(pos, "pos must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
    }

    public enum Kind {
        /** {@code \d} {@code \n} */
        SIMPLE(Operation.ESCAPE),
        /** {@code \(} {@code \+} */
        META(Operation.ESCAPE_META),
        /** {@code \12} {@code \123} */
        OCTAL(Operation.ESCAPE_OCTAL),
        /** {@code \x7F} */
        HEX(Operation.ESCAPE_HEX),
        /** {@code \x{10FFFF}} */
        HEX_FULL(Operation.ESCAPE_HEX_FULL),
        /** {@code \pL} */
        UNI(Operation.ESCAPE_UNI),
        /** {@code \p{Greek}} */
        UNI_FULL(Operation.ESCAPE_UNI_FULL);

        private final Operation op;

        Kind(Operation op) {
            this.op = op;
        }

        public Operation op() {
            return op;
        }

        public static Optional<Kind> of(Operation op) {
            for (Kind kind : values()) {
                if (kind.op == op) {
                    return Optional.of(kind);
                }
            }
            return Optional.empty();
        }
    }

    @Override
    public Operation op() {
        return kind.op();
    }

    @Override
    public List<Expr> args() {
        return List.of();
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitEscape(this);
    }
}
