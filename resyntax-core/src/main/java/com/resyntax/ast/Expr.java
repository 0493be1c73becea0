package com.resyntax.ast;

import java.util.List;

/**
 * Base interface for all regexp AST nodes.
 *
 * <p>Each variant holds exactly the children its {@link Operation} requires.
 * {@link #args()} exposes them in the generic positional form, so that
 * {@code args().get(0)} of a {@link Repeat} is the repeated expression and
 * {@code args().get(1)} its count.</p>
 */
public sealed interface Expr permits
    Concat,
    Alt,
    Dot,
    Caret,
    Dollar,
    Star,
    Plus,
    Question,
    NonGreedy,
    Possessive,
    Literal,
    Char,
    StringArg,
    Quote,
    Escape,
    PosixClass,
    CharClass,
    CharRange,
    Repeat,
    Capture,
    NamedCapture,
    Group,
    GroupWithFlags,
    FlagOnlyGroup,
    Unknown {

    Position pos();

    Operation op();

    List<Expr> args();

    <R> R accept(ExprVisitor<R> visitor);

    /**
     * Raw numeric tag. Equal to {@code op().code()} for every variant but {@link Unknown}.
     */
    default int code() {
        return op().code();
    }

    default int begin() {
        return pos().begin();
    }

    default int end() {
        return pos().end();
    }

    /**
     * Returns the last argument.
     *
     * <p>Must not be called on nodes that may have 0 args: it throws
     * {@link IndexOutOfBoundsException} for them.</p>
     */
    default Expr lastArg() {
        List<Expr> args = args();
        return args.get(args.size() - 1);
    }
}
