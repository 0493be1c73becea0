package com.resyntax.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Builds typed nodes from the generic {@code (op, pos, args)} form.
 *
 * <p>Arguments are checked against the arity table of {@link Operation};
 * a mismatch is reported with {@link MalformedExprException}. Sentinels and
 * codes outside the enum produce an {@link Unknown} node.</p>
 */
public final class ExprFactory {

    private static final Logger LOG = Logger.getLogger(ExprFactory.class.getName());

    private ExprFactory() {
        // Utility class
    }

    public static Expr create(int code, Position pos, List<Expr> args) {
        return Operation.fromCode(code)
            .map(op -> create(op, pos, args))
            .orElseGet(() -> unknown(code, pos, args));
    }

    public static Expr create(Operation op, Position pos, List<Expr> args) {
        if (!op.isSentinel() && !op.acceptsArgCount(args.size())) {
            throw new MalformedExprException(op + " " + pos + ": expected " + arity(op)
                + " args, got " + args.size());
        }
        return switch (op) {
            case NONE, NONE2 -> unknown(op.code(), pos, args);
            case CONCAT -> new Concat(pos, args);
            case DOT -> new Dot(pos);
            case ALT -> new Alt(pos, args);
            case STAR -> new Star(pos, args.get(0));
            case PLUS -> new Plus(pos, args.get(0));
            case QUESTION -> new Question(pos, args.get(0));
            case NON_GREEDY -> new NonGreedy(pos, args.get(0));
            case POSSESSIVE -> new Possessive(pos, args.get(0));
            case CARET -> new Caret(pos);
            case DOLLAR -> new Dollar(pos);
            case LITERAL -> new Literal(pos, chars(op, pos, args));
            case CHAR -> new Char(pos);
            case STRING -> new StringArg(pos);
            case QUOTE -> new Quote(pos);
            case ESCAPE -> new Escape(pos, Escape.Kind.SIMPLE);
            case ESCAPE_META -> new Escape(pos, Escape.Kind.META);
            case ESCAPE_OCTAL -> new Escape(pos, Escape.Kind.OCTAL);
            case ESCAPE_HEX -> new Escape(pos, Escape.Kind.HEX);
            case ESCAPE_HEX_FULL -> new Escape(pos, Escape.Kind.HEX_FULL);
            case ESCAPE_UNI -> new Escape(pos, Escape.Kind.UNI);
            case ESCAPE_UNI_FULL -> new Escape(pos, Escape.Kind.UNI_FULL);
            case CHAR_CLASS -> new CharClass(pos, false, args);
            case NEG_CHAR_CLASS -> new CharClass(pos, true, args);
            case CHAR_RANGE -> new CharRange(pos, bound(op, pos, args.get(0)), bound(op, pos, args.get(1)));
            case POSIX_CLASS -> new PosixClass(pos);
            case REPEAT -> new Repeat(pos, args.get(0), string(op, pos, args.get(1)));
            case CAPTURE -> new Capture(pos, args.get(0));
            case NAMED_CAPTURE -> new NamedCapture(pos, args.get(0), string(op, pos, args.get(1)));
            case GROUP -> new Group(pos, args.get(0));
            case GROUP_WITH_FLAGS -> new GroupWithFlags(pos, args.get(0), string(op, pos, args.get(1)));
            case FLAG_ONLY_GROUP -> new FlagOnlyGroup(pos, string(op, pos, args.get(0)));
        };
    }

    private static Unknown unknown(int code, Position pos, List<Expr> args) {
        LOG.fine(() -> "no typed node for op code " + code + " at " + pos);
        return new Unknown(pos, code, args);
    }

    private static StringArg string(Operation op, Position pos, Expr arg) {
        if (arg instanceof StringArg s) {
            return s;
        }
        throw new MalformedExprException(op + " " + pos + ": expected String arg, got " + arg.op());
    }

    private static Expr bound(Operation op, Position pos, Expr arg) {
        if (arg instanceof Char || arg instanceof Escape) {
            return arg;
        }
        throw new MalformedExprException(op + " " + pos + ": expected Char or Escape bound, got " + arg.op());
    }

    private static List<Char> chars(Operation op, Position pos, List<Expr> args) {
        List<Char> chars = new ArrayList<>(args.size());
        for (Expr arg : args) {
            if (!(arg instanceof Char c)) {
                throw new MalformedExprException(op + " " + pos + ": expected Char arg, got " + arg.op());
            }
            chars.add(c);
        }
        return chars;
    }

    private static String arity(Operation op) {
        if (op.maxArgs() < 0) {
            return "at least " + op.minArgs();
        }
        return String.valueOf(op.minArgs());
    }
}
