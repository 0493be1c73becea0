package com.resyntax.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks the span and tag invariants of a built tree.
 */
public final class RegexpValidator {

    private RegexpValidator() {
        // Utility class
    }

    public record Violation(Expr expr, String message) {
        @Override
        public String toString() {
            return message;
        }
    }

    /**
     * Collects every invariant violation in {@code re}, in pre-order.
     *
     * @return violations found, empty for a well-formed tree
     */
    public static List<Violation> validate(Regexp re) {
        List<Violation> violations = new ArrayList<>();
        check(re.source().length(), re.expr(), null, violations);
        return violations;
    }

    /**
     * @throws MalformedExprException describing the first violation, if any
     */
    public static Regexp requireValid(Regexp re) {
        List<Violation> violations = validate(re);
        if (!violations.isEmpty()) {
            throw new MalformedExprException(violations.get(0).message());
        }
        return re;
    }

    private static void check(int sourceLength, Expr e, Expr parent, List<Violation> out) {
        String where = describe(e);
        if (e.end() > sourceLength) {
            out.add(new Violation(e, where + ": span ends past source length " + sourceLength));
        }
        if (parent != null && !parent.pos().contains(e.pos())) {
            out.add(new Violation(e, where + ": span outside parent " + describe(parent)));
        }
        if (e instanceof CharRange range) {
            for (Expr bound : range.args()) {
                if (!(bound instanceof Char || bound instanceof Escape)) {
                    out.add(new Violation(bound, describe(bound) + ": CharRange bound must be Char or Escape"));
                }
            }
        }
        if (e instanceof Unknown) {
            if (e.op().isSentinel() && e.code() == e.op().code()) {
                out.add(new Violation(e, where + ": sentinel used as node tag"));
            } else {
                out.add(new Violation(e, where + ": unrecognized op code " + e.code()));
            }
        }
        for (Expr arg : e.args()) {
            check(sourceLength, arg, e, out);
        }
    }

    private static String describe(Expr e) {
        String name = e instanceof Unknown ? "<op=" + e.code() + ">" : e.op().displayName();
        return name + " " + e.pos();
    }
}
