package com.resyntax;

import com.resyntax.ast.*;

import java.util.List;

/**
 * Renders a regexp AST as a canonical s-expression-like string.
 *
 * <p>The output is meant for golden-file comparison and debugging, not for
 * parsing back into a pattern. Leaf nodes print their source text verbatim;
 * a lone literal <code>&#123;</code> or <code>&#125;</code> is quoted as
 * <code>'&#123;'</code> / <code>'&#125;'</code> so it cannot be mistaken for the
 * braces around a {@link Concat}.</p>
 *
 * <pre>
 * a|bc        (or a bc)
 * (?P&lt;foo&gt;ab)  (capture {ab} foo)
 * x{3,5}      (repeat x 3,5)
 * </pre>
 *
 * <p>Formatting never fails on an {@link Unknown} node, which prints as
 * {@code <op=N>}. Nodes whose spans fall outside the source throw
 * {@link IndexOutOfBoundsException}.</p>
 */
public final class RegexpFormatter {

    private RegexpFormatter() {
        // Utility class
    }

    public static String format(Regexp re) {
        return format(re, re.expr());
    }

    /**
     * Formats the subtree rooted at {@code e}, which must belong to {@code re}.
     */
    public static String format(Regexp re, Expr e) {
        StringBuilder out = new StringBuilder(re.source().length() * 2);
        e.accept(new Printer(re.source(), out));
        return out.toString();
    }

    private static final class Printer implements ExprVisitor<Void> {
        private final String source;
        private final StringBuilder out;

        Printer(String source, StringBuilder out) {
            this.source = source;
            this.out = out;
        }

        private void text(Expr e) {
            if (e.end() > source.length()) {
                throw new IndexOutOfBoundsException(e.op() + " " + e.pos() + " ends past source length " + source.length());
            }
            out.append(source, e.begin(), e.end());
        }

        // Literal text, with a lone brace quoted.
        private void literalText(Expr e) {
            if (e.pos().length() == 1) {
                char c = source.charAt(e.begin());
                if (c == '{' || c == '}') {
                    out.append('\'').append(c).append('\'');
                    return;
                }
            }
            text(e);
        }

        private void list(List<? extends Expr> args) {
            for (int i = 0; i < args.size(); i++) {
                if (i > 0) {
                    out.append(' ');
                }
                args.get(i).accept(this);
            }
        }

        private Void wrap(String head, Expr arg) {
            out.append('(').append(head).append(' ');
            arg.accept(this);
            out.append(')');
            return null;
        }

        private Void wrap(String head, Expr arg, StringArg tail) {
            out.append('(').append(head).append(' ');
            arg.accept(this);
            out.append(' ');
            text(tail);
            out.append(')');
            return null;
        }

        @Override
        public Void visitConcat(Concat concat) {
            out.append('{');
            list(concat.items());
            out.append('}');
            return null;
        }

        @Override
        public Void visitAlt(Alt alt) {
            out.append("(or ");
            list(alt.branches());
            out.append(')');
            return null;
        }

        @Override
        public Void visitDot(Dot dot) {
            out.append('.');
            return null;
        }

        @Override
        public Void visitCaret(Caret caret) {
            out.append('^');
            return null;
        }

        @Override
        public Void visitDollar(Dollar dollar) {
            out.append('$');
            return null;
        }

        @Override
        public Void visitStar(Star star) {
            return wrap("*", star.expr());
        }

        @Override
        public Void visitPlus(Plus plus) {
            return wrap("+", plus.expr());
        }

        @Override
        public Void visitQuestion(Question question) {
            return wrap("?", question.expr());
        }

        @Override
        public Void visitNonGreedy(NonGreedy nonGreedy) {
            return wrap("non-greedy", nonGreedy.expr());
        }

        @Override
        public Void visitPossessive(Possessive possessive) {
            return wrap("possessive", possessive.expr());
        }

        @Override
        public Void visitLiteral(Literal literal) {
            literalText(literal);
            return null;
        }

        @Override
        public Void visitChar(Char ch) {
            literalText(ch);
            return null;
        }

        @Override
        public Void visitString(StringArg string) {
            text(string);
            return null;
        }

        @Override
        public Void visitQuote(Quote quote) {
            out.append("(q ");
            text(quote);
            out.append(')');
            return null;
        }

        @Override
        public Void visitEscape(Escape escape) {
            text(escape);
            return null;
        }

        @Override
        public Void visitPosixClass(PosixClass posixClass) {
            text(posixClass);
            return null;
        }

        @Override
        public Void visitCharClass(CharClass charClass) {
            out.append(charClass.negated() ? "[^" : "[");
            list(charClass.elements());
            out.append(']');
            return null;
        }

        @Override
        public Void visitCharRange(CharRange charRange) {
            charRange.lower().accept(this);
            out.append('-');
            charRange.upper().accept(this);
            return null;
        }

        @Override
        public Void visitRepeat(Repeat repeat) {
            return wrap("repeat", repeat.expr(), repeat.count());
        }

        @Override
        public Void visitCapture(Capture capture) {
            return wrap("capture", capture.expr());
        }

        @Override
        public Void visitNamedCapture(NamedCapture namedCapture) {
            return wrap("capture", namedCapture.expr(), namedCapture.name());
        }

        @Override
        public Void visitGroup(Group group) {
            return wrap("group", group.expr());
        }

        @Override
        public Void visitGroupWithFlags(GroupWithFlags group) {
            return wrap("group", group.expr(), group.flags());
        }

        @Override
        public Void visitFlagOnlyGroup(FlagOnlyGroup group) {
            out.append("(flags ");
            text(group.flags());
            out.append(')');
            return null;
        }

        @Override
        public Void visitUnknown(Unknown unknown) {
            out.append("<op=").append(unknown.code()).append('>');
            return null;
        }
    }
}
