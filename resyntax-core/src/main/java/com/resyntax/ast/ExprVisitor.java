package com.resyntax.ast;

/**
 * Visitor over every {@link Expr} variant.
 *
 * @param <R> result type
 */
public interface ExprVisitor<R> {

    R visitConcat(Concat concat);

    R visitAlt(Alt alt);

    R visitDot(Dot dot);

    R visitCaret(Caret caret);

    R visitDollar(Dollar dollar);

    R visitStar(Star star);

    R visitPlus(Plus plus);

    R visitQuestion(Question question);

    R visitNonGreedy(NonGreedy nonGreedy);

    R visitPossessive(Possessive possessive);

    R visitLiteral(Literal literal);

    R visitChar(Char ch);

    R visitString(StringArg string);

    R visitQuote(Quote quote);

    R visitEscape(Escape escape);

    R visitPosixClass(PosixClass posixClass);

    R visitCharClass(CharClass charClass);

    R visitCharRange(CharRange charRange);

    R visitRepeat(Repeat repeat);

    R visitCapture(Capture capture);

    R visitNamedCapture(NamedCapture namedCapture);

    R visitGroup(Group group);

    R visitGroupWithFlags(GroupWithFlags group);

    R visitFlagOnlyGroup(FlagOnlyGroup group);

    R visitUnknown(Unknown unknown);
}
