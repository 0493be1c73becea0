package com.resyntax;

import com.resyntax.ast.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class RegexpFormatterTest extends ResyntaxLoggingConfig {

    private static Position at(int begin, int end) {
        return Position.of(begin, end);
    }

    private static Char ch(int begin) {
        return new Char(at(begin, begin + 1));
    }

    // Literal whose chars are one per source char.
    private static Literal lit(int begin, int end) {
        List<Char> chars = new ArrayList<>();
        for (int i = begin; i < end; i++) {
            chars.add(ch(i));
        }
        return new Literal(at(begin, end), chars);
    }

    static Stream<Arguments> canonicalForms() {
        return Stream.of(
            Arguments.of("a|bc",
                new Alt(at(0, 4), List.of(lit(0, 1), lit(2, 4))),
                "(or a bc)"),
            Arguments.of("[a0-9]",
                new CharClass(at(0, 6), false, List.of(ch(1), new CharRange(at(2, 5), ch(2), ch(4)))),
                "[a 0-9]"),
            Arguments.of("x{3,5}",
                new Repeat(at(0, 6), lit(0, 1), new StringArg(at(2, 5))),
                "(repeat x 3,5)"),
            Arguments.of("(?P<foo>ab)",
                new NamedCapture(at(0, 11), new Concat(at(8, 10), List.of(lit(8, 10))), new StringArg(at(4, 7))),
                "(capture {ab} foo)"),
            Arguments.of("^a$",
                new Concat(at(0, 3), List.of(new Caret(at(0, 1)), lit(1, 2), new Dollar(at(2, 3)))),
                "{^ a $}"),
            Arguments.of(".*",
                new Star(at(0, 2), new Dot(at(0, 1))),
                "(* .)"),
            Arguments.of(".*?",
                new NonGreedy(at(0, 3), new Star(at(0, 2), new Dot(at(0, 1)))),
                "(non-greedy (* .))"),
            Arguments.of("a++",
                new Possessive(at(0, 3), new Plus(at(0, 2), lit(0, 1))),
                "(possessive (+ a))"),
            Arguments.of("a?",
                new Question(at(0, 2), lit(0, 1)),
                "(? a)"),
            Arguments.of("(?:ab)",
                new Group(at(0, 6), new Concat(at(3, 5), List.of(lit(3, 5)))),
                "(group {ab})"),
            Arguments.of("(?i:ab)",
                new GroupWithFlags(at(0, 7), new Concat(at(4, 6), List.of(lit(4, 6))), new StringArg(at(2, 3))),
                "(group {ab} i)"),
            Arguments.of("(?i-m)",
                new FlagOnlyGroup(at(0, 6), new StringArg(at(2, 5))),
                "(flags i-m)"),
            Arguments.of("()",
                new Capture(at(0, 2), Concat.empty(at(1, 1))),
                "(capture {})"),
            Arguments.of("[^[:alpha:]\\d]",
                new CharClass(at(0, 14), true, List.of(
                    new PosixClass(at(2, 11)),
                    new Escape(at(11, 13), Escape.Kind.SIMPLE))),
                "[^[:alpha:] \\d]"),
            Arguments.of("[\\x00-\\x7F]",
                new CharClass(at(0, 11), false, List.of(new CharRange(at(1, 10),
                    new Escape(at(1, 5), Escape.Kind.HEX),
                    new Escape(at(6, 10), Escape.Kind.HEX)))),
                "[\\x00-\\x7F]"),
            Arguments.of("\\p{Greek}\\pL\\x{10FFFF}\\123\\+",
                new Concat(at(0, 28), List.of(
                    new Escape(at(0, 9), Escape.Kind.UNI_FULL),
                    new Escape(at(9, 12), Escape.Kind.UNI),
                    new Escape(at(12, 22), Escape.Kind.HEX_FULL),
                    new Escape(at(22, 26), Escape.Kind.OCTAL),
                    new Escape(at(26, 28), Escape.Kind.META))),
                "{\\p{Greek} \\pL \\x{10FFFF} \\123 \\+}"),
            Arguments.of("\\Q.?\\E",
                new Quote(at(0, 6)),
                "(q \\Q.?\\E)"),
            Arguments.of("[{}]",
                new CharClass(at(0, 4), false, List.of(ch(1), ch(2))),
                "['{' '}']"),
            Arguments.of("x{",
                lit(0, 2),
                "x{")
        );
    }

    @ParameterizedTest(name = "{0} -> {2}")
    @MethodSource("canonicalForms")
    void testCanonicalForm(String source, Expr expr, String expected) {
        assertEquals(expected, RegexpFormatter.format(new Regexp(source, expr)));
    }

    @Test
    @DisplayName("Lone brace literals are quoted")
    void testBraceLiteral() {
        assertEquals("'{'", RegexpFormatter.format(new Regexp("{", lit(0, 1))));
        assertEquals("'}'", RegexpFormatter.format(new Regexp("}", lit(0, 1))));
        assertEquals("'{'", RegexpFormatter.format(new Regexp("a{", ch(1))));
    }

    @Test
    void testBraceInStringArgIsNotQuoted() {
        Regexp re = new Regexp("{", new StringArg(at(0, 1)));
        assertEquals("{", RegexpFormatter.format(re));
    }

    @Test
    void testEmptyConcat() {
        assertEquals("{}", RegexpFormatter.format(new Regexp("", Concat.empty(at(0, 0)))));
    }

    @Test
    void testEmptyAlternationAndClass() {
        assertEquals("(or )", RegexpFormatter.format(new Regexp("", new Alt(at(0, 0), List.of()))));
        assertEquals("[]", RegexpFormatter.format(new Regexp("", new CharClass(at(0, 0), false, List.of()))));
        assertEquals("[^]", RegexpFormatter.format(new Regexp("", new CharClass(at(0, 0), true, List.of()))));
    }

    @Test
    @DisplayName("Unknown tags print as a placeholder and formatting continues")
    void testUnknownPlaceholder() {
        Regexp re = new Regexp("ab", new Concat(at(0, 2), List.of(
            lit(0, 1),
            new Unknown(at(1, 2), Operation.NONE2.code(), List.of()),
            new Unknown(at(1, 2), 99, List.of(ch(1))),
            new Unknown(at(0, 0), Operation.NONE.code(), List.of()))));
        assertEquals("{a <op=32> <op=99> <op=0>}", RegexpFormatter.format(re));
    }

    @Test
    void testSubtree() {
        Regexp re = new Regexp("a|bc", new Alt(at(0, 4), List.of(lit(0, 1), lit(2, 4))));
        assertEquals("bc", RegexpFormatter.format(re, re.expr().lastArg()));
    }

    @Test
    void testDeterministic() {
        Regexp re = new Regexp("(?:a|b)*", new Star(at(0, 8),
            new Group(at(0, 7), new Alt(at(3, 6), List.of(lit(3, 4), lit(5, 6))))));
        String first = RegexpFormatter.format(re);
        assertEquals("(* (group (or a b)))", first);
        assertEquals(first, RegexpFormatter.format(re));
    }

    @Test
    void testDistinctShapesFormatDistinctly() {
        String source = "ab";
        List<Expr> trees = List.of(
            new Alt(at(0, 2), List.of(ch(0), ch(1))),
            new Alt(at(0, 2), List.of(ch(1), ch(0))),
            new Concat(at(0, 2), List.of(ch(0), ch(1))),
            new Concat(at(0, 2), List.of(lit(0, 2))),
            new Capture(at(0, 2), lit(0, 2)),
            new Group(at(0, 2), lit(0, 2)),
            new Star(at(0, 2), lit(0, 2)),
            new Possessive(at(0, 2), lit(0, 2)),
            new CharClass(at(0, 2), false, List.of(ch(0), ch(1))),
            new CharClass(at(0, 2), true, List.of(ch(0), ch(1))),
            new CharClass(at(0, 2), false, List.of(new CharRange(at(0, 2), ch(0), ch(1)))));
        long distinct = trees.stream()
            .map(e -> RegexpFormatter.format(new Regexp(source, e)))
            .distinct()
            .count();
        assertEquals(trees.size(), distinct);
    }

    @Test
    void testSpanPastSourceFails() {
        assertThrows(IndexOutOfBoundsException.class,
            () -> RegexpFormatter.format(new Regexp("ab", lit(0, 5))));
        assertThrows(IndexOutOfBoundsException.class,
            () -> RegexpFormatter.format(new Regexp("ab", ch(3))));
    }

    @Test
    void testDoesNotModifyInput() {
        Concat root = new Concat(at(0, 2), List.of(ch(0), ch(1)));
        Regexp re = new Regexp("ab", root);
        RegexpFormatter.format(re);
        assertSame(root, re.expr());
        assertEquals(List.of(ch(0), ch(1)), root.items());
    }
}
