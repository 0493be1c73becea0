package com.resyntax.ast;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ExprTest {

    @Test
    void testTextOf() {
        Regexp re = new Regexp("a|bc", new Alt(Position.of(0, 4), List.of(
            new Literal(Position.of(0, 1), List.of(new Char(Position.of(0, 1)))),
            new Literal(Position.of(2, 4), List.of(new Char(Position.of(2, 3)), new Char(Position.of(3, 4)))))));
        assertEquals("a|bc", re.textOf(re.expr()));
        assertEquals("bc", re.textOf(re.expr().lastArg()));
        assertEquals("c", re.textOf(re.expr().lastArg().lastArg()));
    }

    @Test
    void testSpanOfIsAViewOverTheSource() {
        Regexp re = new Regexp("x{3,5}", new Repeat(Position.of(0, 6),
            new Char(Position.of(0, 1)), new StringArg(Position.of(2, 5))));
        Repeat repeat = (Repeat) re.expr();
        CharSequence count = re.spanOf(repeat.count());
        assertEquals(3, count.length());
        assertEquals("3,5", count.toString());
        assertEquals(re.textOf(repeat.count()), count.toString());
    }

    @Test
    void testTextOutsideSource() {
        Regexp re = new Regexp("ab", new Char(Position.of(1, 3)));
        assertThrows(IndexOutOfBoundsException.class, () -> re.textOf(re.expr()));
        assertThrows(IndexOutOfBoundsException.class, () -> re.spanOf(re.expr()));
    }

    @Test
    void testPositionBounds() {
        assertThrows(IllegalArgumentException.class, () -> Position.of(-1, 2));
        assertThrows(IllegalArgumentException.class, () -> Position.of(3, 2));
        Position empty = Position.of(4, 4);
        assertEquals(0, empty.length());
        assertTrue(Position.of(0, 10).contains(Position.of(2, 5)));
        assertTrue(Position.of(0, 10).contains(Position.of(10, 10)));
        assertFalse(Position.of(2, 5).contains(Position.of(0, 10)));
    }

    @Test
    void testArgsFollowRoles() {
        Char lower = new Char(Position.of(1, 2));
        Escape upper = new Escape(Position.of(3, 5), Escape.Kind.SIMPLE);
        CharRange range = new CharRange(Position.of(1, 5), lower, upper);
        assertEquals(Operation.CHAR_RANGE, range.op());
        assertEquals(List.of(lower, upper), range.args());
        assertSame(upper, range.lastArg());

        StringArg flags = new StringArg(Position.of(2, 3));
        GroupWithFlags group = new GroupWithFlags(Position.of(0, 5), Concat.empty(Position.of(4, 4)), flags);
        assertEquals(Operation.GROUP_WITH_FLAGS, group.op());
        assertSame(flags, group.lastArg());
        assertEquals(Operation.STRING, flags.op());
    }

    @Test
    void testLastArgOnLeafIsAContractViolation() {
        assertThrows(IndexOutOfBoundsException.class, () -> new Dot(Position.of(0, 1)).lastArg());
        assertThrows(IndexOutOfBoundsException.class, () -> Concat.empty(Position.of(0, 0)).lastArg());
    }

    @Test
    void testChildrenAreCopied() {
        List<Expr> items = new ArrayList<>();
        items.add(new Char(Position.of(0, 1)));
        Concat concat = new Concat(Position.of(0, 2), items);
        items.add(new Char(Position.of(1, 2)));
        assertEquals(1, concat.items().size());
        assertThrows(UnsupportedOperationException.class, () -> concat.args().add(new Dot(Position.of(0, 1))));
    }

    @Test
    void testEscapeKindsMapToOperations() {
        for (Escape.Kind kind : Escape.Kind.values()) {
            Escape escape = new Escape(Position.of(0, 2), kind);
            assertEquals(kind.op(), escape.op());
            assertEquals(kind, Escape.Kind.of(kind.op()).orElseThrow());
        }
        assertTrue(Escape.Kind.of(Operation.CHAR).isEmpty());
    }

    @Test
    void testCharClassNegation() {
        assertEquals(Operation.CHAR_CLASS, new CharClass(Position.of(0, 2), false, List.of()).op());
        assertEquals(Operation.NEG_CHAR_CLASS, new CharClass(Position.of(0, 3), true, List.of()).op());
    }

    @Test
    void testUnknownCodes() {
        Unknown sentinel = new Unknown(Position.of(0, 0), 32, List.of());
        assertEquals(Operation.NONE2, sentinel.op());
        assertEquals(32, sentinel.code());

        Unknown future = new Unknown(Position.of(0, 0), 40, List.of());
        assertEquals(Operation.NONE, future.op());
        assertEquals(40, future.code());

        assertThrows(IllegalArgumentException.class,
            () -> new Unknown(Position.of(0, 0), Operation.DOT.code(), List.of()));
    }
}
