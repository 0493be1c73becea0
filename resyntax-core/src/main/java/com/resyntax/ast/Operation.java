package com.resyntax.ast;

import java.util.Optional;

/**
 * Closed set of regexp AST node kinds.
 *
 * <p>Every constant documents the arguments a node of that kind carries.
 * {@link #NONE} and {@link #NONE2} bound the range of codes and never tag a
 * real node.</p>
 */
public enum Operation {

    NONE("None", 0, 0),

    /**
     * Concatenation, e.g. {@code xy} {@code abc\d}.
     * Args: concatenated expressions. With no args it stands for the empty pattern.
     */
    CONCAT("Concat", 0, -1),

    /** The {@code .} wildcard. */
    DOT("Dot", 0, 0),

    /**
     * Alternation, e.g. {@code a|bc}.
     * Args: branches, left to right.
     */
    ALT("Alt", 0, -1),

    /** {@code x*}. Args[0]: repeated expression. */
    STAR("Star", 1, 1),

    /** {@code x+}. Args[0]: repeated expression. */
    PLUS("Plus", 1, 1),

    /** {@code x?}. Args[0]: repeated expression. */
    QUESTION("Question", 1, 1),

    /** {@code x*?} {@code x??}. Args[0]: quantified expression. */
    NON_GREEDY("NonGreedy", 1, 1),

    /** {@code x*+} {@code x++}. Args[0]: quantified expression. */
    POSSESSIVE("Possessive", 1, 1),

    /** The {@code ^} anchor. */
    CARET("Caret", 0, 0),

    /** The {@code $} anchor. */
    DOLLAR("Dollar", 0, 0),

    /**
     * Run of consecutive literal characters, e.g. {@code ab} {@code 10x}.
     * Args: the {@link #CHAR} nodes.
     */
    LITERAL("Literal", 0, -1),

    /** A single literal character. */
    CHAR("Char", 0, 0),

    /** Artificial text holder used as an argument of other nodes. */
    STRING("String", 0, 0),

    /** {@code \Q...\E} literal block. The closing {@code \E} is optional. */
    QUOTE("Quote", 0, 0),

    /** Single character escape, e.g. {@code \d} {@code \n}. */
    ESCAPE("Escape", 0, 0),

    /** Escaped meta character, e.g. {@code \(} {@code \+}. */
    ESCAPE_META("EscapeMeta", 0, 0),

    /** Octal escape of up to 3 digits, e.g. {@code \123}. */
    ESCAPE_OCTAL("EscapeOctal", 0, 0),

    /** Two digit hex escape, e.g. {@code \x7F}. */
    ESCAPE_HEX("EscapeHex", 0, 0),

    /** Braced hex escape, e.g. {@code \x{10FFFF}}. */
    ESCAPE_HEX_FULL("EscapeHexFull", 0, 0),

    /** One letter Unicode class escape, e.g. {@code \pL}. */
    ESCAPE_UNI("EscapeUni", 0, 0),

    /** Braced Unicode class escape, e.g. {@code \p{Greek}}. */
    ESCAPE_UNI_FULL("EscapeUniFull", 0, 0),

    /**
     * Character class, e.g. {@code [a-z0-9]}.
     * Args: class elements, including {@link #CHAR_RANGE} and {@link #POSIX_CLASS}.
     */
    CHAR_CLASS("CharClass", 0, -1),

    /** Negated character class, e.g. {@code [^abc]}. Args as for {@link #CHAR_CLASS}. */
    NEG_CHAR_CLASS("NegCharClass", 0, -1),

    /**
     * Inclusive range inside a class, e.g. {@code 0-9}.
     * Args[0]: lower bound, Args[1]: upper bound (Char or Escape).
     */
    CHAR_RANGE("CharRange", 2, 2),

    /** Named ASCII set inside a class, e.g. {@code [:alpha:]}. */
    POSIX_CLASS("PosixClass", 0, 0),

    /**
     * Counted repetition, e.g. {@code x{2,5}}.
     * Args[0]: repeated expression, Args[1]: count ({@link #STRING}).
     */
    REPEAT("Repeat", 2, 2),

    /** Capturing group {@code (re)}. Args[0]: enclosed expression. */
    CAPTURE("Capture", 1, 1),

    /**
     * Named capturing group {@code (?P<name>re)}.
     * Args[0]: enclosed expression, Args[1]: name ({@link #STRING}).
     */
    NAMED_CAPTURE("NamedCapture", 2, 2),

    /** Non-capturing group {@code (?:re)}. Args[0]: enclosed expression. */
    GROUP("Group", 1, 1),

    /**
     * Non-capturing group with flags {@code (?i:re)}.
     * Args[0]: enclosed expression, Args[1]: flags ({@link #STRING}).
     */
    GROUP_WITH_FLAGS("GroupWithFlags", 2, 2),

    /** Flags applied to the enclosing group, e.g. {@code (?i-m)}. Args[0]: flags ({@link #STRING}). */
    FLAG_ONLY_GROUP("FlagOnlyGroup", 1, 1),

    NONE2("None2", 0, 0);

    private static final Operation[] BY_CODE = values();

    private final String displayName;
    private final int minArgs;
    private final int maxArgs;

    Operation(String displayName, int minArgs, int maxArgs) {
        this.displayName = displayName;
        this.minArgs = minArgs;
        this.maxArgs = maxArgs;
    }

    /**
     * Numeric tag of this operation. Codes follow declaration order, so
     * {@code NONE} is 0 and {@code NONE2} is the largest code.
     */
    public int code() {
        return ordinal();
    }

    public String displayName() {
        return displayName;
    }

    public int minArgs() {
        return minArgs;
    }

    /**
     * @return the maximum number of args, or -1 when unbounded
     */
    public int maxArgs() {
        return maxArgs;
    }

    public boolean isSentinel() {
        return this == NONE || this == NONE2;
    }

    public boolean acceptsArgCount(int count) {
        if (isSentinel() || count < minArgs) {
            return false;
        }
        return maxArgs < 0 || count <= maxArgs;
    }

    public static Optional<Operation> fromCode(int code) {
        if (code < 0 || code >= BY_CODE.length) {
            return Optional.empty();
        }
        return Optional.of(BY_CODE[code]);
    }

    public static Optional<Operation> fromDisplayName(String name) {
        for (Operation op : BY_CODE) {
            if (op.displayName.equals(name)) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return displayName;
    }
}
