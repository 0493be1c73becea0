package com.resyntax.ast;

/**
 * Thrown when a tree, or a node about to be built, breaks the shape
 * contract of its {@link Operation}.
 */
public class MalformedExprException extends IllegalArgumentException {

    public MalformedExprException(String message) {
        super(message);
    }

    public MalformedExprException(String message, Throwable cause) {
        super(message, cause);
    }
}
