package com.resyntax.json;

import com.resyntax.ast.Expr;
import com.resyntax.ast.Regexp;

/**
 * Interface for serializing regexp trees to JSON.
 */
public interface AstJsonSerializer {

    /**
     * Serializes a regexp, source text included, to a JSON string.
     *
     * @param regexp the regexp to serialize
     * @return the JSON representation of the regexp
     * @throws AstJsonException if serialization fails
     */
    String serialize(Regexp regexp) throws AstJsonException;

    /**
     * Serializes a regexp to a pretty-printed JSON string.
     *
     * @param regexp the regexp to serialize
     * @return the pretty-printed JSON representation of the regexp
     * @throws AstJsonException if serialization fails
     */
    String serializePretty(Regexp regexp) throws AstJsonException;

    /**
     * Serializes a single subtree. The output carries spans only, no text.
     *
     * @param expr the node to serialize
     * @return the JSON representation of the node
     * @throws AstJsonException if serialization fails
     */
    String serializeExpr(Expr expr) throws AstJsonException;
}
