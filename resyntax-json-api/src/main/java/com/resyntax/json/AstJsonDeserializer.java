package com.resyntax.json;

import com.resyntax.ast.Expr;
import com.resyntax.ast.Regexp;

/**
 * Interface for deserializing regexp trees from JSON.
 */
public interface AstJsonDeserializer {

    /**
     * Deserializes a JSON string to a Regexp.
     *
     * @param json the JSON string to deserialize
     * @return the deserialized Regexp
     * @throws AstJsonException if the JSON is invalid or describes a malformed tree
     */
    Regexp deserializeRegexp(String json) throws AstJsonException;

    /**
     * Deserializes a JSON string to a single node.
     *
     * @param json the JSON string to deserialize
     * @return the deserialized node
     * @throws AstJsonException if the JSON is invalid or describes a malformed tree
     */
    Expr deserializeExpr(String json) throws AstJsonException;
}
