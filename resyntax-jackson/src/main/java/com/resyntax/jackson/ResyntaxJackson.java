package com.resyntax.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Factory for creating properly configured ObjectMapper instances for regexp trees.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = ResyntaxJackson.createObjectMapper();
 * String json = mapper.writeValueAsString(regexp);
 * Regexp regexp = mapper.readValue(json, Regexp.class);
 * </pre>
 */
public final class ResyntaxJackson {

    private ResyntaxJackson() {
        // Utility class
    }

    /**
     * Creates a new ObjectMapper configured for regexp tree serialization/deserialization.
     *
     * The returned mapper:
     * - Writes every Expr in the generic op/begin/end/args form
     * - Rebuilds typed nodes on read, rejecting arity violations
     * - Excludes null values
     * - Ignores unknown properties during deserialization
     *
     * @return A new configured ObjectMapper instance
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new ParameterNamesModule());

        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);

        // Ignore unknown properties during deserialization
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        mapper.registerModule(new AstModule());

        return mapper;
    }
}
