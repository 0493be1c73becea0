package com.resyntax.jackson;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.resyntax.ast.Expr;
import com.resyntax.ast.Regexp;
import com.resyntax.json.*;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Jackson-based implementation of AstJsonProvider.
 */
public class JacksonAstJsonProvider implements AstJsonProvider {

    private static final Logger LOG = Logger.getLogger(JacksonAstJsonProvider.class.getName());

    private final ObjectMapper mapper;
    private final AstJsonSerializer serializer;
    private final AstJsonDeserializer deserializer;

    public JacksonAstJsonProvider() {
        this(ResyntaxJackson.createObjectMapper());
    }

    public JacksonAstJsonProvider(ObjectMapper mapper) {
        this.mapper = mapper;
        this.serializer = new JacksonSerializer(mapper);
        this.deserializer = new JacksonDeserializer(mapper);
    }

    @Override
    public AstJsonSerializer getSerializer() {
        return serializer;
    }

    @Override
    public AstJsonDeserializer getDeserializer() {
        return deserializer;
    }

    @Override
    public String getName() {
        return "Jackson";
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getObjectMapper() {
        return mapper;
    }

    // ==================== Inner Classes ====================

    private static class JacksonSerializer implements AstJsonSerializer {
        private final ObjectMapper mapper;

        JacksonSerializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public String serialize(Regexp regexp) throws AstJsonException {
            try {
                return mapper.writeValueAsString(regexp);
            } catch (Exception e) {
                throw new AstJsonException("Failed to serialize Regexp", e);
            }
        }

        @Override
        public String serializePretty(Regexp regexp) throws AstJsonException {
            try {
                return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(regexp);
            } catch (Exception e) {
                throw new AstJsonException("Failed to serialize Regexp", e);
            }
        }

        @Override
        public String serializeExpr(Expr expr) throws AstJsonException {
            try {
                return mapper.writerFor(Expr.class).writeValueAsString(expr);
            } catch (Exception e) {
                throw new AstJsonException("Failed to serialize " + expr.op(), e);
            }
        }
    }

    private static class JacksonDeserializer implements AstJsonDeserializer {
        private final ObjectMapper mapper;

        JacksonDeserializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public Regexp deserializeRegexp(String json) throws AstJsonException {
            try {
                return mapper.readValue(json, Regexp.class);
            } catch (Exception e) {
                LOG.log(Level.FINE, "Rejected Regexp JSON", e);
                throw new AstJsonException("Failed to deserialize Regexp", e);
            }
        }

        @Override
        public Expr deserializeExpr(String json) throws AstJsonException {
            try {
                return mapper.readValue(json, Expr.class);
            } catch (Exception e) {
                LOG.log(Level.FINE, "Rejected Expr JSON", e);
                throw new AstJsonException("Failed to deserialize Expr", e);
            }
        }
    }
}
