package com.resyntax.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.*;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.resyntax.ast.*;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Jackson module that configures serialization/deserialization for regexp trees.
 *
 * Every {@link Expr} is written in the generic positional form
 * <pre>{"op":"Repeat","begin":0,"end":6,"args":[...]}</pre>
 * where {@code op} is the operation's display name, or the raw numeric code
 * for an {@link Unknown} node outside the known range. Empty {@code args}
 * are omitted. Reading goes through {@link ExprFactory}, so arity errors in
 * the input are rejected.
 *
 * {@link Regexp} and {@link Position} are plain records and need no help.
 */
public class AstModule extends SimpleModule {

    public AstModule() {
        super("AstModule", new Version(1, 0, 0, null, "com.resyntax", "resyntax-jackson"));
        addSerializer(Expr.class, new ExprSerializer());
        addDeserializer(Expr.class, new ExprDeserializer());
    }

    // ==================== Serializer ====================

    private static class ExprSerializer extends JsonSerializer<Expr> {
        @Override
        public void serialize(Expr expr, JsonGenerator gen, SerializerProvider serializers) throws IOException {
            gen.writeStartObject();
            if (expr instanceof Unknown && Operation.fromCode(expr.code()).isEmpty()) {
                gen.writeNumberField("op", expr.code());
            } else {
                gen.writeStringField("op", expr.op().displayName());
            }
            gen.writeNumberField("begin", expr.begin());
            gen.writeNumberField("end", expr.end());
            List<Expr> args = expr.args();
            if (!args.isEmpty()) {
                gen.writeArrayFieldStart("args");
                for (Expr arg : args) {
                    serialize(arg, gen, serializers);
                }
                gen.writeEndArray();
            }
            gen.writeEndObject();
        }

        @Override
        public Class<Expr> handledType() {
            return Expr.class;
        }
    }

    // ==================== Deserializer ====================

    private static class ExprDeserializer extends JsonDeserializer<Expr> {
        @Override
        public Expr deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonNode node = p.getCodec().readTree(p);
            try {
                return toExpr(p, node);
            } catch (IllegalArgumentException e) {
                // MalformedExprException, or a bad span from Position
                throw JsonMappingException.from(p, e.getMessage(), e);
            }
        }

        private Expr toExpr(JsonParser p, JsonNode node) throws JsonMappingException {
            if (node == null || !node.isObject()) {
                throw JsonMappingException.from(p, "Expected expression object, got " + node);
            }
            JsonNode op = node.get("op");
            JsonNode begin = node.get("begin");
            JsonNode end = node.get("end");
            if (op == null || begin == null || end == null || !begin.isInt() || !end.isInt()) {
                throw JsonMappingException.from(p, "Expression needs 'op', 'begin' and 'end': " + node);
            }

            List<Expr> args = new ArrayList<>();
            JsonNode argsNode = node.get("args");
            if (argsNode != null && !argsNode.isNull()) {
                if (!argsNode.isArray()) {
                    throw JsonMappingException.from(p, "'args' must be an array: " + node);
                }
                for (JsonNode child : argsNode) {
                    args.add(toExpr(p, child));
                }
            }

            Position pos = Position.of(begin.intValue(), end.intValue());
            if (op.isInt()) {
                return ExprFactory.create(op.intValue(), pos, args);
            }
            Optional<Operation> operation = Operation.fromDisplayName(op.asText());
            if (operation.isEmpty()) {
                throw JsonMappingException.from(p, "Unknown op '" + op.asText() + "'");
            }
            return ExprFactory.create(operation.get(), pos, args);
        }

        @Override
        public Class<?> handledType() {
            return Expr.class;
        }
    }
}
