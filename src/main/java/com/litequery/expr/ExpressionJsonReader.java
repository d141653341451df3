package com.litequery.expr;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Reads a predicate expression tree from its JSON encoding. Every node is an object
 * whose {@code kind} selects the node type:
 * <pre>
 * {"kind":"lambda","parameter":"doc","body":
 *   {"kind":"binary","operator":"&lt;",
 *    "left":{"kind":"member","target":{"kind":"parameter","name":"doc"},"name":"a"},
 *    "right":{"kind":"constant","value":5}}}
 * </pre>
 */
public class ExpressionJsonReader {
    private final JsonFactory factory = new JsonFactory();

    public Expression read(String json) throws IOException {
        return read(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
    }

    public Expression read(InputStream input) throws IOException {
        try (JsonParser parser = factory.createParser(input)) {
            JsonToken token = parser.nextToken();
            if (token == null) {
                throw new IOException("Empty expression input");
            }
            Object root = parseValue(parser, token);
            if (parser.nextToken() != null) {
                throw new IOException("Trailing content after expression at " + parser.getCurrentLocation());
            }
            return toExpression(root, "$");
        }
    }

    private Object parseValue(JsonParser parser, JsonToken token) throws IOException {
        if (token == null) {
            throw new IOException("Unexpected end of input");
        }
        return switch (token) {
            case START_OBJECT -> parseObject(parser);
            case START_ARRAY -> parseArray(parser);
            case VALUE_STRING -> parser.getText();
            case VALUE_NUMBER_INT -> parser.getNumberValue();
            case VALUE_NUMBER_FLOAT -> parser.getDoubleValue();
            case VALUE_TRUE -> Boolean.TRUE;
            case VALUE_FALSE -> Boolean.FALSE;
            case VALUE_NULL -> null;
            default -> throw new IOException("Unexpected JSON token: " + token);
        };
    }

    private MutableMap<String, Object> parseObject(JsonParser parser) throws IOException {
        MutableMap<String, Object> fields = Maps.mutable.empty();

        while (parser.nextToken() != JsonToken.END_OBJECT) {
            String fieldName = parser.getCurrentName();
            fields.put(fieldName, parseValue(parser, parser.nextToken()));
        }

        return fields;
    }

    private MutableList<Object> parseArray(JsonParser parser) throws IOException {
        MutableList<Object> elements = Lists.mutable.empty();

        JsonToken token;
        while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
            elements.add(parseValue(parser, token));
        }

        return elements;
    }

    private Expression toExpression(Object value, String location) throws IOException {
        if (!(value instanceof MutableMap<?, ?> node)) {
            throw new IOException("Expected an expression object at " + location);
        }
        String kind = string(node, "kind", location);

        try {
            return switch (kind) {
                case "lambda" -> new Expression.Lambda(string(node, "parameter", location),
                        child(node, "body", location));
                case "binary" -> new Expression.Binary(BinaryOperator.fromSymbol(string(node, "operator", location)),
                        child(node, "left", location), child(node, "right", location));
                case "unary" -> new Expression.Unary(child(node, "operand", location));
                case "constant" -> {
                    if (!node.containsKey("value")) {
                        throw new IOException("Missing field 'value' at " + location);
                    }
                    yield new Expression.Constant(node.get("value"));
                }
                case "parameter" -> new Expression.Parameter(string(node, "name", location));
                case "member" -> new Expression.Member(child(node, "target", location),
                        string(node, "name", location), ValueType.fromName(optionalString(node, "type")));
                case "call" -> new Expression.MethodCall(optionalChild(node, "receiver", location),
                        string(node, "method", location), arguments(node, location),
                        ValueType.fromName(optionalString(node, "type")));
                case "subquery" -> new Expression.SubQuery(child(node, "source", location),
                        optionalChild(node, "where", location), resultOperator(node, location));
                default -> throw new IOException("Unknown expression kind '" + kind + "' at " + location);
            };
        } catch (IllegalArgumentException e) {
            throw new IOException(e.getMessage() + " at " + location, e);
        }
    }

    private ResultOperator resultOperator(MutableMap<?, ?> node, String location) throws IOException {
        String name = string(node, "operator", location);
        return switch (name) {
            case "all" -> new ResultOperator.All(optionalChild(node, "predicate", location));
            case "any" -> new ResultOperator.Any();
            case "count" -> new ResultOperator.Count();
            case "first" -> new ResultOperator.First();
            case "last" -> new ResultOperator.Last();
            default -> new ResultOperator.Aggregate(name);
        };
    }

    private MutableList<Expression> arguments(MutableMap<?, ?> node, String location) throws IOException {
        Object value = node.get("arguments");
        MutableList<Expression> arguments = Lists.mutable.empty();
        if (value == null) {
            return arguments;
        }
        if (!(value instanceof MutableList<?> list)) {
            throw new IOException("Field 'arguments' must be an array at " + location);
        }
        for (int i = 0; i < list.size(); i++) {
            arguments.add(toExpression(list.get(i), location + ".arguments[" + i + "]"));
        }
        return arguments;
    }

    private Expression child(MutableMap<?, ?> node, String field, String location) throws IOException {
        if (!node.containsKey(field)) {
            throw new IOException("Missing field '" + field + "' at " + location);
        }
        return toExpression(node.get(field), location + "." + field);
    }

    private Expression optionalChild(MutableMap<?, ?> node, String field, String location)
            throws IOException {
        return node.get(field) != null ? toExpression(node.get(field), location + "." + field) : null;
    }

    private static String string(MutableMap<?, ?> node, String field, String location)
            throws IOException {
        if (!(node.get(field) instanceof String value)) {
            throw new IOException("Missing string field '" + field + "' at " + location);
        }
        return value;
    }

    private static String optionalString(MutableMap<?, ?> node, String field) {
        return node.get(field) instanceof String value ? value : null;
    }
}
