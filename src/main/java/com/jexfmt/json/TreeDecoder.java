package com.jexfmt.json;

import com.jexfmt.ast.AtomicLiteral;
import com.jexfmt.ast.Node;
import org.eclipse.collections.api.list.ImmutableList;

/**
 * Converts the JSON encoding of a quoted expression tree into {@link Node}s.
 *
 * <p>Scalars are literals ({@code null} is the {@code nil} symbol), arrays are
 * lists, and objects name their variant in a {@code "kind"} field:
 * <pre>
 * {"kind": "call", "name": "foo", "args": [1, {"kind": "symbol", "name": "ok"}]}
 * </pre>
 */
public class TreeDecoder {
    private static final String KIND = "kind";

    public Node decode(JsonValue value) {
        if (value instanceof JsonValue.JsonObject obj) {
            return decodeObject(obj);
        }
        if (value instanceof JsonValue.JsonArray arr) {
            return new Node.Sequence(decodeAll(arr.elements()));
        }
        if (value instanceof JsonValue.JsonString s) {
            return new Node.Atomic(AtomicLiteral.of(s.value()));
        }
        if (value instanceof JsonValue.JsonLong n) {
            return new Node.Atomic(AtomicLiteral.of(n.value()));
        }
        if (value instanceof JsonValue.JsonDouble n) {
            return new Node.Atomic(AtomicLiteral.of(n.value()));
        }
        if (value instanceof JsonValue.JsonBoolean b) {
            return new Node.Atomic(AtomicLiteral.symbol(Boolean.toString(b.value())));
        }
        return new Node.Atomic(AtomicLiteral.symbol("nil"));
    }

    private Node decodeObject(JsonValue.JsonObject obj) {
        String kind = string(obj, KIND);
        return switch (kind) {
            case "symbol" -> new Node.Atomic(AtomicLiteral.symbol(string(obj, "name")));
            case "list" -> new Node.Sequence(nodes(obj, "items"));
            case "tuple" -> new Node.Tuple(nodes(obj, "items"));
            case "map" -> new Node.MapLiteral(array(obj, "pairs").collect(this::decodePair));
            case "fn_ref" -> new Node.FunctionRef(string(obj, "name"), integer(obj, "arity"));
            case "negate" -> new Node.Negate(node(obj, "inner"));
            case "alias" -> new Node.AliasPath(array(obj, "segments").collect(s -> asString(s, "segments")));
            case "anon_call" -> new Node.AnonymousCall(string(obj, "name"), nodes(obj, "args"));
            case "attr" -> new Node.AttributeRef(string(obj, "name"));
            case "attr_set" -> new Node.AttributeSet(string(obj, "name"), node(obj, "value"));
            case "var" -> new Node.Identifier(string(obj, "name"));
            case "access" -> new Node.IndexAccess(node(obj, "base"), node(obj, "key"));
            case "qualified_ref" -> new Node.QualifiedRef(node(obj, "path"), string(obj, "name"));
            case "qualified_call" -> new Node.QualifiedCall(node(obj, "path"), string(obj, "name"), nodes(obj, "args"));
            case "call" -> new Node.Call(string(obj, "name"), nodes(obj, "args"));
            case "sigil" -> decodeSigil(obj);
            default -> throw new IllegalArgumentException("Unknown node kind: " + kind);
        };
    }

    private Node decodeSigil(JsonValue.JsonObject obj) {
        String sigil = string(obj, "char");
        if (sigil.length() != 1) {
            throw new IllegalArgumentException("Sigil char must be a single character: \"" + sigil + "\"");
        }
        String modifiers = obj.fields().containsKey("modifiers") ? string(obj, "modifiers") : "";
        return new Node.QuotedLiteral(sigil.charAt(0), string(obj, "content"), modifiers);
    }

    private Node.Pair decodePair(JsonValue value) {
        if (value instanceof JsonValue.JsonArray arr && arr.elements().size() == 2) {
            return new Node.Pair(decode(arr.elements().get(0)), decode(arr.elements().get(1)));
        }
        throw new IllegalArgumentException("Map pair must be a two-element array, got " + value.describe());
    }

    private ImmutableList<Node> decodeAll(ImmutableList<JsonValue> values) {
        return values.collect(this::decode);
    }

    private Node node(JsonValue.JsonObject obj, String field) {
        return decode(required(obj, field));
    }

    private ImmutableList<Node> nodes(JsonValue.JsonObject obj, String field) {
        return decodeAll(array(obj, field));
    }

    private static ImmutableList<JsonValue> array(JsonValue.JsonObject obj, String field) {
        JsonValue value = required(obj, field);
        if (value instanceof JsonValue.JsonArray arr) {
            return arr.elements();
        }
        throw new IllegalArgumentException("Field \"" + field + "\" must be an array, got " + value.describe());
    }

    private static String string(JsonValue.JsonObject obj, String field) {
        return asString(required(obj, field), field);
    }

    private static String asString(JsonValue value, String field) {
        if (value instanceof JsonValue.JsonString s) {
            return s.value();
        }
        throw new IllegalArgumentException("Field \"" + field + "\" must be a string, got " + value.describe());
    }

    private static int integer(JsonValue.JsonObject obj, String field) {
        JsonValue value = required(obj, field);
        if (value instanceof JsonValue.JsonLong n && n.value() >= 0 && n.value() <= Integer.MAX_VALUE) {
            return (int) n.value();
        }
        throw new IllegalArgumentException("Field \"" + field + "\" must be a non-negative integer");
    }

    private static JsonValue required(JsonValue.JsonObject obj, String field) {
        JsonValue value = obj.fields().get(field);
        if (value == null) {
            throw new IllegalArgumentException("Missing field \"" + field + "\"");
        }
        return value;
    }
}
