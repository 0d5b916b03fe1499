package com.jexfmt.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;

import java.io.IOException;
import java.io.InputStream;

/**
 * Reads one JSON document into {@link JsonValue}s. Nesting deeper than
 * {@code maxDepth} is rejected, since the formatter recurses once per level.
 */
public class TreeJsonParser {
    public static final int DEFAULT_MAX_DEPTH = 512;

    private final JsonFactory factory = new JsonFactory();
    private final int maxDepth;

    public TreeJsonParser() {
        this(DEFAULT_MAX_DEPTH);
    }

    public TreeJsonParser(int maxDepth) {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("Max depth must be positive: " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    public JsonValue parse(InputStream input) throws IOException {
        try (JsonParser parser = factory.createParser(input)) {
            JsonToken token = parser.nextToken();
            if (token == null) {
                throw new IOException("Empty input");
            }
            JsonValue value = parseValue(parser, token, 1);
            if (parser.nextToken() != null) {
                throw new IOException("Trailing content after JSON value at " + parser.getCurrentLocation());
            }
            return value;
        }
    }

    private JsonValue parseValue(JsonParser parser, JsonToken token, int depth) throws IOException {
        return switch (token) {
            case START_OBJECT -> parseObject(parser, depth);
            case START_ARRAY -> parseArray(parser, depth);
            case VALUE_STRING -> new JsonValue.JsonString(parser.getText());
            case VALUE_NUMBER_INT -> new JsonValue.JsonLong(parser.getLongValue());
            case VALUE_NUMBER_FLOAT -> new JsonValue.JsonDouble(parser.getDoubleValue());
            case VALUE_TRUE -> new JsonValue.JsonBoolean(true);
            case VALUE_FALSE -> new JsonValue.JsonBoolean(false);
            case VALUE_NULL -> new JsonValue.JsonNull();
            default -> throw new IOException("Unexpected JSON token: " + token);
        };
    }

    private JsonValue.JsonObject parseObject(JsonParser parser, int depth) throws IOException {
        checkDepth(parser, depth);
        MutableMap<String, JsonValue> fields = Maps.mutable.empty();

        while (parser.nextToken() != JsonToken.END_OBJECT) {
            String fieldName = parser.getCurrentName();
            fields.put(fieldName, parseValue(parser, parser.nextToken(), depth + 1));
        }

        return new JsonValue.JsonObject(fields.toImmutable());
    }

    private JsonValue.JsonArray parseArray(JsonParser parser, int depth) throws IOException {
        checkDepth(parser, depth);
        MutableList<JsonValue> elements = Lists.mutable.empty();

        JsonToken token;
        while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
            elements.add(parseValue(parser, token, depth + 1));
        }

        return new JsonValue.JsonArray(elements.toImmutable());
    }

    private void checkDepth(JsonParser parser, int depth) throws IOException {
        if (depth > maxDepth) {
            throw new IOException("Tree nested deeper than " + maxDepth + " levels at " + parser.getCurrentLocation());
        }
    }
}
