package com.jexfmt.json;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.map.ImmutableMap;

public sealed interface JsonValue {
    record JsonObject(ImmutableMap<String, JsonValue> fields) implements JsonValue {}
    record JsonArray(ImmutableList<JsonValue> elements) implements JsonValue {}
    record JsonString(String value) implements JsonValue {}
    record JsonLong(long value) implements JsonValue {}
    record JsonDouble(double value) implements JsonValue {}
    record JsonBoolean(boolean value) implements JsonValue {}
    record JsonNull() implements JsonValue {}

    default String describe() {
        return getClass().getSimpleName().substring("Json".length()).toLowerCase();
    }
}
