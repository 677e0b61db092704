package com.dictprop.persistence;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts stored field values to JSON trees and back without losing their
 * kind. Integral numbers are written without a fraction and read back as
 * {@link Long}; anything else numeric reads back as {@link Double}.
 * Timestamps are wrapped in a single-member object whose name uses the
 * reserved metadata prefix, so it cannot collide with a stored name.
 */
final class StoredValueCodec {
    static final String TIMESTAMP_TAG = "_timestamp";

    private StoredValueCodec() {
    }

    static JsonElement encode(Object value) {
        if (value == null) {
            return JsonNull.INSTANCE;
        }
        if (value instanceof String s) {
            return new JsonPrimitive(s);
        }
        if (value instanceof Boolean b) {
            return new JsonPrimitive(b);
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return new JsonPrimitive(((Number) value).longValue());
        }
        if (value instanceof Number n) {
            return new JsonPrimitive(n.doubleValue());
        }
        if (value instanceof Instant instant) {
            JsonObject tagged = new JsonObject();
            tagged.addProperty(TIMESTAMP_TAG, instant.toString());
            return tagged;
        }
        if (value instanceof Map<?, ?> map) {
            JsonObject object = new JsonObject();
            for (var entry : map.entrySet()) {
                object.add(String.valueOf(entry.getKey()), encode(entry.getValue()));
            }
            return object;
        }
        if (value instanceof List<?> list) {
            JsonArray array = new JsonArray();
            for (Object element : list) {
                array.add(encode(element));
            }
            return array;
        }
        throw new IllegalArgumentException("cannot persist value of type " + value.getClass().getName());
    }

    static Object decode(JsonElement element) {
        if (element == null || element.isJsonNull()) {
            return null;
        }
        if (element.isJsonPrimitive()) {
            JsonPrimitive primitive = element.getAsJsonPrimitive();
            if (primitive.isBoolean()) {
                return primitive.getAsBoolean();
            }
            if (primitive.isString()) {
                return primitive.getAsString();
            }
            String text = primitive.getAsNumber().toString();
            try {
                return Long.parseLong(text);
            } catch (NumberFormatException e) {
                return Double.parseDouble(text);
            }
        }
        if (element.isJsonArray()) {
            List<Object> list = new ArrayList<>();
            for (JsonElement child : element.getAsJsonArray()) {
                list.add(decode(child));
            }
            return list;
        }
        JsonObject object = element.getAsJsonObject();
        if (object.size() == 1 && object.has(TIMESTAMP_TAG)) {
            String text = object.get(TIMESTAMP_TAG).getAsString();
            try {
                return Instant.parse(text);
            } catch (DateTimeParseException e) {
                throw new IllegalStateException("corrupt timestamp in store: " + text, e);
            }
        }
        return decodeObject(object);
    }

    static Map<String, Object> decodeObject(JsonObject object) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (var entry : object.entrySet()) {
            map.put(entry.getKey(), decode(entry.getValue()));
        }
        return map;
    }
}
