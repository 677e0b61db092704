package com.dictprop.model;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonIOException;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;

import java.io.IOException;
import java.io.StringReader;
import java.math.BigInteger;

/**
 * A field whose value is any JSON-encodable object, stored as opaque text.
 * The encoding has no whitespace between tokens and no HTML escaping, so it
 * is as short as JSON allows. Decoding accepts any valid JSON document,
 * including text written with ordinary whitespace.
 *
 * <p>Objects decode to maps, arrays to lists, integral numbers to
 * {@link Long} ({@link BigInteger} beyond the long range, so they stay
 * exact) and other numbers to {@link Double}. Arrays and lists encode
 * the same way. The field is never indexed.
 */
public class CompactJsonField extends Field<Object> {
    private static final Gson GSON = new GsonBuilder()
            .disableHtmlEscaping()
            .serializeNulls()
            .setObjectToNumberStrategy(CompactJsonField::readNumber)
            .create();
    private static final TypeAdapter<Object> TREE_ADAPTER = GSON.getAdapter(Object.class);

    public CompactJsonField(String name) {
        super(name, false);
    }

    public static String encode(Object value) {
        try {
            return GSON.toJson(value);
        } catch (JsonIOException e) {
            throw new IllegalArgumentException("value is not JSON-encodable: " + e.getMessage(), e);
        }
    }

    /**
     * @throws MalformedJsonException if {@code text} is not a single valid JSON document
     */
    public static Object decode(String text) {
        if (text == null) {
            throw new MalformedJsonException("no JSON text to decode", null);
        }
        try {
            JsonReader reader = new JsonReader(new StringReader(text));
            reader.setLenient(false);
            Object value = TREE_ADAPTER.read(reader);
            if (reader.peek() != JsonToken.END_DOCUMENT) {
                throw new MalformedJsonException("trailing data after JSON value", null);
            }
            return value;
        } catch (IOException | JsonParseException | IllegalStateException e) {
            throw new MalformedJsonException("malformed JSON: " + e.getMessage(), e);
        }
    }

    private static Number readNumber(JsonReader in) throws IOException {
        String text = in.nextString();
        try {
            if (text.indexOf('.') < 0 && text.indexOf('e') < 0 && text.indexOf('E') < 0) {
                BigInteger integer = new BigInteger(text);
                return integer.bitLength() < Long.SIZE ? (Number) integer.longValue() : integer;
            }
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new JsonParseException("Cannot parse number " + text + "; at path " + in.getPreviousPath(), e);
        }
    }

    @Override
    public Object coerce(Object value) {
        return value;
    }

    @Override
    public Object toStorage(Object value) {
        return value == null ? null : encode(value);
    }

    @Override
    public Object fromStorage(Object stored) {
        if (stored == null) {
            return null;
        }
        if (!(stored instanceof String text)) {
            throw new IllegalStateException("CompactJsonField " + getName()
                    + " holds a non-text stored value of type " + stored.getClass().getName());
        }
        return decode(text);
    }
}
