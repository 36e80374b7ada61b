package com.notredis.network.protocol;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable value of the RESP wire grammar.
 * A tagged union: the {@link Type} decides which of the payload fields is meaningful.
 */
public final class RespValue {

    public enum Type {
        ARRAY,
        BULK_STRING,
        SIMPLE_STRING,
        INTEGER,
        NULL,
        /** Reply-only. Encoded as {@code -<text>\r\n}. */
        ERROR
    }

    private static final RespValue NULL = new RespValue(Type.NULL, null, 0, null);
    private static final RespValue EMPTY_ARRAY = new RespValue(Type.ARRAY, null, 0, Collections.emptyList());
    private static final RespValue OK = new RespValue(Type.SIMPLE_STRING, "OK", 0, null);

    private final Type type;
    private final String text;
    private final long integer;
    private final List<RespValue> elements;

    private RespValue(Type type, String text, long integer, List<RespValue> elements) {
        this.type = type;
        this.text = text;
        this.integer = integer;
        this.elements = elements;
    }

    /**
     * Create an array value.
     *
     * @param elements the elements, in order
     */
    public static RespValue array(List<RespValue> elements) {
        Objects.requireNonNull(elements, "elements");
        if (elements.isEmpty()) {
            return EMPTY_ARRAY;
        }
        for (RespValue element : elements) {
            Objects.requireNonNull(element, "array element");
        }
        return new RespValue(Type.ARRAY, null, 0, Collections.unmodifiableList(new ArrayList<>(elements)));
    }

    public static RespValue array(RespValue... elements) {
        return array(Arrays.asList(elements));
    }

    /**
     * Create an array of bulk strings, the shape of every client request.
     */
    public static RespValue command(String... tokens) {
        List<RespValue> elements = new ArrayList<>(tokens.length);
        for (String token : tokens) {
            elements.add(bulkString(token));
        }
        return array(elements);
    }

    public static RespValue bulkString(String text) {
        return new RespValue(Type.BULK_STRING, Objects.requireNonNull(text, "text"), 0, null);
    }

    /**
     * Create a simple string.
     *
     * @throws IllegalArgumentException if the text contains CR or LF
     */
    public static RespValue simpleString(String text) {
        requireSingleLine(text);
        if ("OK".equals(text)) {
            return OK;
        }
        return new RespValue(Type.SIMPLE_STRING, text, 0, null);
    }

    public static RespValue ok() {
        return OK;
    }

    public static RespValue integer(long value) {
        return new RespValue(Type.INTEGER, null, value, null);
    }

    public static RespValue nullValue() {
        return NULL;
    }

    /**
     * Create an error reply.
     *
     * @throws IllegalArgumentException if the text contains CR or LF
     */
    public static RespValue error(String text) {
        requireSingleLine(text);
        return new RespValue(Type.ERROR, text, 0, null);
    }

    private static void requireSingleLine(String text) {
        Objects.requireNonNull(text, "text");
        if (text.indexOf('\r') >= 0 || text.indexOf('\n') >= 0) {
            throw new IllegalArgumentException("Line value must not contain CR or LF: " + text);
        }
    }

    public Type getType() {
        return type;
    }

    /**
     * Get the text of a bulk string, simple string or error.
     *
     * @throws IllegalStateException for any other type
     */
    public String getText() {
        if (text == null) {
            throw new IllegalStateException(type + " has no text");
        }
        return text;
    }

    /**
     * Get the value of an integer.
     *
     * @throws IllegalStateException for any other type
     */
    public long getInteger() {
        if (type != Type.INTEGER) {
            throw new IllegalStateException(type + " is not an integer");
        }
        return integer;
    }

    /**
     * Get the elements of an array.
     *
     * @return unmodifiable element list
     * @throws IllegalStateException for any other type
     */
    public List<RespValue> getElements() {
        if (elements == null) {
            throw new IllegalStateException(type + " is not an array");
        }
        return elements;
    }

    public boolean isArray() {
        return type == Type.ARRAY;
    }

    public boolean isBulkString() {
        return type == Type.BULK_STRING;
    }

    public boolean isNull() {
        return type == Type.NULL;
    }

    public boolean isError() {
        return type == Type.ERROR;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RespValue that = (RespValue) o;
        return type == that.type &&
               integer == that.integer &&
               Objects.equals(text, that.text) &&
               Objects.equals(elements, that.elements);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, text, integer, elements);
    }

    @Override
    public String toString() {
        switch (type) {
            case ARRAY: return "Array" + elements;
            case BULK_STRING: return "BulkString(\"" + text + "\")";
            case SIMPLE_STRING: return "SimpleString(\"" + text + "\")";
            case INTEGER: return "Integer(" + integer + ")";
            case ERROR: return "Error(\"" + text + "\")";
            default: return "Null";
        }
    }
}
