package com.notredis.core;

import com.notredis.network.protocol.RespValue;

import java.util.Objects;

/**
 * Immutable value held under a key: either text or a 64-bit number.
 */
public final class StoredValue {

    public enum Kind {
        TEXT,
        NUMBER
    }

    private final Kind kind;
    private final String text; // null for NUMBER
    private final long number;

    private StoredValue(Kind kind, String text, long number) {
        this.kind = kind;
        this.text = text;
        this.number = number;
    }

    public static StoredValue text(String text) {
        return new StoredValue(Kind.TEXT, Objects.requireNonNull(text, "text"), 0);
    }

    public static StoredValue number(long number) {
        return new StoredValue(Kind.NUMBER, null, number);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isText() {
        return kind == Kind.TEXT;
    }

    /**
     * Get the text of a TEXT value.
     *
     * @throws IllegalStateException for a NUMBER value
     */
    public String getText() {
        if (kind != Kind.TEXT) {
            throw new IllegalStateException("Value is a number");
        }
        return text;
    }

    /**
     * Get the number of a NUMBER value.
     *
     * @throws IllegalStateException for a TEXT value
     */
    public long getNumber() {
        if (kind != Kind.NUMBER) {
            throw new IllegalStateException("Value is text");
        }
        return number;
    }

    /**
     * Value incremented by one, keeping its kind.
     * Text that holds a base-10 integer stays text.
     *
     * @return the incremented value
     * @throws NumberFormatException if this is text that is not a 64-bit integer
     * @throws ArithmeticException   if the increment overflows
     */
    public StoredValue increment() {
        if (kind == Kind.NUMBER) {
            return number(Math.addExact(number, 1));
        }
        long parsed = Long.parseLong(text);
        return text(Long.toString(Math.addExact(parsed, 1)));
    }

    /**
     * Reply form for GET. Both kinds go out as bulk strings, a number in base 10.
     */
    public RespValue toRespValue() {
        return RespValue.bulkString(kind == Kind.NUMBER ? Long.toString(number) : text);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StoredValue that = (StoredValue) o;
        return kind == that.kind &&
               number == that.number &&
               Objects.equals(text, that.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, text, number);
    }

    @Override
    public String toString() {
        return kind == Kind.NUMBER ? "Number(" + number + ")" : "Text(\"" + text + "\")";
    }
}
