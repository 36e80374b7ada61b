package com.notredis.network.protocol;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * RESP encoder/decoder for NotRedis.
 *
 * Grammar:
 * Array:         *<n>\r\n followed by n values
 * Bulk string:   $<len>\r\n<len bytes>\r\n   ($-1\r\n is Null)
 * Simple string: +<text>\r\n
 * Integer:       :<digits>\r\n
 * Error:         -<text>\r\n
 *
 * A request whose first byte is none of the type tags is an inline command:
 * one line of space-separated words, decoded as an array of bulk strings.
 *
 * The buffer position is the cursor. Decoding advances it past the consumed
 * bytes, or up to the point of failure.
 */
public final class RespCodec {

    public static final byte ARRAY = '*';
    public static final byte BULK_STRING = '$';
    public static final byte SIMPLE_STRING = '+';
    public static final byte INTEGER = ':';
    public static final byte ERROR = '-';

    // Maximum sizes
    public static final int MAX_BULK_LENGTH = 512 * 1024 * 1024;  // 512MB
    public static final int MAX_ARRAY_LENGTH = 1024 * 1024;
    public static final int MAX_NESTING_DEPTH = 128;

    private static final byte CR = '\r';
    private static final byte LF = '\n';
    private static final byte[] CRLF = {CR, LF};
    private static final byte[] NULL_BULK = "$-1\r\n".getBytes(StandardCharsets.US_ASCII);

    private RespCodec() {
        // Utility class
    }

    // ==================== Encoding ====================

    /**
     * Encode a value into a new ByteBuffer.
     *
     * @param value the value to encode
     * @return ByteBuffer positioned at start, ready to read
     */
    public static ByteBuffer encode(RespValue value) {
        ByteBuffer buffer = ByteBuffer.allocate(encodedSize(value));
        encode(value, buffer);
        buffer.flip();
        return buffer;
    }

    /**
     * Encode a value into an existing ByteBuffer.
     *
     * @param value  the value to encode
     * @param buffer the buffer to write to (must have sufficient capacity)
     */
    public static void encode(RespValue value, ByteBuffer buffer) {
        switch (value.getType()) {
            case ARRAY:
                List<RespValue> elements = value.getElements();
                writeLine(buffer, ARRAY, Integer.toString(elements.size()).getBytes(StandardCharsets.US_ASCII));
                for (RespValue element : elements) {
                    encode(element, buffer);
                }
                break;
            case BULK_STRING:
                byte[] payload = value.getText().getBytes(StandardCharsets.UTF_8);
                writeLine(buffer, BULK_STRING, Integer.toString(payload.length).getBytes(StandardCharsets.US_ASCII));
                buffer.put(payload);
                buffer.put(CRLF);
                break;
            case SIMPLE_STRING:
                writeLine(buffer, SIMPLE_STRING, value.getText().getBytes(StandardCharsets.UTF_8));
                break;
            case INTEGER:
                writeLine(buffer, INTEGER, Long.toString(value.getInteger()).getBytes(StandardCharsets.US_ASCII));
                break;
            case ERROR:
                writeLine(buffer, ERROR, value.getText().getBytes(StandardCharsets.UTF_8));
                break;
            case NULL:
                buffer.put(NULL_BULK);
                break;
            default:
                throw new IllegalArgumentException("Cannot encode " + value.getType());
        }
    }

    /**
     * Encode a value into a byte array.
     */
    public static byte[] encodeToBytes(RespValue value) {
        ByteBuffer buffer = encode(value);
        byte[] bytes = new byte[buffer.remaining()];
        buffer.get(bytes);
        return bytes;
    }

    /**
     * Calculate the encoded size of a value.
     *
     * @param value the value
     * @return size in bytes
     */
    public static int encodedSize(RespValue value) {
        switch (value.getType()) {
            case ARRAY:
                int size = lineSize(Integer.toString(value.getElements().size()).length());
                for (RespValue element : value.getElements()) {
                    size += encodedSize(element);
                }
                return size;
            case BULK_STRING:
                int payloadLength = utf8Length(value.getText());
                return lineSize(Integer.toString(payloadLength).length()) + payloadLength + CRLF.length;
            case SIMPLE_STRING:
            case ERROR:
                return lineSize(utf8Length(value.getText()));
            case INTEGER:
                return lineSize(Long.toString(value.getInteger()).length());
            case NULL:
                return NULL_BULK.length;
            default:
                throw new IllegalArgumentException("Cannot encode " + value.getType());
        }
    }

    // ==================== Decoding ====================

    /**
     * Decode one message from the buffer's position.
     *
     * @param buffer the buffer to decode from
     * @return the decoded value
     * @throws RespException if the data is invalid or incomplete
     */
    public static RespValue decode(ByteBuffer buffer) {
        if (!buffer.hasRemaining()) {
            throw new RespException(RespException.Kind.TRUNCATED, buffer.position(), "Empty buffer");
        }
        if (isTypeTag(buffer.get(buffer.position()))) {
            return decodeValue(buffer, 0);
        }
        return decodeInline(buffer);
    }

    /**
     * Decode one message from a byte array.
     */
    public static RespValue decode(byte[] bytes) {
        return decode(ByteBuffer.wrap(bytes));
    }

    /**
     * Decode one complete message if the buffer holds one.
     * Unlike {@link #decode(ByteBuffer)}, a message that has not fully arrived
     * is not an error: the position is restored and null is returned.
     *
     * @param buffer the buffer to decode from
     * @return the decoded value, or null if more bytes are needed
     * @throws RespException if the data is invalid
     */
    public static RespValue decodeFrame(ByteBuffer buffer) {
        int start = buffer.position();
        try {
            return decode(buffer);
        } catch (RespException e) {
            if (e.isIncomplete()) {
                buffer.position(start);
                return null;
            }
            throw e;
        }
    }

    private static RespValue decodeValue(ByteBuffer buffer, int depth) {
        if (!buffer.hasRemaining()) {
            throw new RespException(RespException.Kind.TRUNCATED, buffer.position(), "Missing array element");
        }
        byte tag = buffer.get(buffer.position());
        switch (tag) {
            case ARRAY:
                return decodeArray(buffer, depth + 1);
            case BULK_STRING:
                return decodeBulkString(buffer);
            case SIMPLE_STRING:
                return RespValue.simpleString(decodeLineValue(SIMPLE_STRING, buffer));
            case INTEGER:
                return decodeInteger(buffer);
            case ERROR:
                return RespValue.error(decodeLineValue(ERROR, buffer));
            default:
                throw new RespException(RespException.Kind.UNKNOWN_TYPE, buffer.position(),
                    String.format("Unknown type byte 0x%02X", tag));
        }
    }

    private static RespValue decodeArray(ByteBuffer buffer, int depth) {
        if (depth > MAX_NESTING_DEPTH) {
            throw new RespException(RespException.Kind.TOO_DEEP, buffer.position(),
                "Arrays nested deeper than " + MAX_NESTING_DEPTH);
        }
        expectType(ARRAY, buffer);
        int lengthOffset = buffer.position();
        long length = readNumber(buffer);
        if (length < 0 || length > MAX_ARRAY_LENGTH) {
            throw new RespException(RespException.Kind.INVALID_LENGTH, lengthOffset,
                "Invalid array length: " + length);
        }
        // Capacity is capped so a forged length cannot force a huge allocation
        List<RespValue> elements = new ArrayList<>((int) Math.min(length, 1024));
        for (long i = 0; i < length; i++) {
            elements.add(decodeValue(buffer, depth));
        }
        return RespValue.array(elements);
    }

    private static RespValue decodeBulkString(ByteBuffer buffer) {
        expectType(BULK_STRING, buffer);
        int lengthOffset = buffer.position();
        long length = readNumber(buffer);
        if (length == -1) {
            return RespValue.nullValue();
        }
        if (length < -1 || length > MAX_BULK_LENGTH) {
            throw new RespException(RespException.Kind.INVALID_LENGTH, lengthOffset,
                "Invalid bulk string length: " + length);
        }

        int start = buffer.position();
        int size = (int) length;
        int available = buffer.limit() - start;
        if (available < size) {
            throw new RespException(RespException.Kind.TRUNCATED, buffer.limit(),
                "Incomplete bulk string: need " + size + " bytes, got " + available);
        }
        int end = start + size;
        if (available < size + CRLF.length) {
            if (available == size || buffer.get(end) == CR) {
                throw new RespException(RespException.Kind.TRUNCATED, buffer.limit(),
                    "Incomplete bulk string terminator");
            }
            throw new RespException(RespException.Kind.MISSING_TERMINATOR, end,
                "Bulk string not terminated by CRLF");
        }
        if (buffer.get(end) != CR || buffer.get(end + 1) != LF) {
            throw new RespException(RespException.Kind.MISSING_TERMINATOR, end,
                "Bulk string not terminated by CRLF");
        }

        byte[] payload = new byte[size];
        buffer.get(payload);
        String text = decodeUtf8(payload, start);
        buffer.position(end + CRLF.length);
        return RespValue.bulkString(text);
    }

    private static RespValue decodeInteger(ByteBuffer buffer) {
        expectType(INTEGER, buffer);
        return RespValue.integer(readNumber(buffer));
    }

    private static String decodeLineValue(byte tag, ByteBuffer buffer) {
        expectType(tag, buffer);
        int start = buffer.position();
        String text = decodeUtf8(readLine(buffer), start);
        if (text.indexOf('\r') >= 0 || text.indexOf('\n') >= 0) {
            throw new RespException(RespException.Kind.MISSING_TERMINATOR, start,
                "Bare CR or LF inside line");
        }
        return text;
    }

    private static RespValue decodeInline(ByteBuffer buffer) {
        int start = buffer.position();
        byte first = buffer.get(start);
        if (!isAsciiLetter(first)) {
            throw new RespException(RespException.Kind.INVALID_INLINE, start,
                String.format("Inline command must start with a letter, got 0x%02X", first));
        }
        String line = decodeUtf8(readLine(buffer), start);
        List<RespValue> tokens = new ArrayList<>();
        for (String token : line.split(" ")) {
            // Repeated spaces produce empty words, which are not arguments
            if (!token.isEmpty()) {
                tokens.add(RespValue.bulkString(token));
            }
        }
        return RespValue.array(tokens);
    }

    // ==================== Helpers ====================

    private static void expectType(byte expected, ByteBuffer buffer) {
        int position = buffer.position();
        if (!buffer.hasRemaining()) {
            throw new RespException(RespException.Kind.TRUNCATED, position, "Missing type byte");
        }
        byte actual = buffer.get(position);
        if (actual != expected) {
            throw new RespException(RespException.Kind.WRONG_TYPE, position,
                String.format("Expected type '%c', got 0x%02X", (char) expected, actual));
        }
        buffer.position(position + 1);
    }

    /**
     * Read up to the next CRLF and advance past it.
     */
    private static byte[] readLine(ByteBuffer buffer) {
        int start = buffer.position();
        int limit = buffer.limit();
        for (int i = start; i < limit - 1; i++) {
            if (buffer.get(i) == CR && buffer.get(i + 1) == LF) {
                byte[] line = new byte[i - start];
                buffer.get(line);
                buffer.position(i + CRLF.length);
                return line;
            }
        }
        throw new RespException(RespException.Kind.TRUNCATED, limit, "No CRLF line terminator");
    }

    private static long readNumber(ByteBuffer buffer) {
        int start = buffer.position();
        String text = new String(readLine(buffer), StandardCharsets.US_ASCII);
        // Only '-' may sign a number on the wire
        if (!text.isEmpty() && text.charAt(0) == '+') {
            throw new RespException(RespException.Kind.NOT_A_NUMBER, start, "Not a number: '" + text + "'");
        }
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new RespException(RespException.Kind.NOT_A_NUMBER, start, "Not a number: '" + text + "'", e);
        }
    }

    private static String decodeUtf8(byte[] bytes, int offset) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            CharBuffer chars = decoder.decode(ByteBuffer.wrap(bytes));
            return chars.toString();
        } catch (CharacterCodingException e) {
            throw new RespException(RespException.Kind.INVALID_UTF8, offset, "Invalid UTF-8 text", e);
        }
    }

    private static void writeLine(ByteBuffer buffer, byte tag, byte[] content) {
        buffer.put(tag);
        buffer.put(content);
        buffer.put(CRLF);
    }

    private static int lineSize(int contentLength) {
        return 1 + contentLength + CRLF.length;
    }

    private static int utf8Length(String text) {
        return text.getBytes(StandardCharsets.UTF_8).length;
    }

    private static boolean isTypeTag(byte b) {
        return b == ARRAY || b == BULK_STRING || b == SIMPLE_STRING || b == INTEGER || b == ERROR;
    }

    private static boolean isAsciiLetter(byte b) {
        return (b >= 'a' && b <= 'z') || (b >= 'A' && b <= 'Z');
    }
}
