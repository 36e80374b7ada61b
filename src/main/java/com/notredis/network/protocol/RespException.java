package com.notredis.network.protocol;

/**
 * Exception thrown when RESP encoding/decoding fails.
 */
public class RespException extends RuntimeException {

    /**
     * Reason a buffer could not be decoded.
     */
    public enum Kind {
        /** The byte at the cursor is not the type tag the parser expected. */
        WRONG_TYPE,
        /** A nested element starts with a byte that is not a type tag. */
        UNKNOWN_TYPE,
        /** Negative or oversized array/bulk length. */
        INVALID_LENGTH,
        /** The buffer ends before the message does. More bytes may complete it. */
        TRUNCATED,
        /** A bulk payload is not followed by CRLF. */
        MISSING_TERMINATOR,
        INVALID_UTF8,
        /** Length or integer text is not a base-10 64-bit number. */
        NOT_A_NUMBER,
        /** Inline command line does not start with a letter. */
        INVALID_INLINE,
        TOO_DEEP
    }

    private final Kind kind;
    private final int offset;

    public RespException(Kind kind, int offset, String message) {
        super(message + " (offset " + offset + ")");
        this.kind = kind;
        this.offset = offset;
    }

    public RespException(Kind kind, int offset, String message, Throwable cause) {
        super(message + " (offset " + offset + ")", cause);
        this.kind = kind;
        this.offset = offset;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Buffer offset at which decoding stopped.
     */
    public int getOffset() {
        return offset;
    }

    /**
     * Whether the failure only means the message has not fully arrived yet.
     */
    public boolean isIncomplete() {
        return kind == Kind.TRUNCATED;
    }
}
