package com.notredis.command;

import com.notredis.network.protocol.RespValue;

import java.util.List;

/**
 * Exception thrown when a decoded request cannot be executed.
 * The connection stays usable: the error is reported to the client as an error reply.
 */
public class CommandException extends RuntimeException {

    public enum Kind {
        /** The request is not an array of bulk strings. */
        INCORRECT_FORMAT,
        UNKNOWN_COMMAND,
        /** Known command, wrong argument shape. */
        SYNTAX_ERROR,
        /** INCR on a value that does not parse as a 64-bit integer. */
        NOT_AN_INTEGER,
        INCREMENT_OVERFLOW,
        /** A command name reached a component that does not execute it. */
        NOT_AVAILABLE
    }

    private final Kind kind;

    public CommandException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public CommandException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static CommandException incorrectFormat(String detail) {
        return new CommandException(Kind.INCORRECT_FORMAT,
            "request must be an array of bulk strings (" + detail + ")");
    }

    public static CommandException unknownCommand(List<String> tokens) {
        return new CommandException(Kind.UNKNOWN_COMMAND, "unknown command '" + String.join(" ", tokens) + "'");
    }

    public static CommandException syntaxError(List<String> tokens, String reason) {
        return new CommandException(Kind.SYNTAX_ERROR,
            "syntax error in '" + String.join(" ", tokens) + "': " + reason);
    }

    public static CommandException notAnInteger(Throwable cause) {
        return new CommandException(Kind.NOT_AN_INTEGER, "value is not an integer or out of range", cause);
    }

    public static CommandException incrementOverflow(Throwable cause) {
        return new CommandException(Kind.INCREMENT_OVERFLOW, "increment or decrement would overflow", cause);
    }

    public static CommandException notAvailable(String name) {
        return new CommandException(Kind.NOT_AVAILABLE, "command not available: " + name);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * The error reply sent to the client.
     */
    public RespValue toReply() {
        return RespValue.error("ERR " + getMessage().replace('\r', ' ').replace('\n', ' '));
    }
}
