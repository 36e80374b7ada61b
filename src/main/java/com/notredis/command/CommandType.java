package com.notredis.command;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * The closed set of commands the server understands.
 */
public enum CommandType {

    PING(false),
    ECHO(false),
    COMMAND(false),
    CONFIG(false),
    QUIT(false),
    GET(true),
    SET(true),
    MGET(true),
    MSET(true),
    DEL(true),
    INCR(true);

    private static final Map<String, CommandType> BY_NAME = new HashMap<>();

    static {
        for (CommandType type : values()) {
            BY_NAME.put(type.name(), type);
        }
    }

    private final boolean dataCommand;

    CommandType(boolean dataCommand) {
        this.dataCommand = dataCommand;
    }

    /**
     * Whether the command reads or writes the key space and is executed by the storage engine.
     */
    public boolean isDataCommand() {
        return dataCommand;
    }

    /**
     * Resolve a command name, ignoring case.
     *
     * @param name the first token of a request
     * @return the command type, or empty if the name is not a known command
     */
    public static Optional<CommandType> resolve(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_NAME.get(name.toUpperCase(Locale.ROOT)));
    }
}
