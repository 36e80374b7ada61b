package com.notredis.command;

import com.notredis.config.ConfigTable;
import com.notredis.core.StorageEngine;
import com.notredis.network.protocol.RespValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Routes decoded requests.
 * Server commands (PING, ECHO, COMMAND, CONFIG, QUIT) are answered here;
 * data commands are forwarded to the storage engine with their full token list.
 */
public class CommandDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(CommandDispatcher.class);

    private final StorageEngine storage;
    private final ConfigTable configuration;

    /**
     * Create a dispatcher.
     *
     * @param storage       the engine executing data commands
     * @param configuration the table read and written by CONFIG
     */
    public CommandDispatcher(StorageEngine storage, ConfigTable configuration) {
        this.storage = storage;
        this.configuration = configuration;
    }

    /**
     * Execute one request.
     *
     * @param request the decoded request
     * @return the reply
     * @throws CommandException if the request is malformed or fails
     */
    public RespValue dispatch(RespValue request) {
        List<String> tokens = tokenize(request);
        return dispatch(resolve(tokens), tokens);
    }

    /**
     * Execute an already classified request.
     *
     * @param type   the resolved command
     * @param tokens the request tokens, command name first
     * @return the reply
     */
    public RespValue dispatch(CommandType type, List<String> tokens) {
        switch (type) {
            case PING:
                return handlePing(tokens);
            case ECHO:
                return handleEcho(tokens);
            case COMMAND:
                return handleCommand(tokens);
            case CONFIG:
                return handleConfig(tokens);
            case QUIT:
                return RespValue.ok();
            default:
                return storage.execute(tokens);
        }
    }

    /**
     * Flatten a request into its tokens.
     *
     * @throws CommandException if the request is not a non-empty array of bulk strings
     */
    public static List<String> tokenize(RespValue request) {
        if (!request.isArray()) {
            throw CommandException.incorrectFormat("got " + request.getType());
        }
        List<RespValue> elements = request.getElements();
        if (elements.isEmpty()) {
            throw CommandException.incorrectFormat("empty array");
        }
        List<String> tokens = new ArrayList<>(elements.size());
        for (RespValue element : elements) {
            if (!element.isBulkString()) {
                throw CommandException.incorrectFormat("element of type " + element.getType());
            }
            tokens.add(element.getText());
        }
        return Collections.unmodifiableList(tokens);
    }

    /**
     * Resolve the command named by the first token.
     *
     * @throws CommandException if the name is not a known command
     */
    public static CommandType resolve(List<String> tokens) {
        return CommandType.resolve(tokens.get(0))
            .orElseThrow(() -> CommandException.unknownCommand(tokens));
    }

    private RespValue handlePing(List<String> tokens) {
        switch (tokens.size()) {
            case 1:
                return RespValue.simpleString("PONG");
            case 2:
                return RespValue.simpleString(singleLine(tokens.get(1)));
            default:
                throw CommandException.syntaxError(tokens, "PING takes at most one argument");
        }
    }

    private RespValue handleEcho(List<String> tokens) {
        if (tokens.size() != 2) {
            throw CommandException.syntaxError(tokens, "ECHO takes exactly one argument");
        }
        return RespValue.bulkString(tokens.get(1));
    }

    private RespValue handleCommand(List<String> tokens) {
        if (tokens.size() == 2 && "DOCS".equals(upper(tokens.get(1)))) {
            return RespValue.array(Collections.emptyList());
        }
        throw CommandException.syntaxError(tokens, "only COMMAND DOCS is supported");
    }

    private RespValue handleConfig(List<String> tokens) {
        String subcommand = tokens.size() > 1 ? upper(tokens.get(1)) : "";
        if ("GET".equals(subcommand) && tokens.size() == 3) {
            return RespValue.simpleString(singleLine(configuration.get(tokens.get(2))));
        }
        if ("SET".equals(subcommand) && tokens.size() == 4) {
            String key = tokens.get(2);
            String value = tokens.get(3);
            configuration.set(key, value);
            logger.info("CONFIG SET {} {}", key, value);
            return RespValue.simpleString(singleLine(value));
        }
        throw CommandException.syntaxError(tokens, "expected CONFIG GET <key> or CONFIG SET <key> <value>");
    }

    private static String upper(String token) {
        return token.toUpperCase(Locale.ROOT);
    }

    // Simple strings cannot carry line breaks
    private static String singleLine(String text) {
        return text.replace('\r', ' ').replace('\n', ' ');
    }
}
