package com.notredis.core;

import com.notredis.command.CommandException;
import com.notredis.command.CommandType;
import com.notredis.network.protocol.RespValue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Executes data commands against a {@link KVStore}.
 * Argument shape is checked before the store is touched, so a rejected command never writes.
 */
public class StorageEngine {

    private final KVStore store;

    public StorageEngine(KVStore store) {
        this.store = store;
    }

    /**
     * Execute a data command.
     *
     * @param tokens the request tokens, command name first
     * @return the reply
     * @throws CommandException on a wrong argument shape, a non-integer INCR
     *                          or a name that is not a data command
     */
    public RespValue execute(List<String> tokens) {
        if (tokens.isEmpty()) {
            throw CommandException.incorrectFormat("empty command");
        }
        String name = tokens.get(0);
        CommandType type = CommandType.resolve(name)
            .filter(CommandType::isDataCommand)
            .orElseThrow(() -> CommandException.notAvailable(name));

        switch (type) {
            case GET:
                return handleGet(tokens);
            case SET:
                return handleSet(tokens);
            case MGET:
                return handleMget(tokens);
            case MSET:
                return handleMset(tokens);
            case DEL:
                return handleDel(tokens);
            case INCR:
                return handleIncr(tokens);
            default:
                throw CommandException.notAvailable(name);
        }
    }

    /**
     * Get the underlying store.
     */
    public KVStore getStore() {
        return store;
    }

    private RespValue handleGet(List<String> tokens) {
        requireArity(tokens, 2, "GET takes exactly one key");
        return toReply(store.get(tokens.get(1)));
    }

    private RespValue handleSet(List<String> tokens) {
        requireArity(tokens, 3, "SET takes a key and a value");
        store.set(tokens.get(1), tokens.get(2));
        return RespValue.ok();
    }

    private RespValue handleMget(List<String> tokens) {
        if (tokens.size() < 2) {
            throw CommandException.syntaxError(tokens, "MGET takes at least one key");
        }
        List<Optional<StoredValue>> values = store.getAll(tokens.subList(1, tokens.size()));
        List<RespValue> replies = new ArrayList<>(values.size());
        for (Optional<StoredValue> value : values) {
            replies.add(toReply(value));
        }
        return RespValue.array(replies);
    }

    private RespValue handleMset(List<String> tokens) {
        if (tokens.size() < 3 || tokens.size() % 2 == 0) {
            throw CommandException.syntaxError(tokens, "MSET takes one or more key value pairs");
        }
        Map<String, String> entries = new LinkedHashMap<>();
        for (int i = 1; i < tokens.size(); i += 2) {
            entries.put(tokens.get(i), tokens.get(i + 1));
        }
        store.setAll(entries);
        return RespValue.ok();
    }

    private RespValue handleDel(List<String> tokens) {
        if (tokens.size() < 2) {
            throw CommandException.syntaxError(tokens, "DEL takes at least one key");
        }
        return RespValue.integer(store.delete(tokens.subList(1, tokens.size())));
    }

    private RespValue handleIncr(List<String> tokens) {
        requireArity(tokens, 2, "INCR takes exactly one key");
        try {
            return RespValue.integer(store.increment(tokens.get(1)));
        } catch (NumberFormatException e) {
            throw CommandException.notAnInteger(e);
        } catch (ArithmeticException e) {
            throw CommandException.incrementOverflow(e);
        }
    }

    private static void requireArity(List<String> tokens, int arity, String reason) {
        if (tokens.size() != arity) {
            throw CommandException.syntaxError(tokens, reason);
        }
    }

    private static RespValue toReply(Optional<StoredValue> value) {
        return value.map(StoredValue::toRespValue).orElse(RespValue.nullValue());
    }
}
