package com.notredis.command;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class CommandTypeTest {

    @Test
    void resolve_ignoresCase() {
        assertThat(CommandType.resolve("get")).contains(CommandType.GET);
        assertThat(CommandType.resolve("MgEt")).contains(CommandType.MGET);
        assertThat(CommandType.resolve("quit")).contains(CommandType.QUIT);
    }

    @Test
    void resolve_unknownName_isEmpty() {
        assertThat(CommandType.resolve("FLUSHALL")).isEmpty();
        assertThat(CommandType.resolve("")).isEmpty();
        assertThat(CommandType.resolve(null)).isEmpty();
    }

    @Test
    void dataCommands_areTheKeySpaceCommands() {
        assertThat(CommandType.values())
            .filteredOn(CommandType::isDataCommand)
            .containsExactlyInAnyOrder(CommandType.GET, CommandType.SET, CommandType.MGET,
                CommandType.MSET, CommandType.DEL, CommandType.INCR);
    }
}
