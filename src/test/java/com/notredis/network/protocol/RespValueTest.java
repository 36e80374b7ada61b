package com.notredis.network.protocol;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class RespValueTest {

    @Test
    void command_buildsArrayOfBulkStrings() {
        RespValue value = RespValue.command("SET", "k", "v");

        assertThat(value.isArray()).isTrue();
        assertThat(value.getElements()).extracting(RespValue::getType)
            .containsOnly(RespValue.Type.BULK_STRING);
        assertThat(value.getElements()).extracting(RespValue::getText)
            .containsExactly("SET", "k", "v");
    }

    @Test
    void array_copiesElements() {
        List<RespValue> source = new ArrayList<>();
        source.add(RespValue.integer(1));
        RespValue value = RespValue.array(source);

        source.add(RespValue.integer(2));

        assertThat(value.getElements()).hasSize(1);
        assertThatThrownBy(() -> value.getElements().add(RespValue.integer(3)))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void simpleString_rejectsLineBreaks() {
        assertThatThrownBy(() -> RespValue.simpleString("a\r\nb"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RespValue.error("ERR\n"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void bulkString_allowsLineBreaks() {
        assertThat(RespValue.bulkString("a\r\nb").getText()).isEqualTo("a\r\nb");
    }

    @Test
    void accessors_rejectWrongType() {
        assertThatThrownBy(() -> RespValue.integer(1).getText())
            .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> RespValue.bulkString("x").getInteger())
            .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> RespValue.nullValue().getElements())
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void equality_dependsOnTypeAndContent() {
        assertThat(RespValue.bulkString("OK")).isNotEqualTo(RespValue.simpleString("OK"));
        assertThat(RespValue.simpleString("OK")).isEqualTo(RespValue.ok());
        assertThat(RespValue.command("PING")).isEqualTo(RespValue.array(RespValue.bulkString("PING")));
        assertThat(RespValue.command("PING").hashCode())
            .isEqualTo(RespValue.array(RespValue.bulkString("PING")).hashCode());
        assertThat(RespValue.integer(1)).isNotEqualTo(RespValue.integer(2));
    }

    @Test
    void toString_isReadable() {
        assertThat(RespValue.nullValue().toString()).isNotBlank();
        assertThat(RespValue.command("GET", "key").toString()).contains("GET", "key");
    }
}
