package com.notredis.config;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ConfigTableTest {

    @Test
    void get_absentKey_returnsEmptyString() {
        assertThat(new ConfigTable().get("anything")).isEmpty();
    }

    @Test
    void setThenGet_returnsValue() {
        ConfigTable table = new ConfigTable();
        table.set("save", "900 1");

        assertThat(table.get("save")).isEqualTo("900 1");
        assertThat(table.contains("save")).isTrue();
    }

    @Test
    void set_nullValue_isRejected() {
        assertThatThrownBy(() -> new ConfigTable().set("k", null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void snapshot_isACopy() {
        ConfigTable table = new ConfigTable();
        table.set("a", "1");

        Map<String, String> snapshot = table.snapshot();
        table.set("b", "2");

        assertThat(snapshot).containsOnlyKeys("a");
    }

    @Test
    void port_defaultsWhenUnsetOrInvalid() {
        assertThat(new ConfigTable().getPort()).isEqualTo(ConfigTable.DEFAULT_PORT);

        Map<String, String> initial = new HashMap<>();
        initial.put(ConfigTable.PORT, "not-a-port");
        assertThat(new ConfigTable(initial).getPort()).isEqualTo(ConfigTable.DEFAULT_PORT);

        initial.put(ConfigTable.PORT, "70000");
        assertThat(new ConfigTable(initial).getPort()).isEqualTo(ConfigTable.DEFAULT_PORT);
    }

    @Test
    void port_isParsed() {
        ConfigTable table = new ConfigTable();
        table.set(ConfigTable.PORT, " 6380 ");

        assertThat(table.getPort()).isEqualTo(6380);
    }

    @Test
    void bindAddress_usesFirstAddress() {
        ConfigTable table = new ConfigTable();
        assertThat(table.getBindAddress()).isEqualTo("127.0.0.1");

        table.set(ConfigTable.BIND, "0.0.0.0 ::1");
        assertThat(table.getBindAddress()).isEqualTo("0.0.0.0");
    }
}
