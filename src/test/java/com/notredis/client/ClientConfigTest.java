package com.notredis.client;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ClientConfigTest {

    @Test
    void defaults() {
        ClientConfig config = new ClientConfig();

        assertThat(config.getConnectTimeoutMs()).isEqualTo(5000);
        assertThat(config.getReadTimeoutMs()).isEqualTo(30000);
        assertThat(config.getMaxReplyBytes()).isEqualTo(64 * 1024 * 1024);
    }

    @Test
    void builder_setsValues() {
        ClientConfig config = ClientConfig.builder()
            .connectTimeoutMs(100)
            .readTimeoutMs(200)
            .maxReplyBytes(4096)
            .build();

        assertThat(config.getConnectTimeoutMs()).isEqualTo(100);
        assertThat(config.getReadTimeoutMs()).isEqualTo(200);
        assertThat(config.getMaxReplyBytes()).isEqualTo(4096);
    }

    @Test
    void invalidValues_areRejected() {
        assertThatThrownBy(() -> ClientConfig.builder().connectTimeoutMs(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("connectTimeoutMs");
        assertThatThrownBy(() -> ClientConfig.builder().readTimeoutMs(-1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ClientConfig.builder().maxReplyBytes(10))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
