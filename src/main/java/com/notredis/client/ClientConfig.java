package com.notredis.client;

/**
 * Configuration for NotRedis client.
 */
public class ClientConfig {

    private int connectTimeoutMs = 5000;
    private int readTimeoutMs = 30000;
    private int maxReplyBytes = 64 * 1024 * 1024;

    /**
     * Create a config builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    public int getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(int connectTimeoutMs) {
        if (connectTimeoutMs <= 0) {
            throw new IllegalArgumentException("connectTimeoutMs must be positive, got: " + connectTimeoutMs);
        }
        this.connectTimeoutMs = connectTimeoutMs;
    }

    public int getReadTimeoutMs() {
        return readTimeoutMs;
    }

    public void setReadTimeoutMs(int readTimeoutMs) {
        if (readTimeoutMs <= 0) {
            throw new IllegalArgumentException("readTimeoutMs must be positive, got: " + readTimeoutMs);
        }
        this.readTimeoutMs = readTimeoutMs;
    }

    public int getMaxReplyBytes() {
        return maxReplyBytes;
    }

    /**
     * Largest reply the client buffers before giving up on the connection.
     */
    public void setMaxReplyBytes(int maxReplyBytes) {
        if (maxReplyBytes < 1024) {
            throw new IllegalArgumentException("maxReplyBytes must be at least 1024, got: " + maxReplyBytes);
        }
        this.maxReplyBytes = maxReplyBytes;
    }

    /**
     * Builder for ClientConfig.
     */
    public static class Builder {
        private final ClientConfig config = new ClientConfig();

        public Builder connectTimeoutMs(int timeout) {
            config.setConnectTimeoutMs(timeout);
            return this;
        }

        public Builder readTimeoutMs(int timeout) {
            config.setReadTimeoutMs(timeout);
            return this;
        }

        public Builder maxReplyBytes(int max) {
            config.setMaxReplyBytes(max);
            return this;
        }

        public ClientConfig build() {
            return config;
        }
    }
}
