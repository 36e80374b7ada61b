package com.notredis.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Server configuration values, readable and writable at runtime through CONFIG.
 * Guarded by its own monitor, independent of the data store.
 */
public class ConfigTable {

    private static final Logger logger = LoggerFactory.getLogger(ConfigTable.class);

    public static final String PORT = "port";
    public static final String BIND = "bind";
    public static final int DEFAULT_PORT = 6379;
    public static final String DEFAULT_BIND = "127.0.0.1";

    private final Map<String, String> values = new HashMap<>();
    private final Object lock = new Object();

    public ConfigTable() {
    }

    /**
     * Create a table seeded with the given values.
     */
    public ConfigTable(Map<String, String> initial) {
        values.putAll(initial);
    }

    /**
     * Get a configuration value.
     *
     * @param key the configuration key
     * @return the value, or the empty string if the key is not set
     */
    public String get(String key) {
        synchronized (lock) {
            return values.getOrDefault(key, "");
        }
    }

    /**
     * Set a configuration value.
     *
     * @param key   the configuration key
     * @param value the new value
     */
    public void set(String key, String value) {
        if (key == null || value == null) {
            throw new IllegalArgumentException("Configuration key and value cannot be null");
        }
        synchronized (lock) {
            values.put(key, value);
        }
    }

    /**
     * Check if a key has been set.
     */
    public boolean contains(String key) {
        synchronized (lock) {
            return values.containsKey(key);
        }
    }

    /**
     * Get a copy of all values.
     */
    public Map<String, String> snapshot() {
        synchronized (lock) {
            return new HashMap<>(values);
        }
    }

    /**
     * Get the listening port.
     *
     * @return the configured port, or 6379 if unset or invalid
     */
    public int getPort() {
        String value = get(PORT).trim();
        if (value.isEmpty()) {
            return DEFAULT_PORT;
        }
        try {
            int port = Integer.parseInt(value);
            if (port >= 0 && port <= 65535) {
                return port;
            }
            logger.warn("Port {} out of range, using default {}", port, DEFAULT_PORT);
        } catch (NumberFormatException e) {
            logger.warn("Invalid port value: {}, using default {}", value, DEFAULT_PORT);
        }
        return DEFAULT_PORT;
    }

    /**
     * Get the address to listen on.
     *
     * @return the first configured bind address, or 127.0.0.1
     */
    public String getBindAddress() {
        String value = get(BIND).trim();
        if (value.isEmpty()) {
            return DEFAULT_BIND;
        }
        // redis.conf allows several addresses; only the first is used
        return value.split("\\s+")[0];
    }
}
