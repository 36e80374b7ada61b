package com.notredis.core;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Core storage interface for the key-value store.
 * All implementations must be thread-safe, and every method must appear atomic:
 * no caller may observe a multi-key write half applied.
 */
public interface KVStore {

    /**
     * Retrieve the value for a given key.
     *
     * @param key the key to look up
     * @return the value if present, empty otherwise
     */
    Optional<StoredValue> get(String key);

    /**
     * Retrieve several values at once.
     *
     * @param keys the keys to look up
     * @return one slot per key, in request order
     */
    List<Optional<StoredValue>> getAll(List<String> keys);

    /**
     * Store text under a key, replacing any previous value.
     *
     * @param key   the key to store
     * @param value the text to store
     */
    void set(String key, String value);

    /**
     * Store several texts at once. Later entries win over earlier ones for the same key.
     *
     * @param entries keys and texts to store
     */
    void setAll(Map<String, String> entries);

    /**
     * Delete keys.
     *
     * @param keys the keys to delete
     * @return the number of keys that existed and were removed
     */
    int delete(Collection<String> keys);

    /**
     * Increment the value under a key by one.
     * An absent key becomes the number 1; text holding an integer stays text.
     *
     * @param key the key to increment
     * @return the new value
     * @throws NumberFormatException if the current value is text that is not an integer
     * @throws ArithmeticException   if the increment overflows
     */
    long increment(String key);

    /**
     * Check if a key exists.
     *
     * @param key the key to check
     * @return true if the key exists
     */
    boolean exists(String key);

    /**
     * Get all keys in the store.
     *
     * @return snapshot of the key set
     */
    Set<String> keys();

    /**
     * Get the number of entries in the store.
     *
     * @return the number of entries
     */
    int size();

    /**
     * Clear all entries from the store.
     */
    void clear();
}
