package com.notredis.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Thread-safe in-memory key-value store.
 * Every operation, reads included, runs under one monitor, so operations are
 * linearized in lock acquisition order and multi-key writes are never seen half done.
 */
public class InMemoryStore implements KVStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryStore.class);

    private final Map<String, StoredValue> store;
    private final Object lock = new Object();

    /**
     * Create an empty store.
     */
    public InMemoryStore() {
        this.store = new HashMap<>();
        logger.debug("Created in-memory store");
    }

    @Override
    public Optional<StoredValue> get(String key) {
        validateKey(key);
        synchronized (lock) {
            return Optional.ofNullable(store.get(key));
        }
    }

    @Override
    public List<Optional<StoredValue>> getAll(List<String> keys) {
        keys.forEach(this::validateKey);
        List<Optional<StoredValue>> result = new ArrayList<>(keys.size());
        synchronized (lock) {
            for (String key : keys) {
                result.add(Optional.ofNullable(store.get(key)));
            }
        }
        return result;
    }

    @Override
    public void set(String key, String value) {
        validateKey(key);
        StoredValue text = StoredValue.text(value);
        synchronized (lock) {
            store.put(key, text);
        }
    }

    @Override
    public void setAll(Map<String, String> entries) {
        // Build every value before taking the lock so a bad entry cannot leave a partial write
        Map<String, StoredValue> values = new HashMap<>(entries.size() * 2);
        for (Map.Entry<String, String> entry : entries.entrySet()) {
            validateKey(entry.getKey());
            values.put(entry.getKey(), StoredValue.text(entry.getValue()));
        }
        synchronized (lock) {
            store.putAll(values);
        }
    }

    @Override
    public int delete(Collection<String> keys) {
        keys.forEach(this::validateKey);
        // The same key named twice is removed once
        Set<String> unique = new HashSet<>(keys);
        int removed = 0;
        synchronized (lock) {
            for (String key : unique) {
                if (store.remove(key) != null) {
                    removed++;
                }
            }
        }
        return removed;
    }

    @Override
    public long increment(String key) {
        validateKey(key);
        synchronized (lock) {
            StoredValue current = store.get(key);
            if (current == null) {
                store.put(key, StoredValue.number(1));
                return 1;
            }
            // Throws before the map is touched, so a failed increment changes nothing
            StoredValue next = current.increment();
            store.put(key, next);
            return next.isText() ? Long.parseLong(next.getText()) : next.getNumber();
        }
    }

    @Override
    public boolean exists(String key) {
        validateKey(key);
        synchronized (lock) {
            return store.containsKey(key);
        }
    }

    @Override
    public Set<String> keys() {
        synchronized (lock) {
            return new HashSet<>(store.keySet());
        }
    }

    @Override
    public int size() {
        synchronized (lock) {
            return store.size();
        }
    }

    @Override
    public void clear() {
        int cleared;
        synchronized (lock) {
            cleared = store.size();
            store.clear();
        }
        logger.info("Cleared {} keys", cleared);
    }

    private void validateKey(String key) {
        if (key == null) {
            throw new IllegalArgumentException("Key cannot be null");
        }
    }
}
