package com.nifty.bulk.client.core;

import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory implementation of StateStore.
 * Intended for local/dev/testing only (single JVM, nothing survives a restart).
 */
public final class InMemoryStateStore implements StateStore {

    private final ConcurrentMap<String, String> map = new ConcurrentHashMap<>();
    private final String prefix; // e.g., "nb:"

    public InMemoryStateStore() {
        this("");
    }

    public InMemoryStateStore(String prefix) {
        this.prefix = prefix == null ? "" : prefix;
    }

    private String k(String key) {
        return prefix + key;
    }

    @Override
    public void put(String key, String value) {
        map.put(k(key), value);
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(map.get(k(key)));
    }

    @Override
    public void delete(String key) {
        map.remove(k(key));
    }

    @Override
    public Set<String> keys(String keyPrefix) {
        final String p = k(keyPrefix == null ? "" : keyPrefix);
        Set<String> out = new TreeSet<>();
        for (String full : map.keySet()) {
            if (full.startsWith(p)) {
                out.add(full.substring(prefix.length()));
            }
        }
        return out;
    }
}
