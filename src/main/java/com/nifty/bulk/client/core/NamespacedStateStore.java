package com.nifty.bulk.client.core;

import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Disjoint slice of a {@link StateStore}. Each subsystem owns exactly one namespace and
 * is the only writer of the keys under it.
 */
public final class NamespacedStateStore {

    private final StateStore delegate;
    private final String name;
    private final String prefix;

    NamespacedStateStore(StateStore delegate, String name) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate must not be null");
        }
        if (name == null || name.isBlank() || name.contains(":")) {
            throw new IllegalArgumentException("namespace must be a non-blank name without ':'");
        }
        this.delegate = delegate;
        this.name = name;
        this.prefix = name + ":";
    }

    public String name() {
        return name;
    }

    private String k(String key) {
        return prefix + key;
    }

    public void put(String key, String value) {
        if (value == null) {
            delegate.delete(k(key));
        } else {
            delegate.put(k(key), value);
        }
    }

    public Optional<String> get(String key) {
        return delegate.get(k(key));
    }

    public void delete(String key) {
        delegate.delete(k(key));
    }

    /**
     * Keys of this namespace (without the namespace prefix) that start with {@code keyPrefix}.
     */
    public Set<String> keys(String keyPrefix) {
        String p = keyPrefix == null ? "" : keyPrefix;
        Set<String> out = new LinkedHashSet<>();
        for (String full : delegate.keys(k(p))) {
            out.add(full.substring(prefix.length()));
        }
        return out;
    }

    /**
     * Removes every key of this namespace starting with {@code keyPrefix}.
     */
    public void deleteAll(String keyPrefix) {
        for (String key : keys(keyPrefix)) {
            delete(key);
        }
    }
}
