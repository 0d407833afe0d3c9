package com.nifty.bulk.client.core;

import java.util.Optional;
import java.util.Set;

/**
 * A tiny abstraction over a durable key-value store that survives restarts.
 * Used by the session, ledger and portfolio subsystems to resume without a fresh login.
 *
 * Contracts:
 *  - All methods are thread-safe and synchronous.
 *  - Writes are visible to every reader of the same backing store, including other
 *    client instances sharing it.
 *  - Subsystems never write through the raw store; they take a {@link #namespace(String)} view.
 */
public interface StateStore {

    void put(String key, String value);

    Optional<String> get(String key);

    void delete(String key);

    // All keys starting with the given prefix (prefix "" lists everything)
    Set<String> keys(String prefix);

    /**
     * View of this store confined to keys under {@code name + ":"}.
     */
    default NamespacedStateStore namespace(String name) {
        return new NamespacedStateStore(this, name);
    }
}
