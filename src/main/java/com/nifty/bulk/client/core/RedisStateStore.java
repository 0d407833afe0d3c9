package com.nifty.bulk.client.core;

import org.springframework.data.redis.core.StringRedisTemplate;

import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Redis implementation using StringRedisTemplate.
 * Keys are prefixed with the provided prefix (e.g., "nb:").
 */
public final class RedisStateStore implements StateStore {

    private final StringRedisTemplate redis;
    private final String prefix;

    public RedisStateStore(StringRedisTemplate redis, String prefix) {
        if (redis == null) {
            throw new IllegalArgumentException("redis must not be null");
        }
        this.redis = redis;
        this.prefix = prefix == null ? "" : prefix;
    }

    private String k(String key) {
        return prefix + key;
    }

    @Override
    public void put(String key, String value) {
        redis.opsForValue().set(k(key), value);
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(redis.opsForValue().get(k(key)));
    }

    @Override
    public void delete(String key) {
        redis.delete(k(key));
    }

    @Override
    public Set<String> keys(String keyPrefix) {
        // KEYS is fine here: one client profile holds a handful of entries
        Set<String> raw = redis.keys(k(keyPrefix == null ? "" : keyPrefix) + "*");
        Set<String> out = new TreeSet<>();
        if (raw == null) return out;
        for (String full : raw) {
            out.add(full.substring(prefix.length()));
        }
        return out;
    }
}
