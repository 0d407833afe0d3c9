package com.nifty.bulk.client.core;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * File-backed StateStore: the whole map lives in one JSON document that is rewritten
 * (write to temp file, then atomic move) on every mutation.
 * This is the default store for a desktop profile; it survives restarts.
 */
@Slf4j
public final class FileStateStore implements StateStore {

    private static final TypeReference<TreeMap<String, String>> MAP_TYPE = new TypeReference<>() {
    };

    private final Path file;
    private final ObjectMapper mapper;
    private final TreeMap<String, String> map;

    public FileStateStore(Path file, ObjectMapper mapper) {
        if (file == null) {
            throw new IllegalArgumentException("file must not be null");
        }
        this.file = file;
        this.mapper = mapper == null ? new ObjectMapper() : mapper;
        this.map = load();
    }

    private TreeMap<String, String> load() {
        if (!Files.exists(file)) {
            return new TreeMap<>();
        }
        try {
            TreeMap<String, String> m = mapper.readValue(file.toFile(), MAP_TYPE);
            log.info("Loaded {} state entries from {}", m == null ? 0 : m.size(), file);
            return m == null ? new TreeMap<>() : m;
        } catch (IOException e) {
            throw new StateStoreException("Cannot read state file " + file, e);
        }
    }

    private void flush() {
        try {
            Path dir = file.toAbsolutePath().getParent();
            if (dir != null) {
                Files.createDirectories(dir);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            mapper.writeValue(tmp.toFile(), map);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new StateStoreException("Cannot write state file " + file, e);
        }
    }

    @Override
    public synchronized void put(String key, String value) {
        if (value == null) {
            delete(key);
            return;
        }
        String prev = map.put(key, value);
        if (value.equals(prev)) return;
        flush();
    }

    @Override
    public synchronized Optional<String> get(String key) {
        return Optional.ofNullable(map.get(key));
    }

    @Override
    public synchronized void delete(String key) {
        if (map.remove(key) != null) {
            flush();
        }
    }

    @Override
    public synchronized Set<String> keys(String prefix) {
        String p = prefix == null ? "" : prefix;
        Set<String> out = new TreeSet<>();
        for (Map.Entry<String, String> e : map.tailMap(p, true).entrySet()) {
            if (!e.getKey().startsWith(p)) break;
            out.add(e.getKey());
        }
        return out;
    }
}
