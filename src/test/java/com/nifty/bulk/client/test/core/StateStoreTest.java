package com.nifty.bulk.client.test.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nifty.bulk.client.config.CustomConfig;
import com.nifty.bulk.client.core.FileStateStore;
import com.nifty.bulk.client.core.InMemoryStateStore;
import com.nifty.bulk.client.core.NamespacedStateStore;
import com.nifty.bulk.client.core.StateStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StateStoreTest {

    private final ObjectMapper mapper = new CustomConfig().mapper();

    @Test
    void namespacesDoNotSeeEachOther() {
        StateStore store = new InMemoryStateStore("nb:");
        NamespacedStateStore session = store.namespace("session");
        NamespacedStateStore ledger = store.namespace("ledger");

        session.put("token", "abc");
        ledger.put("u1:balance", "{}");

        assertThat(session.get("token")).contains("abc");
        assertThat(ledger.get("token")).isEmpty();
        assertThat(session.keys("")).containsExactly("token");
        assertThat(store.keys("")).containsExactlyInAnyOrder("session:token", "ledger:u1:balance");
    }

    @Test
    void deleteAllOnlyTouchesMatchingKeysOfOneNamespace() {
        StateStore store = new InMemoryStateStore();
        NamespacedStateStore ledger = store.namespace("ledger");
        ledger.put("u1:balance", "a");
        ledger.put("u1:authoritative", "b");
        ledger.put("u2:balance", "c");
        store.namespace("portfolio").put("u1:journal", "[]");

        ledger.deleteAll("u1:");

        assertThat(ledger.keys("")).containsExactly("u2:balance");
        assertThat(store.namespace("portfolio").get("u1:journal")).contains("[]");
    }

    @Test
    void putNullDeletes() {
        NamespacedStateStore ns = new InMemoryStateStore().namespace("session");
        ns.put("expiry", "2030-01-01T00:00:00Z");
        ns.put("expiry", null);
        assertThat(ns.get("expiry")).isEmpty();
    }

    @Test
    void namespaceNameMustNotContainSeparator() {
        StateStore store = new InMemoryStateStore();
        assertThatThrownBy(() -> store.namespace("a:b")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.namespace(" ")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void fileStoreSurvivesRestart(@TempDir Path dir) {
        Path file = dir.resolve("state").resolve("state.json");
        FileStateStore first = new FileStateStore(file, mapper);
        first.namespace("session").put("fencing", "f-1");
        first.namespace("session").put("token", "t-1");
        first.namespace("session").delete("token");

        FileStateStore second = new FileStateStore(file, mapper);
        assertThat(second.namespace("session").get("fencing")).contains("f-1");
        assertThat(second.namespace("session").get("token")).isEmpty();
        assertThat(second.keys("session:")).containsExactly("session:fencing");
    }

    @Test
    void fileStoreKeysArePrefixScoped(@TempDir Path dir) {
        FileStateStore store = new FileStateStore(dir.resolve("s.json"), mapper);
        store.put("a:1", "x");
        store.put("ab:2", "y");
        store.put("b:3", "z");

        assertThat(store.keys("a:")).containsExactly("a:1");
        assertThat(store.keys("")).hasSize(3);
    }
}
