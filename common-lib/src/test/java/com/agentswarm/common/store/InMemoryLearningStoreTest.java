package com.agentswarm.common.store;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryLearningStoreTest {

    private record Entry(String key, int value) {}

    @Test
    @DisplayName("unique-key store rejects a second record for the same key")
    void uniqueKeys() {
        InMemoryLearningStore<Entry> store = new InMemoryLearningStore<>("test", Entry::key, true);

        assertTrue(store.append(new Entry("a", 1)));
        assertFalse(store.append(new Entry("a", 2)));
        assertEquals(List.of(new Entry("a", 1)), store.query(e -> true));
    }

    @Test
    @DisplayName("latest returns the newest record for a key")
    void latest() {
        InMemoryLearningStore<Entry> store = new InMemoryLearningStore<>("test", Entry::key, false);
        store.append(new Entry("a", 1));
        store.append(new Entry("b", 5));
        store.append(new Entry("a", 2));

        assertEquals(Optional.of(new Entry("a", 2)), store.latest("a"));
        assertTrue(store.latest("missing").isEmpty());
    }

    @Test
    @DisplayName("update sees the newest record and replaces the key's records")
    void update() {
        InMemoryLearningStore<Entry> store = new InMemoryLearningStore<>("test", Entry::key, false);

        store.update("a", current -> new Entry("a", current.map(Entry::value).orElse(0) + 1));
        Entry second = store.update("a", current -> new Entry("a", current.map(Entry::value).orElse(0) + 1));

        assertEquals(2, second.value());
        assertEquals(List.of(new Entry("a", 2)), store.query(e -> e.key().equals("a")));
    }
}
