package com.agentswarm.orchestrator.store;

import com.agentswarm.common.exception.LearningStoreUnavailableException;
import com.agentswarm.common.model.RoutingThreshold;
import com.agentswarm.common.model.TaskOutcome;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonLinesLearningStoreTest {

    private static final Instant NOW = Instant.parse("2026-05-01T09:00:00Z");

    @TempDir
    Path dir;

    private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private JsonLinesLearningStore<TaskOutcome> outcomes(Path file) {
        return new JsonLinesLearningStore<>("task_outcomes", file, TaskOutcome.class,
            TaskOutcome::taskId, true, objectMapper);
    }

    private JsonLinesLearningStore<RoutingThreshold> thresholds(Path file) {
        return new JsonLinesLearningStore<>("routing_thresholds", file, RoutingThreshold.class,
            RoutingThreshold::domain, false, objectMapper);
    }

    private static TaskOutcome outcome(String id, String domain, boolean success) {
        return new TaskOutcome(id, NOW, "query", domain, 4, "dns_specialist", true, success, 0.8, 0);
    }

    @Nested
    @DisplayName("append and query")
    class AppendAndQuery {

        @Test
        @DisplayName("duplicate key is rejected when keys are unique")
        void uniqueKeys() {
            JsonLinesLearningStore<TaskOutcome> store = outcomes(dir.resolve("task_outcomes.jsonl"));

            assertTrue(store.append(outcome("t-1", "dns", true)));
            assertFalse(store.append(outcome("t-1", "dns", false)));

            List<TaskOutcome> all = store.query(o -> true);
            assertEquals(1, all.size());
            assertTrue(all.get(0).success());
        }

        @Test
        @DisplayName("query filters in insertion order")
        void queryFilters() {
            JsonLinesLearningStore<TaskOutcome> store = outcomes(dir.resolve("task_outcomes.jsonl"));
            store.append(outcome("t-1", "dns", true));
            store.append(outcome("t-2", "security", true));
            store.append(outcome("t-3", "dns", false));

            List<TaskOutcome> dns = store.query(o -> "dns".equals(o.domain()));

            assertEquals(List.of("t-1", "t-3"), dns.stream().map(TaskOutcome::taskId).toList());
        }

        @Test
        @DisplayName("records survive a new store instance on the same file")
        void persistence() {
            Path file = dir.resolve("task_outcomes.jsonl");
            outcomes(file).append(outcome("t-1", "dns", true));

            assertEquals(1, outcomes(file).query(o -> true).size());
        }

        @Test
        @DisplayName("unparseable lines are skipped")
        void corruptLine() throws IOException {
            Path file = dir.resolve("task_outcomes.jsonl");
            JsonLinesLearningStore<TaskOutcome> store = outcomes(file);
            store.append(outcome("t-1", "dns", true));
            Files.writeString(file, "{not json\n", StandardOpenOption.APPEND);
            store.append(outcome("t-2", "dns", true));

            assertEquals(2, store.query(o -> true).size());
        }
    }

    @Nested
    @DisplayName("snapshots")
    class Snapshots {

        @Test
        @DisplayName("latest returns the newest snapshot for a key")
        void latest() {
            JsonLinesLearningStore<RoutingThreshold> store = thresholds(dir.resolve("routing_thresholds.jsonl"));
            RoutingThreshold initial = RoutingThreshold.initial("dns", NOW);
            store.append(initial);
            store.append(initial.withLearnedState(2.9, 0.4, 5, NOW.plusSeconds(60)));

            assertEquals(2.9, store.latest("dns").orElseThrow().currentThreshold(), 1e-9);
            assertTrue(store.latest("security").isEmpty());
        }

        @Test
        @DisplayName("update sees the current snapshot and appends the result")
        void update() {
            JsonLinesLearningStore<RoutingThreshold> store = thresholds(dir.resolve("routing_thresholds.jsonl"));

            RoutingThreshold created = store.update("dns", current ->
                current.orElseGet(() -> RoutingThreshold.initial("dns", NOW)));
            RoutingThreshold moved = store.update("dns", current ->
                current.orElseThrow().withLearnedState(3.1, 0.9, 3, NOW));

            assertEquals(3.0, created.currentThreshold(), 1e-9);
            assertEquals(3.1, moved.currentThreshold(), 1e-9);
            assertEquals(3.1, store.latest("dns").orElseThrow().currentThreshold(), 1e-9);
        }
    }

    @Nested
    @DisplayName("compaction")
    class Compaction {

        @Test
        @DisplayName("repeated updates keep one line per key")
        void oneLinePerKey() throws IOException {
            Path file = dir.resolve("routing_thresholds.jsonl");
            JsonLinesLearningStore<RoutingThreshold> store = thresholds(file);
            store.update("security", current -> RoutingThreshold.initial("security", NOW));
            for (int i = 0; i < 200; i++) {
                double next = 3.0 + (i % 10) / 10.0;
                store.update("dns", current -> current.orElseGet(() -> RoutingThreshold.initial("dns", NOW))
                    .withLearnedState(next, 0.5, 10, NOW));
            }

            assertEquals(2, Files.readAllLines(file).size());
            assertEquals(3.9, store.latest("dns").orElseThrow().currentThreshold(), 1e-9);
            assertEquals(List.of("security", "dns"),
                store.query(t -> true).stream().map(RoutingThreshold::domain).toList());
        }

        @Test
        @DisplayName("update leaves records of other keys and appended history intact")
        void otherKeysSurvive() {
            Path file = dir.resolve("routing_thresholds.jsonl");
            JsonLinesLearningStore<RoutingThreshold> store = thresholds(file);
            store.append(RoutingThreshold.initial("security", NOW));
            store.append(RoutingThreshold.initial("network", NOW));

            store.update("security", current -> current.orElseThrow().withLearnedState(2.5, 0.2, 6, NOW));

            assertEquals(2, store.query(t -> true).size());
            assertEquals(3.0, store.latest("network").orElseThrow().currentThreshold(), 1e-9);
            assertEquals(2.5, thresholds(file).latest("security").orElseThrow().currentThreshold(), 1e-9);
        }
    }

    @Test
    @DisplayName("I/O failure surfaces as store unavailable")
    void unavailable() throws IOException {
        Path blocker = Files.writeString(dir.resolve("blocker"), "regular file");
        JsonLinesLearningStore<TaskOutcome> store = outcomes(blocker.resolve("task_outcomes.jsonl"));

        LearningStoreUnavailableException ex = assertThrows(LearningStoreUnavailableException.class,
            () -> store.append(outcome("t-1", "dns", true)));
        assertTrue(ex.getMessage().contains("task_outcomes"));
    }
}
