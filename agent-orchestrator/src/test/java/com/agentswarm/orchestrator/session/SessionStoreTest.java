package com.agentswarm.orchestrator.session;

import com.agentswarm.common.model.HandoffHistoryEntry;
import com.agentswarm.orchestrator.service.SwarmState;
import com.agentswarm.orchestrator.support.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class SessionStoreTest {

    @TempDir
    Path dir;

    private MutableClock clock;
    private SessionStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.now());
        ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        store = new SessionStore(dir.resolve("sessions"), Duration.ofHours(24), objectMapper, clock);
    }

    private SwarmSession session(String executionId) {
        SwarmSession session = new SwarmSession();
        session.setExecutionId(executionId);
        session.setInitialAgent("dns_specialist");
        session.setCurrentAgent("azure_architect");
        session.setVersion("v2");
        session.setState(SwarmState.RUNNING);
        session.setHandoffsEnabled(true);
        session.getHandoffChain().add(new HandoffHistoryEntry("dns_specialist", "azure_architect",
            "DNS configured", 42, clock.instant()));
        session.setCreatedAt(clock.instant());
        session.setUpdatedAt(clock.instant());
        return session;
    }

    @Test
    void saveThenLoadRestoresTheSession() {
        store.save(session("exec-1"));

        SwarmSession loaded = store.load("exec-1").orElseThrow();

        assertEquals("azure_architect", loaded.getCurrentAgent());
        assertEquals(SwarmState.RUNNING, loaded.getState());
        assertEquals(1, loaded.getHandoffChain().size());
        assertEquals("azure_architect", loaded.getHandoffChain().get(0).toAgent());
        assertTrue(Files.exists(dir.resolve("sessions").resolve("swarm_session_exec-1.json")));
    }

    @Test
    void saveOverwritesThePreviousSnapshot() {
        SwarmSession session = session("exec-2");
        store.save(session);
        session.setState(SwarmState.COMPLETE);
        store.save(session);

        assertEquals(SwarmState.COMPLETE, store.load("exec-2").orElseThrow().getState());
    }

    @Test
    void loadOfUnknownExecutionIsEmpty() {
        assertTrue(store.load("missing").isEmpty());
    }

    @Test
    void cleanupRemovesOnlyExpiredSessions() throws IOException {
        store.save(session("old"));
        store.save(session("recent"));
        Files.setLastModifiedTime(store.pathFor("old"),
            FileTime.from(clock.instant().minus(Duration.ofHours(25))));

        int removed = store.cleanupExpired();

        assertEquals(1, removed);
        assertFalse(Files.exists(store.pathFor("old")));
        assertTrue(Files.exists(store.pathFor("recent")));
    }

    @Test
    void cleanupWithoutDirectoryIsNoop() {
        assertEquals(0, store.cleanupExpired());
    }
}
