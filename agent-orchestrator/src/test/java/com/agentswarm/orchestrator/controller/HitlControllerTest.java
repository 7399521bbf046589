package com.agentswarm.orchestrator.controller;

import com.agentswarm.common.model.ActionRecord;
import com.agentswarm.common.store.InMemoryLearningStore;
import com.agentswarm.orchestrator.hitl.ActionRateLimiter;
import com.agentswarm.orchestrator.hitl.AdaptiveHitlGate;
import com.agentswarm.orchestrator.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Instant;

class HitlControllerTest {

    private WebTestClient client;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(Instant.parse("2026-05-01T09:00:00Z"));
        AdaptiveHitlGate gate = new AdaptiveHitlGate(
            new InMemoryLearningStore<>("decisions", ActionRecord::actionType, false),
            new ActionRateLimiter(clock, ActionRateLimiter.DEFAULT_MAX_ATTEMPTS, ActionRateLimiter.DEFAULT_WINDOW),
            clock, AdaptiveHitlGate.DEFAULT_PAUSE_THRESHOLD, AdaptiveHitlGate.DEFAULT_BULK_THRESHOLD);
        client = WebTestClient.bindToController(new HitlController(gate))
            .controllerAdvice(new ApiExceptionHandler())
            .build();
    }

    @Test
    void criticalActionPauses() {
        client.post().uri("/api/v1/hitl/check")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"action\":{\"type\":\"database_drop\",\"target\":\"prod_db\"},"
                + "\"context\":{\"environment\":\"production\"}}")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.pause").isEqualTo(true)
            .jsonPath("$.category").isEqualTo("CRITICAL");
    }

    @Test
    void missingActionIsBadRequest() {
        client.post().uri("/api/v1/hitl/check")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"context\":{}}")
            .exchange()
            .expectStatus().isBadRequest();
    }

    @Test
    void recordedDecisionsShowUpInStatsAndHistory() {
        client.post().uri("/api/v1/hitl/decisions")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"action\":{\"type\":\"file_delete\",\"target\":\"tmp.txt\"},"
                + "\"approved\":false,\"feedback\":\"keep it\"}")
            .exchange()
            .expectStatus().isCreated()
            .expectBody()
            .jsonPath("$.recorded").isEqualTo(true);

        client.get().uri("/api/v1/hitl/stats")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.total_decisions").isEqualTo(1)
            .jsonPath("$.rejections").isEqualTo(1);

        client.get().uri("/api/v1/hitl/decisions?limit=5")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$[0].action_type").isEqualTo("file_delete");
    }
}
