package com.agentswarm.orchestrator;

import com.agentswarm.orchestrator.support.AgentFixtures;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class AgentOrchestratorApplicationTest {

    private static final Path ROOT = createRoot();

    @Autowired
    private WebTestClient client;

    private static Path createRoot() {
        try {
            Path root = Files.createTempDirectory("agent-swarm");
            AgentFixtures.handoffCapable(root.resolve("agents"), "dns_specialist_agent", "DNS Management");
            return root;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @DynamicPropertySource
    static void swarmProperties(DynamicPropertyRegistry registry) {
        registry.add("swarm.agents-dir", () -> ROOT.resolve("agents").toString());
        registry.add("swarm.data-dir", () -> ROOT.resolve("data").toString());
        registry.add("swarm.preferences-file", () -> ROOT.resolve("data/preferences.json").toString());
    }

    @Test
    void wiresRegistryAndPersistsRoutingState() {
        client.get().uri("/api/v1/swarm/agents/dns_specialist")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.supports_handoff").isEqualTo(true);

        client.post().uri("/api/v1/routing/check")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"domain\":\"dns\",\"complexity\":4}")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.load_agent").isEqualTo(true);

        assertTrue(Files.exists(ROOT.resolve("data/learning/routing_thresholds.jsonl")));
    }
}
