package com.agentswarm.orchestrator.controller;

import com.agentswarm.common.handoff.HandoffStats;
import com.agentswarm.common.model.AgentDescriptor;
import com.agentswarm.orchestrator.registry.AgentRegistry;
import com.agentswarm.orchestrator.service.SwarmOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/swarm")
public class SwarmController {

    private static final Logger log = LoggerFactory.getLogger(SwarmController.class);

    private final AgentRegistry     registry;
    private final SwarmOrchestrator orchestrator;

    public SwarmController(AgentRegistry registry, SwarmOrchestrator orchestrator) {
        this.registry = registry;
        this.orchestrator = orchestrator;
    }

    @GetMapping("/agents")
    public Mono<ResponseEntity<List<AgentDescriptor>>> agents(
            @RequestParam(value = "specialty", required = false) String specialty) {
        log.info("Agent listing requested. specialty={}", specialty);
        List<AgentDescriptor> agents = specialty == null || specialty.isBlank()
            ? registry.descriptors()
            : registry.findBySpecialty(specialty);
        return Mono.just(ResponseEntity.ok(agents));
    }

    @GetMapping("/agents/{name}")
    public Mono<ResponseEntity<AgentDescriptor>> agent(@PathVariable String name) {
        return Mono.fromCallable(() -> ResponseEntity.ok(registry.describe(name)))
            .doOnError(e -> log.warn("Agent lookup failed. name={} reason={}", name, e.getMessage()));
    }

    @GetMapping("/stats")
    public Mono<ResponseEntity<Map<String, Object>>> stats() {
        HandoffStats handoffs = orchestrator.getHandoffStats();
        return Mono.just(ResponseEntity.ok(Map.of(
            "registry", registry.getStats(),
            "handoffs", handoffs,
            "max_handoffs", orchestrator.getMaxHandoffs())));
    }
}
