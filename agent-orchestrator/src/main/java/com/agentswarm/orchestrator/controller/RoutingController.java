package com.agentswarm.orchestrator.controller;

import com.agentswarm.common.model.RoutingDecision;
import com.agentswarm.common.model.RoutingThreshold;
import com.agentswarm.common.model.TaskOutcome;
import com.agentswarm.common.model.ThresholdChange;
import com.agentswarm.common.routing.DomainStats;
import com.agentswarm.common.trace.TraceContextUtil;
import com.agentswarm.orchestrator.dto.RoutingCheckRequest;
import com.agentswarm.orchestrator.routing.AdaptiveRoutingController;
import com.agentswarm.orchestrator.routing.RoutingStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/routing")
public class RoutingController {

    private static final Logger log = LoggerFactory.getLogger(RoutingController.class);

    private final AdaptiveRoutingController routingController;

    public RoutingController(AdaptiveRoutingController routingController) {
        this.routingController = routingController;
    }

    @PostMapping("/check")
    public Mono<ResponseEntity<RoutingDecision>> check(
            @RequestBody RoutingCheckRequest request,
            @RequestHeader(value = "X-Execution-Id", defaultValue = TraceContextUtil.UNKNOWN) String executionId) {
        if (request.domain() == null || request.domain().isBlank()) {
            return Mono.error(new IllegalArgumentException("domain is required"));
        }
        Mono<ResponseEntity<RoutingDecision>> pipeline = Mono
            .fromCallable(() -> routingController.shouldLoadAgent(request.domain(), request.complexity()))
            .subscribeOn(Schedulers.boundedElastic())
            .doOnEach(signal -> {
                if (!signal.isOnNext()) return;
                String id = TraceContextUtil.getExecutionId(signal.getContextView());
                TraceContextUtil.withMdc(id, () ->
                    log.info("[RoutingApi] check domain={} complexity={} loadAgent={}",
                             request.domain(), request.complexity(), signal.get().loadAgent()));
            })
            .map(ResponseEntity::ok);
        return TraceContextUtil.withExecutionId(pipeline, executionId);
    }

    @PostMapping("/outcomes")
    public Mono<ResponseEntity<Map<String, Object>>> recordOutcome(@RequestBody TaskOutcome outcome) {
        log.info("Outcome received. taskId={} domain={} success={}", outcome.taskId(), outcome.domain(), outcome.success());
        return Mono.fromCallable(() -> routingController.recordOutcome(outcome))
            .subscribeOn(Schedulers.boundedElastic())
            .map(recorded -> ResponseEntity.status(recorded ? HttpStatus.CREATED : HttpStatus.OK)
                .body(Map.<String, Object>of("task_id", outcome.taskId(), "recorded", recorded)))
            .doOnError(e -> log.error("Outcome endpoint error. taskId={}", outcome.taskId(), e));
    }

    @GetMapping("/domains/{domain}")
    public Mono<ResponseEntity<DomainStats>> domainStats(@PathVariable String domain) {
        return Mono.fromCallable(() -> routingController.getDomainStats(domain))
            .subscribeOn(Schedulers.boundedElastic())
            .map(ResponseEntity::ok);
    }

    @GetMapping("/domains/{domain}/history")
    public Mono<ResponseEntity<List<ThresholdChange>>> history(@PathVariable String domain) {
        return Mono.fromCallable(() -> routingController.getThresholdHistory(domain))
            .subscribeOn(Schedulers.boundedElastic())
            .map(ResponseEntity::ok);
    }

    @PostMapping("/domains/{domain}/reset")
    public Mono<ResponseEntity<RoutingThreshold>> reset(@PathVariable String domain) {
        log.info("Threshold reset requested. domain={}", domain);
        return Mono.fromCallable(() -> routingController.resetDomain(domain))
            .subscribeOn(Schedulers.boundedElastic())
            .map(ResponseEntity::ok);
    }

    @GetMapping("/stats")
    public Mono<ResponseEntity<RoutingStats>> stats() {
        return Mono.fromCallable(routingController::getAllStats)
            .subscribeOn(Schedulers.boundedElastic())
            .map(ResponseEntity::ok);
    }
}
