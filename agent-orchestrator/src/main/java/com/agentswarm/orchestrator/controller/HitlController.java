package com.agentswarm.orchestrator.controller;

import com.agentswarm.common.model.ActionRecord;
import com.agentswarm.common.model.PauseDecision;
import com.agentswarm.common.trace.TraceContextUtil;
import com.agentswarm.orchestrator.dto.HitlCheckRequest;
import com.agentswarm.orchestrator.dto.HitlDecisionRequest;
import com.agentswarm.orchestrator.hitl.AdaptiveHitlGate;
import com.agentswarm.orchestrator.hitl.HitlStats;
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
@RequestMapping("/api/v1/hitl")
public class HitlController {

    private static final Logger log = LoggerFactory.getLogger(HitlController.class);

    private final AdaptiveHitlGate gate;

    public HitlController(AdaptiveHitlGate gate) {
        this.gate = gate;
    }

    @PostMapping("/check")
    public Mono<ResponseEntity<PauseDecision>> check(
            @RequestBody HitlCheckRequest request,
            @RequestHeader(value = "X-Execution-Id", defaultValue = TraceContextUtil.UNKNOWN) String executionId) {
        if (request.action() == null) {
            return Mono.error(new IllegalArgumentException("action is required"));
        }
        Mono<ResponseEntity<PauseDecision>> pipeline = Mono
            .fromCallable(() -> gate.shouldPause(request.action(), request.context()))
            .subscribeOn(Schedulers.boundedElastic())
            .doOnEach(signal -> {
                if (!signal.isOnNext()) return;
                String id = TraceContextUtil.getExecutionId(signal.getContextView());
                TraceContextUtil.withMdc(id, () ->
                    log.info("[HitlApi] check type={} pause={} reason={}",
                             request.action().type(), signal.get().pause(), signal.get().reason()));
            })
            .map(ResponseEntity::ok);
        return TraceContextUtil.withExecutionId(pipeline, executionId);
    }

    @PostMapping("/decisions")
    public Mono<ResponseEntity<Map<String, Object>>> recordDecision(@RequestBody HitlDecisionRequest request) {
        if (request.action() == null) {
            return Mono.error(new IllegalArgumentException("action is required"));
        }
        return Mono.fromCallable(() -> gate.recordDecision(request.action(), request.approved(), request.feedback()))
            .subscribeOn(Schedulers.boundedElastic())
            .map(recorded -> ResponseEntity.status(recorded ? HttpStatus.CREATED : HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.<String, Object>of("action_type", request.action().type(), "recorded", recorded)))
            .doOnError(e -> log.error("Decision endpoint error. type={}", request.action().type(), e));
    }

    @GetMapping("/decisions")
    public Mono<ResponseEntity<List<ActionRecord>>> recentDecisions(
            @RequestParam(value = "limit", defaultValue = "20") int limit) {
        return Mono.fromCallable(() -> gate.getRecentDecisions(limit))
            .subscribeOn(Schedulers.boundedElastic())
            .map(ResponseEntity::ok);
    }

    @GetMapping("/stats")
    public Mono<ResponseEntity<HitlStats>> stats() {
        return Mono.fromCallable(gate::getStats)
            .subscribeOn(Schedulers.boundedElastic())
            .map(ResponseEntity::ok);
    }
}
