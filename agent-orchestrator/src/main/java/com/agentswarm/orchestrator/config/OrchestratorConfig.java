package com.agentswarm.orchestrator.config;

import com.agentswarm.common.model.ActionRecord;
import com.agentswarm.common.model.RoutingThreshold;
import com.agentswarm.common.model.TaskOutcome;
import com.agentswarm.common.model.ThresholdChange;
import com.agentswarm.common.store.LearningStore;
import com.agentswarm.orchestrator.flag.FeatureFlagStore;
import com.agentswarm.orchestrator.hitl.ActionRateLimiter;
import com.agentswarm.orchestrator.hitl.AdaptiveHitlGate;
import com.agentswarm.orchestrator.logger.HandoffEventLogger;
import com.agentswarm.orchestrator.registry.AgentRegistry;
import com.agentswarm.orchestrator.routing.AdaptiveRoutingController;
import com.agentswarm.orchestrator.service.SwarmOrchestrator;
import com.agentswarm.orchestrator.service.SwarmTaskService;
import com.agentswarm.orchestrator.session.SessionStore;
import com.agentswarm.orchestrator.store.JsonLinesLearningStore;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

@Configuration
public class OrchestratorConfig {

    @Value("${swarm.agents-dir}")
    private String agentsDir;

    @Value("${swarm.data-dir}")
    private String dataDir;

    @Value("${swarm.preferences-file}")
    private String preferencesFile;

    @Value("${swarm.max-handoffs:10}")
    private int maxHandoffs;

    @Value("${swarm.repeat-tolerance:1}")
    private int repeatTolerance;

    @Value("${swarm.session-retention-hours:24}")
    private long sessionRetentionHours;

    @Value("${swarm.hitl.pause-threshold:0.6}")
    private double pauseThreshold;

    @Value("${swarm.hitl.bulk-threshold:5}")
    private int bulkThreshold;

    @Value("${swarm.hitl.rate-limit:10}")
    private int rateLimit;

    @Value("${swarm.hitl.rate-window-seconds:60}")
    private long rateWindowSeconds;

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public AgentRegistry agentRegistry() {
        return new AgentRegistry(Path.of(agentsDir));
    }

    @Bean
    public FeatureFlagStore featureFlagStore(ObjectMapper objectMapper) {
        return new FeatureFlagStore(Path.of(preferencesFile), objectMapper);
    }

    @Bean
    public SessionStore sessionStore(ObjectMapper objectMapper, Clock clock) {
        return new SessionStore(Path.of(dataDir, "sessions"), Duration.ofHours(sessionRetentionHours),
            objectMapper, clock);
    }

    @Bean
    public HandoffEventLogger handoffEventLogger(ObjectMapper objectMapper, Clock clock) {
        return new HandoffEventLogger(Path.of(dataDir, "handoff_events.jsonl"), objectMapper, clock);
    }

    @Bean
    public SwarmOrchestrator swarmOrchestrator(AgentRegistry registry, FeatureFlagStore flags,
                                               SessionStore sessionStore, HandoffEventLogger eventLogger,
                                               ObjectMapper objectMapper, Clock clock) {
        return new SwarmOrchestrator(registry, flags, sessionStore, eventLogger, objectMapper, clock,
            maxHandoffs, repeatTolerance);
    }

    @Bean
    public LearningStore<TaskOutcome> taskOutcomeStore(ObjectMapper objectMapper) {
        return new JsonLinesLearningStore<>("task_outcomes", learningFile("task_outcomes.jsonl"),
            TaskOutcome.class, TaskOutcome::taskId, true, objectMapper);
    }

    @Bean
    public LearningStore<RoutingThreshold> routingThresholdStore(ObjectMapper objectMapper) {
        return new JsonLinesLearningStore<>("routing_thresholds", learningFile("routing_thresholds.jsonl"),
            RoutingThreshold.class, RoutingThreshold::domain, false, objectMapper);
    }

    @Bean
    public LearningStore<ThresholdChange> thresholdChangeStore(ObjectMapper objectMapper) {
        return new JsonLinesLearningStore<>("threshold_history", learningFile("threshold_history.jsonl"),
            ThresholdChange.class, ThresholdChange::domain, false, objectMapper);
    }

    @Bean
    public LearningStore<ActionRecord> actionRecordStore(ObjectMapper objectMapper) {
        return new JsonLinesLearningStore<>("hitl_decisions", learningFile("hitl_decisions.jsonl"),
            ActionRecord.class, ActionRecord::actionType, false, objectMapper);
    }

    @Bean
    public AdaptiveRoutingController adaptiveRoutingController(LearningStore<TaskOutcome> taskOutcomeStore,
                                                               LearningStore<RoutingThreshold> routingThresholdStore,
                                                               LearningStore<ThresholdChange> thresholdChangeStore,
                                                               Clock clock) {
        return new AdaptiveRoutingController(taskOutcomeStore, routingThresholdStore, thresholdChangeStore, clock);
    }

    @Bean
    public AdaptiveHitlGate adaptiveHitlGate(LearningStore<ActionRecord> actionRecordStore, Clock clock) {
        ActionRateLimiter limiter = new ActionRateLimiter(clock, rateLimit, Duration.ofSeconds(rateWindowSeconds));
        return new AdaptiveHitlGate(actionRecordStore, limiter, clock, pauseThreshold, bulkThreshold);
    }

    @Bean
    public SwarmTaskService swarmTaskService(AdaptiveRoutingController routingController,
                                             SwarmOrchestrator orchestrator, Clock clock) {
        return new SwarmTaskService(routingController, orchestrator, clock);
    }

    private Path learningFile(String fileName) {
        return Path.of(dataDir, "learning", fileName);
    }
}
