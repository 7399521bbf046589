package com.agentswarm.orchestrator.service;

import com.agentswarm.common.exception.AgentInvocationException;
import com.agentswarm.common.exception.AgentNotFoundException;
import com.agentswarm.common.exception.MaxHandoffsExceededException;
import com.agentswarm.common.guard.CycleGuard;
import com.agentswarm.common.handoff.HandoffDeclarationParser;
import com.agentswarm.common.handoff.HandoffStats;
import com.agentswarm.common.handoff.HandoffStatsCalculator;
import com.agentswarm.common.handoff.ParseResult;
import com.agentswarm.common.model.HandoffDeclaration;
import com.agentswarm.common.model.HandoffHistoryEntry;
import com.agentswarm.common.trace.TraceContextUtil;
import com.agentswarm.orchestrator.flag.FeatureFlagStore;
import com.agentswarm.orchestrator.logger.HandoffEvent.EventType;
import com.agentswarm.orchestrator.logger.HandoffEventLogger;
import com.agentswarm.orchestrator.registry.AgentRegistry;
import com.agentswarm.orchestrator.service.SwarmExecutionResult.AgentStep;
import com.agentswarm.orchestrator.session.ExecutionContext;
import com.agentswarm.orchestrator.session.SessionStore;
import com.agentswarm.orchestrator.session.SwarmSession;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Drives the bounded multi-agent hop loop.
 *
 * <p>State machine: {@code IDLE -> RUNNING(agent) -> RUNNING(next) | COMPLETE | ABORTED}.
 * After each agent run its output is parsed for a handoff declaration. When one is present
 * the checks run in this order, the first that applies deciding the transition:
 * <ol>
 *   <li>declaring agent is terminal: COMPLETE ({@link CompletionReason#TERMINAL_AGENT})</li>
 *   <li>handoffs disabled: COMPLETE ({@link CompletionReason#HANDOFFS_DISABLED}), declaration reported</li>
 *   <li>unknown target: ABORTED with {@link AgentNotFoundException}</li>
 *   <li>cycle guard tripped: COMPLETE ({@link CompletionReason#CYCLE_DETECTED})</li>
 *   <li>chain already at {@code maxHandoffs}: ABORTED with {@link MaxHandoffsExceededException}</li>
 *   <li>otherwise the handoff is accepted and the next agent runs with merged context</li>
 * </ol>
 *
 * <p>All per-execution state lives in locals and the {@link ExecutionContext}; the only
 * instance state is the list of finished chains, completed or aborted, feeding
 * {@link #getHandoffStats()}.
 */
public class SwarmOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(SwarmOrchestrator.class);

    public static final int    DEFAULT_MAX_HANDOFFS = 10;
    public static final String PREVIOUS_AGENT_KEY   = "_previous_agent";
    public static final String HANDOFF_REASON_KEY   = "_handoff_reason";
    public static final String OUTPUT_KEY_SUFFIX    = "_output";

    private final AgentRegistry      registry;
    private final FeatureFlagStore   featureFlags;
    private final SessionStore       sessionStore;
    private final HandoffEventLogger eventLogger;
    private final ObjectMapper       objectMapper;
    private final Clock              clock;
    private final int                maxHandoffs;
    private final int                repeatTolerance;

    private final List<List<HandoffHistoryEntry>> finishedChains = Collections.synchronizedList(new ArrayList<>());

    public SwarmOrchestrator(AgentRegistry registry,
                             FeatureFlagStore featureFlags,
                             SessionStore sessionStore,
                             HandoffEventLogger eventLogger,
                             ObjectMapper objectMapper,
                             Clock clock,
                             int maxHandoffs,
                             int repeatTolerance) {
        this.registry = registry;
        this.featureFlags = featureFlags;
        this.sessionStore = sessionStore;
        this.eventLogger = eventLogger;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.maxHandoffs = maxHandoffs;
        this.repeatTolerance = repeatTolerance;
    }

    public SwarmExecutionResult execute(String initialAgent, Map<String, Object> task, AgentInvoker invoker) {
        return execute(ExecutionContext.create(clock), initialAgent, task, invoker);
    }

    /**
     * Runs {@code initialAgent} on {@code task} and follows declared handoffs until completion.
     *
     * @param task initial context handed to the first agent
     * @throws AgentNotFoundException       initial agent or a handoff target is not registered
     * @throws MaxHandoffsExceededException an agent declared a handoff with the chain already full
     */
    public SwarmExecutionResult execute(ExecutionContext ctx, String initialAgent,
                                        Map<String, Object> task, AgentInvoker invoker) {
        long startNanos = System.nanoTime();
        String executionId = ctx.executionId();
        sessionStore.cleanupExpired();

        if (!registry.contains(initialAgent)) {
            throw new AgentNotFoundException(initialAgent, registry.candidateNames());
        }

        boolean handoffsEnabled = featureFlags.handoffsEnabled();
        SwarmSession session = startSession(ctx, initialAgent, handoffsEnabled);

        List<HandoffHistoryEntry> chain = new ArrayList<>();
        List<AgentStep> steps = new ArrayList<>();
        Map<String, Object> context = task == null ? new LinkedHashMap<>() : new LinkedHashMap<>(task);
        String current = initialAgent;
        String handoffReason = null;

        TraceContextUtil.withMdc(executionId, () ->
            log.info("[Swarm] execution started initialAgent={} handoffsEnabled={} maxHandoffs={}",
                     initialAgent, handoffsEnabled, maxHandoffs));

        while (true) {
            String agent = current;
            String prompt = registry.buildPrompt(agent, context, handoffReason);
            String output;
            try {
                output = invoker.invoke(agent, prompt, ctx);
            } catch (RuntimeException e) {
                String lastOutput = steps.isEmpty() ? null : steps.get(steps.size() - 1).output();
                TraceContextUtil.withMdc(executionId, () ->
                    log.error("[Swarm] agent invocation failed agent={} handoffs={}", agent, chain.size(), e));
                abort(session, chain);
                throw new AgentInvocationException(agent, chain, lastOutput, e);
            }
            steps.add(new AgentStep(agent, output));

            ParseResult parsed = HandoffDeclarationParser.parseResult(output, clock.instant());
            if (!parsed.isOk()) {
                if (parsed.status() == ParseResult.Status.MALFORMED) {
                    TraceContextUtil.withMdc(executionId, () ->
                        log.warn("[Swarm] malformed handoff declaration ignored agent={} detail={}",
                                 agent, parsed.detail()));
                }
                return complete(ctx, session, agent, output, chain, steps, context,
                    CompletionReason.NO_HANDOFF, null, parsed.detail(), startNanos);
            }

            HandoffDeclaration declaration = parsed.declaration();
            String target = declaration.toAgent();
            eventLogger.log(EventType.HANDOFF_TRIGGERED, executionId, agent, target, declaration.reason(), null);

            if (!registry.describe(agent).supportsHandoff()) {
                eventLogger.log(EventType.HANDOFF_REJECTED, executionId, agent, target,
                    declaration.reason(), "terminal agent");
                return complete(ctx, session, agent, output, chain, steps, context,
                    CompletionReason.TERMINAL_AGENT, null, "Agent " + agent + " does not support handoffs",
                    startNanos);
            }

            if (!handoffsEnabled) {
                eventLogger.log(EventType.HANDOFF_SUPPRESSED, executionId, agent, target,
                    declaration.reason(), FeatureFlagStore.HANDOFFS_ENABLED + "=false");
                return complete(ctx, session, agent, output, chain, steps, context,
                    CompletionReason.HANDOFFS_DISABLED, declaration, null, startNanos);
            }

            if (!registry.contains(target)) {
                eventLogger.log(EventType.HANDOFF_FAILED, executionId, agent, target,
                    declaration.reason(), "unknown target");
                abort(session, chain);
                throw new AgentNotFoundException(target, registry.candidateNames(), chain, output);
            }

            CycleGuard.GuardResult guard = CycleGuard.evaluate(chain, agent, target, repeatTolerance);
            if (!guard.allowed()) {
                eventLogger.log(EventType.HANDOFF_REJECTED, executionId, agent, target,
                    declaration.reason(), guard.reason());
                return complete(ctx, session, agent, output, chain, steps, context,
                    CompletionReason.CYCLE_DETECTED, null, guard.reason(), startNanos);
            }

            if (chain.size() >= maxHandoffs) {
                eventLogger.log(EventType.HANDOFF_FAILED, executionId, agent, target,
                    declaration.reason(), "max handoffs " + maxHandoffs + " reached");
                abort(session, chain);
                throw new MaxHandoffsExceededException(agent, maxHandoffs, target, chain, output);
            }

            chain.add(new HandoffHistoryEntry(agent, target, declaration.reason(),
                contextSize(declaration), clock.instant()));
            context = mergeContext(context, declaration, agent, output);
            handoffReason = declaration.reason();
            current = target;

            session.setCurrentAgent(target);
            session.setVersion(registry.describe(target).version());
            session.setHandoffChain(List.copyOf(chain));
            session.setUpdatedAt(clock.instant());
            sessionStore.save(session);

            eventLogger.log(EventType.HANDOFF_COMPLETED, executionId, agent, target, declaration.reason(),
                "hop " + chain.size() + "/" + maxHandoffs);
        }
    }

    /**
     * New context for the next hop: previous entries, then the declared context (new keys win),
     * then the internal handoff metadata and the source agent's raw output.
     */
    static Map<String, Object> mergeContext(Map<String, Object> previous, HandoffDeclaration declaration,
                                            String fromAgent, String fromOutput) {
        Map<String, Object> merged = new LinkedHashMap<>(previous);
        merged.putAll(declaration.context());
        merged.put(PREVIOUS_AGENT_KEY, fromAgent);
        merged.put(HANDOFF_REASON_KEY, declaration.reason());
        merged.put(fromAgent + OUTPUT_KEY_SUFFIX, fromOutput);
        return merged;
    }

    /** Handoff analytics over every chain this orchestrator finished, aborted ones included. */
    public HandoffStats getHandoffStats() {
        synchronized (finishedChains) {
            return HandoffStatsCalculator.compute(List.copyOf(finishedChains));
        }
    }

    public int getMaxHandoffs() {
        return maxHandoffs;
    }

    private SwarmSession startSession(ExecutionContext ctx, String initialAgent, boolean handoffsEnabled) {
        SwarmSession session = new SwarmSession();
        session.setExecutionId(ctx.executionId());
        session.setInitialAgent(initialAgent);
        session.setCurrentAgent(initialAgent);
        session.setVersion(registry.describe(initialAgent).version());
        session.setState(SwarmState.RUNNING);
        session.setHandoffsEnabled(handoffsEnabled);
        session.setCreatedAt(ctx.createdAt());
        session.setUpdatedAt(clock.instant());
        sessionStore.save(session);
        return session;
    }

    private SwarmExecutionResult complete(ExecutionContext ctx, SwarmSession session, String finalAgent,
                                          String finalOutput, List<HandoffHistoryEntry> chain,
                                          List<AgentStep> steps, Map<String, Object> context,
                                          CompletionReason reason, HandoffDeclaration suppressed,
                                          String diagnostic, long startNanos) {
        session.setState(SwarmState.COMPLETE);
        session.setUpdatedAt(clock.instant());
        sessionStore.save(session);
        finishedChains.add(List.copyOf(chain));

        long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;
        TraceContextUtil.withMdc(ctx.executionId(), () ->
            log.info("[Swarm] execution complete finalAgent={} handoffs={} reason={} elapsedMs={}",
                     finalAgent, chain.size(), reason, elapsedMs));

        return new SwarmExecutionResult(
            ctx.executionId(),
            finalOutput,
            session.getInitialAgent(),
            finalAgent,
            List.copyOf(chain),
            reason,
            suppressed,
            diagnostic,
            List.copyOf(steps),
            Collections.unmodifiableMap(context),
            elapsedMs);
    }

    private void abort(SwarmSession session, List<HandoffHistoryEntry> chain) {
        session.setState(SwarmState.ABORTED);
        session.setHandoffChain(List.copyOf(chain));
        session.setUpdatedAt(clock.instant());
        sessionStore.save(session);
        finishedChains.add(List.copyOf(chain));
    }

    private int contextSize(HandoffDeclaration declaration) {
        try {
            return objectMapper.writeValueAsString(declaration.context()).getBytes(StandardCharsets.UTF_8).length;
        } catch (JsonProcessingException e) {
            return 0;
        }
    }
}
