package com.agentswarm.orchestrator.service;

import com.agentswarm.common.model.RoutingDecision;
import com.agentswarm.common.trace.TraceContextUtil;
import com.agentswarm.orchestrator.routing.AdaptiveRoutingController;
import com.agentswarm.orchestrator.session.ExecutionContext;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;

/**
 * Entry point for a task: asks the routing controller whether a specialized agent is
 * warranted and, if so, runs the swarm from the chosen agent.
 */
public class SwarmTaskService {

    private static final Logger log = LoggerFactory.getLogger(SwarmTaskService.class);

    private final AdaptiveRoutingController routingController;
    private final SwarmOrchestrator         orchestrator;
    private final Clock                     clock;

    public SwarmTaskService(AdaptiveRoutingController routingController, SwarmOrchestrator orchestrator, Clock clock) {
        this.routingController = routingController;
        this.orchestrator = orchestrator;
        this.clock = clock;
    }

    /**
     * @param execution null when the routing decision kept the task on the cheap path
     */
    public record TaskRun(
        @JsonProperty("execution_id") String               executionId,
        @JsonProperty("routing")      RoutingDecision      routing,
        @JsonProperty("execution")    SwarmExecutionResult execution
    ) {
        public boolean agentLoaded() {
            return execution != null;
        }
    }

    public TaskRun submit(String domain, int complexity, String initialAgent,
                          Map<String, Object> task, AgentInvoker invoker) {
        ExecutionContext ctx = ExecutionContext.create(clock);
        RoutingDecision routing = routingController.shouldLoadAgent(domain, complexity);
        TraceContextUtil.withMdc(ctx.executionId(), () ->
            log.info("[TaskRouting] domain={} complexity={} loadAgent={} reason={}",
                     domain, complexity, routing.loadAgent(), routing.reason()));
        if (!routing.loadAgent()) {
            return new TaskRun(ctx.executionId(), routing, null);
        }
        return new TaskRun(ctx.executionId(), routing, orchestrator.execute(ctx, initialAgent, task, invoker));
    }
}
