package com.agentswarm.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

/**
 * Carries the swarm execution id into log output.
 *
 * <p>In reactive request handling the Reactor Context holds the id. In the synchronous
 * hop loop it is passed explicitly through the execution context. Either way MDC is
 * written only for the duration of a single log statement and cleared afterwards, so
 * no execution id can leak onto another request sharing the thread.
 *
 * <pre>
 *     TraceContextUtil.withMdc(ctx.executionId(), () -&gt; log.info("[Swarm] hop ..."));
 * </pre>
 */
public final class TraceContextUtil {

    public static final String EXECUTION_ID_KEY = "executionId";
    public static final String UNKNOWN          = "unknown";

    private TraceContextUtil() {}

    /**
     * Stores {@code executionId} in the Reactor Context of {@code mono}. Call at the end
     * of pipeline assembly: {@code contextWrite} propagates upstream.
     */
    public static <T> Mono<T> withExecutionId(Mono<T> mono, String executionId) {
        return mono.contextWrite(ctx -> ctx.put(EXECUTION_ID_KEY, executionId));
    }

    /** Execution id from the Reactor context, {@value #UNKNOWN} when absent. Never null. */
    public static String getExecutionId(ContextView ctx) {
        return ctx.getOrDefault(EXECUTION_ID_KEY, UNKNOWN);
    }

    /**
     * Bridges {@code executionId} into MDC while {@code logAction} runs, then removes it.
     * Only use inside logging side effects.
     */
    public static void withMdc(String executionId, Runnable logAction) {
        MDC.put(EXECUTION_ID_KEY, executionId == null ? UNKNOWN : executionId);
        try {
            logAction.run();
        } finally {
            MDC.remove(EXECUTION_ID_KEY);
        }
    }
}
