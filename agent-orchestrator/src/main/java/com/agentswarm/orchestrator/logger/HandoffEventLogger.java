package com.agentswarm.orchestrator.logger;

import com.agentswarm.common.trace.TraceContextUtil;
import com.agentswarm.orchestrator.logger.HandoffEvent.EventType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;

/**
 * Observability component for the handoff lifecycle.
 *
 * <p>Every event goes to the application log and is appended as one JSON line to the
 * event log file. All methods are pure side effects: a failed write is logged at WARN
 * and never reaches the hop loop.
 *
 * <p>Event types:
 * <ol>
 *   <li>{@link EventType#HANDOFF_TRIGGERED}  – an agent declared a handoff</li>
 *   <li>{@link EventType#HANDOFF_COMPLETED}  – the next agent was entered</li>
 *   <li>{@link EventType#HANDOFF_SUPPRESSED} – the feature flag is off, the declaration was ignored</li>
 *   <li>{@link EventType#HANDOFF_REJECTED}   – terminal agent or cycle, the chain stopped</li>
 *   <li>{@link EventType#HANDOFF_FAILED}     – unknown target or cap reached, the execution aborted</li>
 * </ol>
 */
public class HandoffEventLogger {

    private static final Logger log = LoggerFactory.getLogger(HandoffEventLogger.class);

    private final Path         eventFile;
    private final ObjectMapper objectMapper;
    private final Clock        clock;

    public HandoffEventLogger(Path eventFile, ObjectMapper objectMapper, Clock clock) {
        this.eventFile = eventFile;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public void log(EventType type, String executionId, String fromAgent, String toAgent,
                    String reason, String detail) {
        HandoffEvent event = new HandoffEvent(clock.instant(), type, executionId, fromAgent, toAgent, reason, detail);
        TraceContextUtil.withMdc(executionId, () ->
            log.info("[HandoffEvent] type={} from={} to={} reason={} detail={}",
                     type, fromAgent, toAgent, reason, detail));
        append(event);
    }

    private synchronized void append(HandoffEvent event) {
        try {
            Path parent = eventFile.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            String line = objectMapper.writeValueAsString(event) + System.lineSeparator();
            Files.writeString(eventFile, line, StandardCharsets.UTF_8,
                              StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            TraceContextUtil.withMdc(event.executionId(), () ->
                log.warn("[HandoffEvent] event log write failed path={} reason={}", eventFile, e.getMessage()));
        }
    }
}
