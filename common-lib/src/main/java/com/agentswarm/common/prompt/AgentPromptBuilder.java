package com.agentswarm.common.prompt;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.Collection;
import java.util.Map;

/**
 * Builds an invocable prompt from raw descriptor text plus the context that
 * previous agents surfaced.
 *
 * <p>The context block is appended after the descriptor, delimited by
 * {@value #CONTEXT_START} and {@value #CONTEXT_END}. Map and collection values are
 * pretty-printed as JSON. Keys starting with {@value #INTERNAL_KEY_PREFIX} are internal
 * metadata: omitted from the rendered block, still present in the map.
 *
 * <p>Pure: the inputs are never mutated.
 */
public final class AgentPromptBuilder {

    public static final String CONTEXT_START       = "--- CONTEXT FROM PREVIOUS AGENTS ---";
    public static final String CONTEXT_END         = "--- END CONTEXT ---";
    public static final String INTERNAL_KEY_PREFIX = "_";

    private static final ObjectMapper JSON = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .enable(SerializationFeature.INDENT_OUTPUT);

    private AgentPromptBuilder() {}

    public static String injectContext(String agentPrompt, Map<String, ?> context) {
        return injectContext(agentPrompt, context, null);
    }

    /**
     * @param agentPrompt   raw descriptor text
     * @param context       accumulated context (may be null or empty)
     * @param handoffReason reason the previous agent gave, or null for the first agent
     * @return a new prompt string; the descriptor text itself when there is nothing to inject
     */
    public static String injectContext(String agentPrompt, Map<String, ?> context, String handoffReason) {
        boolean hasReason = handoffReason != null && !handoffReason.isBlank();
        boolean hasVisibleContext = context != null && context.keySet().stream().anyMatch(k -> !isInternal(k));
        if (!hasReason && !hasVisibleContext) {
            return agentPrompt;
        }

        StringBuilder sb = new StringBuilder(agentPrompt == null ? "" : agentPrompt);
        sb.append("\n\n").append(CONTEXT_START).append('\n');
        if (hasReason) {
            sb.append("Handoff reason: ").append(handoffReason.trim()).append('\n');
        }
        if (hasVisibleContext) {
            for (Map.Entry<String, ?> entry : context.entrySet()) {
                if (isInternal(entry.getKey())) {
                    continue;
                }
                sb.append(entry.getKey()).append(": ").append(render(entry.getValue())).append('\n');
            }
        }
        sb.append(CONTEXT_END).append('\n');
        return sb.toString();
    }

    public static boolean isInternal(String key) {
        return key == null || key.startsWith(INTERNAL_KEY_PREFIX);
    }

    private static String render(Object value) {
        if (value instanceof Map<?, ?> || value instanceof Collection<?> || (value != null && value.getClass().isArray())) {
            try {
                return "\n" + JSON.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                return String.valueOf(value);
            }
        }
        return String.valueOf(value);
    }
}
