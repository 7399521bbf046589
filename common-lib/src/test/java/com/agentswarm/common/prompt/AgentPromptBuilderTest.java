package com.agentswarm.common.prompt;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AgentPromptBuilderTest {

    private static final String PROMPT = "# DNS Specialist\nYou configure DNS.";

    @Test
    @DisplayName("no context and no reason → prompt unchanged")
    void nothingToInject() {
        assertEquals(PROMPT, AgentPromptBuilder.injectContext(PROMPT, Map.of()));
        assertEquals(PROMPT, AgentPromptBuilder.injectContext(PROMPT, null, null));
    }

    @Test
    @DisplayName("context block is delimited and appended after the descriptor")
    void delimitedBlock() {
        String result = AgentPromptBuilder.injectContext(PROMPT, Map.of("domain", "company.com"), "DNS done");

        assertTrue(result.startsWith(PROMPT));
        int start = result.indexOf(AgentPromptBuilder.CONTEXT_START);
        int end = result.indexOf(AgentPromptBuilder.CONTEXT_END);
        assertTrue(start > 0 && end > start);
        String block = result.substring(start, end);
        assertTrue(block.contains("Handoff reason: DNS done"));
        assertTrue(block.contains("domain: company.com"));
    }

    @Test
    @DisplayName("maps and lists are pretty-printed as JSON")
    void structuredValuesPretty() {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("records", List.of("MX", "SPF"));
        context.put("key_data", Map.of("ttl", 300));

        String result = AgentPromptBuilder.injectContext(PROMPT, context);

        assertTrue(result.contains("\"MX\""));
        assertTrue(result.contains("\"ttl\" : 300"));
    }

    @Test
    @DisplayName("internal keys are hidden from the block but stay in the map")
    void internalKeysOmitted() {
        Map<String, Object> context = new HashMap<>();
        context.put("_previous_agent", "dns_specialist");
        context.put("visible", "yes");

        String result = AgentPromptBuilder.injectContext(PROMPT, context);

        assertFalse(result.contains("_previous_agent"));
        assertTrue(result.contains("visible: yes"));
        assertEquals("dns_specialist", context.get("_previous_agent"));
    }

    @Test
    @DisplayName("only internal keys and no reason → prompt unchanged")
    void onlyInternalKeys() {
        assertEquals(PROMPT, AgentPromptBuilder.injectContext(PROMPT, Map.of("_handoff_reason", "x")));
    }
}
