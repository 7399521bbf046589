package com.agentswarm.orchestrator.flag;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads runtime switches from the JSON preferences file. The file is re-read on every
 * query so toggling a flag needs no restart. Missing file, missing key or unreadable
 * content all mean "off".
 */
public class FeatureFlagStore {

    private static final Logger log = LoggerFactory.getLogger(FeatureFlagStore.class);

    public static final String HANDOFFS_ENABLED = "handoffs_enabled";

    private final Path         preferencesFile;
    private final ObjectMapper objectMapper;

    public FeatureFlagStore(Path preferencesFile, ObjectMapper objectMapper) {
        this.preferencesFile = preferencesFile;
        this.objectMapper = objectMapper;
    }

    public boolean handoffsEnabled() {
        return isEnabled(HANDOFFS_ENABLED);
    }

    public boolean isEnabled(String flag) {
        if (!Files.exists(preferencesFile)) {
            return false;
        }
        try {
            JsonNode node = objectMapper.readTree(preferencesFile.toFile()).get(flag);
            return node != null && node.isBoolean() && node.booleanValue();
        } catch (IOException e) {
            log.warn("[FeatureFlag] preferences unreadable, flag off. flag={} path={} reason={}",
                     flag, preferencesFile, e.getMessage());
            return false;
        }
    }
}
