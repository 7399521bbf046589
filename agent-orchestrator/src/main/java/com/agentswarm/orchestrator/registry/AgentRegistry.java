package com.agentswarm.orchestrator.registry;

import com.agentswarm.common.exception.AgentNotFoundException;
import com.agentswarm.common.exception.AgentRegistryException;
import com.agentswarm.common.model.AgentDescriptor;
import com.agentswarm.common.prompt.AgentPromptBuilder;
import com.agentswarm.common.prompt.DescriptorMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Catalog of the agents available to the swarm, built from the {@code *.md} descriptors
 * of one directory.
 *
 * <p>The directory is scanned once on construction; the resulting map is immutable.
 * Descriptor text is read on each {@link #load} so edits to a prompt apply without
 * a rescan.
 */
public class AgentRegistry {

    private static final Logger log = LoggerFactory.getLogger(AgentRegistry.class);

    public static final int MAX_CANDIDATES = 10;

    private final Path                         agentsDir;
    private final Map<String, AgentDescriptor> agents;

    public AgentRegistry(Path agentsDir) {
        this.agentsDir = agentsDir;
        this.agents = scan(agentsDir);
        log.info("[AgentRegistry] scanned dir={} agents={} handoffCapable={}",
                 agentsDir, agents.size(), handoffCapableCount());
    }

    private static Map<String, AgentDescriptor> scan(Path dir) {
        if (!Files.isDirectory(dir)) {
            log.warn("[AgentRegistry] agents directory missing, registry empty. dir={}", dir);
            return Map.of();
        }
        Map<String, AgentDescriptor> found = new TreeMap<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(dir, "*.md")) {
            for (Path file : files) {
                String stem = file.getFileName().toString();
                stem = stem.substring(0, stem.length() - ".md".length());
                String name = DescriptorMetadata.normalizeName(stem);
                String text = read(name, file);

                AgentDescriptor descriptor = new AgentDescriptor(
                    name,
                    DescriptorMetadata.detectVersion(stem),
                    file,
                    DescriptorMetadata.checkHandoffCapability(text),
                    DescriptorMetadata.extractSpecialties(text),
                    DescriptorMetadata.extractPurpose(text));

                AgentDescriptor previous = found.putIfAbsent(name, descriptor);
                if (previous != null) {
                    throw new AgentRegistryException(name, String.format(
                        "Descriptor name collision: %s and %s", previous.path().getFileName(), file.getFileName()));
                }
            }
        } catch (IOException e) {
            throw new AgentRegistryException("registry", "Cannot scan agents directory " + dir, e);
        }
        return Collections.unmodifiableMap(found);
    }

    private static String read(String name, Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new AgentRegistryException(name, "Cannot read descriptor " + file, e);
        }
    }

    /** Full descriptor text of {@code name}. */
    public String load(String name) {
        return read(name, describe(name).path());
    }

    public AgentDescriptor describe(String name) {
        AgentDescriptor descriptor = agents.get(name);
        if (descriptor == null) {
            throw new AgentNotFoundException(name, candidateNames());
        }
        return descriptor;
    }

    public Optional<AgentDescriptor> find(String name) {
        return Optional.ofNullable(agents.get(name));
    }

    public boolean contains(String name) {
        return agents.containsKey(name);
    }

    /** All agent names, alphabetical. */
    public List<String> agentNames() {
        return List.copyOf(agents.keySet());
    }

    public List<AgentDescriptor> descriptors() {
        return List.copyOf(agents.values());
    }

    /** First {@value #MAX_CANDIDATES} names alphabetically, as listed in not-found errors. */
    public List<String> candidateNames() {
        return agents.keySet().stream().limit(MAX_CANDIDATES).collect(Collectors.toList());
    }

    /**
     * Descriptor text with the accumulated context injected.
     *
     * @param handoffReason reason given by the previous agent, null for the initial agent
     */
    public String buildPrompt(String name, Map<String, ?> context, String handoffReason) {
        return AgentPromptBuilder.injectContext(load(name), context, handoffReason);
    }

    public boolean checkHandoffCapability(String name) {
        return describe(name).supportsHandoff();
    }

    /** Agents whose specialties or purpose mention {@code text}, case-insensitive. */
    public List<AgentDescriptor> findBySpecialty(String text) {
        String needle = text.toLowerCase(Locale.ROOT);
        return agents.values().stream()
            .filter(d -> d.purpose().toLowerCase(Locale.ROOT).contains(needle)
                || d.specialties().stream().anyMatch(s -> s.toLowerCase(Locale.ROOT).contains(needle)))
            .collect(Collectors.toList());
    }

    public Map<String, Object> getStats() {
        Map<String, Object> stats = new HashMap<>();
        stats.put("agents_dir", agentsDir.toString());
        stats.put("total_agents", agents.size());
        stats.put("handoff_capable", handoffCapableCount());
        stats.put("versions", agents.values().stream()
            .collect(Collectors.groupingBy(AgentDescriptor::version, TreeMap::new, Collectors.counting())));
        return stats;
    }

    private long handoffCapableCount() {
        return agents.values().stream().filter(AgentDescriptor::supportsHandoff).count();
    }
}
