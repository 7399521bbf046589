package com.agentswarm.common.prompt;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Metadata extraction from agent descriptor text and file names.
 *
 * <ul>
 *   <li>{@link #normalizeName} – {@code dns_specialist_agent_v2} to {@code dns_specialist}.</li>
 *   <li>{@link #detectVersion} – {@code v2} for {@code *_v2}, {@code base} when unmarked.</li>
 *   <li>{@link #checkHandoffCapability} – Integration Points heading AND the declaration keyword.</li>
 *   <li>{@link #extractSpecialties} – bold bullet items of the Specialties / Core Capabilities / Expertise section.</li>
 *   <li>{@link #extractPurpose} – the {@code **Purpose**:} line.</li>
 * </ul>
 *
 * <p>This class is stateless, pure, and thread-safe.
 */
public final class DescriptorMetadata {

    public static final String INTEGRATION_POINTS_HEADING = "## Integration Points";
    public static final String HANDOFF_KEYWORD            = "HANDOFF DECLARATION";
    public static final String BASE_VERSION               = "base";
    public static final int    MAX_SPECIALTIES            = 10;

    private static final Pattern VERSION_SUFFIX = Pattern.compile("_(v\\d+)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern AGENT_SUFFIX   = Pattern.compile("_agent$", Pattern.CASE_INSENSITIVE);

    private static final Pattern SPECIALTY_SECTION = Pattern.compile(
        "^##\\s+(?:Specialt(?:ies|y)|Core Capabilities|Expertise)\\s*$(.*?)(?=^##\\s|\\z)",
        Pattern.CASE_INSENSITIVE | Pattern.MULTILINE | Pattern.DOTALL);
    private static final Pattern BOLD_BULLET = Pattern.compile("^\\s*[-*]\\s+\\*\\*([^*]+)\\*\\*", Pattern.MULTILINE);
    private static final Pattern PURPOSE     = Pattern.compile("\\*\\*Purpose\\*\\*:\\s*([^\\n]+)", Pattern.CASE_INSENSITIVE);

    private DescriptorMetadata() {}

    public static String normalizeName(String fileStem) {
        String name = VERSION_SUFFIX.matcher(fileStem).replaceFirst("");
        name = AGENT_SUFFIX.matcher(name).replaceFirst("");
        return name.toLowerCase(Locale.ROOT);
    }

    public static String detectVersion(String fileStem) {
        Matcher m = VERSION_SUFFIX.matcher(fileStem);
        return m.find() ? m.group(1).toLowerCase(Locale.ROOT) : BASE_VERSION;
    }

    /**
     * An agent may legally terminate with a handoff only when its descriptor documents
     * both the integration section and the declaration protocol.
     */
    public static boolean checkHandoffCapability(String descriptorText) {
        return descriptorText != null
            && descriptorText.contains(INTEGRATION_POINTS_HEADING)
            && descriptorText.contains(HANDOFF_KEYWORD);
    }

    public static List<String> extractSpecialties(String descriptorText) {
        if (descriptorText == null) {
            return List.of();
        }
        Matcher section = SPECIALTY_SECTION.matcher(descriptorText);
        if (!section.find()) {
            return List.of();
        }
        List<String> specialties = new ArrayList<>();
        Matcher bullet = BOLD_BULLET.matcher(section.group(1));
        while (bullet.find() && specialties.size() < MAX_SPECIALTIES) {
            specialties.add(bullet.group(1).trim());
        }
        return List.copyOf(specialties);
    }

    public static String extractPurpose(String descriptorText) {
        if (descriptorText == null) {
            return "";
        }
        Matcher m = PURPOSE.matcher(descriptorText);
        return m.find() ? m.group(1).trim() : "";
    }
}
