package com.agentswarm.common.handoff;

import com.agentswarm.common.model.HandoffDeclaration;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Extracts at most one {@link HandoffDeclaration} from an agent's free-text output.
 *
 * <h3>Accepted grammar</h3>
 * <pre>
 *   HANDOFF DECLARATION:
 *   To: &lt;agent_name&gt;                 (required, first non-blank line)
 *   Reason: &lt;free text&gt;              (optional)
 *   Context:                          (optional)
 *     - Work completed: &lt;text&gt;
 *     - Key data: {"k": "v"}          (JSON values parsed when well-formed)
 * </pre>
 *
 * <p>A block ends at the first blank line after {@code To:}, at the next header or at
 * the end of the text. Context keys are normalized to lower snake case; bullets
 * without a key are collected under {@value #NOTES_KEY}; indented lines without a
 * bullet continue the previous value.
 *
 * <p>When the output carries several blocks the first well-formed one wins. The
 * parser never throws.
 *
 * <p>This class is stateless, pure, and thread-safe.
 */
public final class HandoffDeclarationParser {

    public static final String HEADER    = "HANDOFF DECLARATION:";
    public static final String NOTES_KEY = "notes";

    private static final String TO_PREFIX      = "To:";
    private static final String REASON_PREFIX  = "Reason:";
    private static final String CONTEXT_PREFIX = "Context:";

    private static final Pattern AGENT_NAME = Pattern.compile("[A-Za-z0-9_.\\-]+");

    private static final ObjectMapper JSON =
        new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private HandoffDeclarationParser() {}

    /** Convenience form: the declaration if one is well-formed, otherwise empty. */
    public static Optional<HandoffDeclaration> parse(String agentOutput) {
        return parseResult(agentOutput, Instant.now()).asOptional();
    }

    public static ParseResult parseResult(String agentOutput) {
        return parseResult(agentOutput, Instant.now());
    }

    /**
     * @param agentOutput raw agent output (may be null)
     * @param now         creation timestamp stamped on the declaration
     * @return the tagged parse outcome; never {@code null}
     */
    public static ParseResult parseResult(String agentOutput, Instant now) {
        if (agentOutput == null || !agentOutput.contains(HEADER)) {
            return ParseResult.absent();
        }

        String normalized = agentOutput.replace("\r\n", "\n");
        ParseResult firstFailure = null;

        int start = normalized.indexOf(HEADER);
        while (start >= 0) {
            int bodyStart = start + HEADER.length();
            int next      = normalized.indexOf(HEADER, bodyStart);
            String body   = next >= 0 ? normalized.substring(bodyStart, next) : normalized.substring(bodyStart);

            ParseResult result = parseBlock(body, now);
            if (result.isOk()) {
                return result;
            }
            if (firstFailure == null) {
                firstFailure = result;
            }
            start = next;
        }
        return firstFailure;
    }

    private static ParseResult parseBlock(String body, Instant now) {
        String[] lines = body.split("\n", -1);

        if (!lines[0].isBlank()) {
            return ParseResult.malformed("unexpected text after header: '" + lines[0].trim() + "'");
        }

        int i = 1;
        while (i < lines.length && lines[i].isBlank()) {
            i++;
        }
        if (i >= lines.length || !lines[i].trim().startsWith(TO_PREFIX)) {
            return ParseResult.malformed("missing 'To:' line");
        }

        String toAgent = stripDecoration(lines[i].trim().substring(TO_PREFIX.length()));
        if (!AGENT_NAME.matcher(toAgent).matches()) {
            return ParseResult.malformed("invalid target agent name: '" + toAgent + "'");
        }

        String reason = null;
        boolean inContext = false;
        Map<String, Object> context = new LinkedHashMap<>();
        List<String> notes = new ArrayList<>();
        String currentKey = null;

        for (i = i + 1; i < lines.length; i++) {
            String raw  = lines[i];
            String line = raw.trim();
            if (line.isEmpty()) {
                // blank lines between "Context:" and its first bullet belong to the block
                if (inContext && context.isEmpty() && notes.isEmpty()) {
                    continue;
                }
                break;
            }
            if (!inContext && line.startsWith(REASON_PREFIX)) {
                if (reason == null) {
                    reason = line.substring(REASON_PREFIX.length()).trim();
                }
                continue;
            }
            if (line.startsWith(CONTEXT_PREFIX)) {
                inContext = true;
                currentKey = null;
                continue;
            }
            if (!inContext) {
                continue;
            }

            if (line.startsWith("- ") || line.startsWith("* ")) {
                String entry = line.substring(2).trim();
                int colon = entry.indexOf(':');
                if (colon > 0) {
                    currentKey = normalizeKey(entry.substring(0, colon));
                    context.put(currentKey, entry.substring(colon + 1).trim());
                } else if (!entry.isEmpty()) {
                    notes.add(entry);
                    currentKey = null;
                }
            } else if (currentKey != null && context.get(currentKey) instanceof String previous) {
                context.put(currentKey, previous.isEmpty() ? line : previous + " " + line);
            }
        }

        context.replaceAll((key, value) -> value instanceof String s ? parseStructured(s) : value);
        if (!notes.isEmpty()) {
            context.putIfAbsent(NOTES_KEY, List.copyOf(notes));
        }

        return ParseResult.ok(new HandoffDeclaration(toAgent, reason == null ? "" : reason, context, now));
    }

    /** JSON object/array values are parsed; anything unparsable is kept verbatim. */
    private static Object parseStructured(String value) {
        if (!(value.startsWith("{") || value.startsWith("["))) {
            return value;
        }
        try {
            return JSON.readValue(value, Object.class);
        } catch (JsonProcessingException e) {
            return value;
        }
    }

    static String normalizeKey(String key) {
        return key.trim()
            .toLowerCase(Locale.ROOT)
            .replaceAll("[^a-z0-9]+", "_")
            .replaceAll("^_+|_+$", "");
    }

    private static String stripDecoration(String value) {
        return value.trim().replaceAll("^[`*\"']+|[`*\"']+$", "");
    }
}
