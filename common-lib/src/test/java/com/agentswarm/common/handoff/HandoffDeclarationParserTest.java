package com.agentswarm.common.handoff;

import com.agentswarm.common.model.HandoffDeclaration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class HandoffDeclarationParserTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    private static final String WELL_FORMED = String.join("\n",
        "DNS records are configured for company.com.",
        "",
        "HANDOFF DECLARATION:",
        "To: azure_solutions_architect",
        "Reason: Azure Exchange Online configuration needed",
        "Context:",
        "  - Work completed: MX, SPF and DKIM records created",
        "  - Current state: DNS propagated",
        "  - Next steps: Configure the tenant",
        "  - Key data: {\"domain\": \"company.com\", \"records\": [\"MX\", \"SPF\"]}",
        "");

    @Nested
    @DisplayName("well-formed blocks")
    class WellFormed {

        @Test
        @DisplayName("target, reason and context are extracted")
        void fullBlock() {
            ParseResult result = HandoffDeclarationParser.parseResult(WELL_FORMED, NOW);

            assertEquals(ParseResult.Status.OK, result.status());
            HandoffDeclaration declaration = result.declaration();
            assertEquals("azure_solutions_architect", declaration.toAgent());
            assertEquals("Azure Exchange Online configuration needed", declaration.reason());
            assertEquals(NOW, declaration.createdAt());
            assertEquals("MX, SPF and DKIM records created", declaration.context().get("work_completed"));
            assertEquals("DNS propagated", declaration.context().get("current_state"));
            assertEquals("Configure the tenant", declaration.context().get("next_steps"));
        }

        @Test
        @DisplayName("JSON value in context is parsed into structured data")
        void keyDataParsedAsJson() {
            HandoffDeclaration declaration = HandoffDeclarationParser.parse(WELL_FORMED).orElseThrow();

            Object keyData = declaration.context().get("key_data");
            assertInstanceOf(Map.class, keyData);
            Map<?, ?> map = (Map<?, ?>) keyData;
            assertEquals("company.com", map.get("domain"));
            assertEquals(List.of("MX", "SPF"), map.get("records"));
        }

        @Test
        @DisplayName("invalid JSON value falls back to the raw string without invalidating the block")
        void invalidJsonKeptRaw() {
            String output = "HANDOFF DECLARATION:\nTo: sre_agent\nReason: check\nContext:\n"
                + "  - Key data: {not json\n  - Other: fine\n";

            HandoffDeclaration declaration = HandoffDeclarationParser.parse(output).orElseThrow();

            assertEquals("{not json", declaration.context().get("key_data"));
            assertEquals("fine", declaration.context().get("other"));
        }

        @Test
        @DisplayName("only To: present → empty reason and empty context")
        void minimalBlock() {
            HandoffDeclaration declaration =
                HandoffDeclarationParser.parse("HANDOFF DECLARATION:\nTo: security_agent").orElseThrow();

            assertEquals("security_agent", declaration.toAgent());
            assertEquals("", declaration.reason());
            assertTrue(declaration.context().isEmpty());
        }

        @Test
        @DisplayName("indented continuation line extends the previous value")
        void continuationLine() {
            String output = "HANDOFF DECLARATION:\nTo: sre_agent\nContext:\n"
                + "  - Work completed: first part\n      second part\n";

            HandoffDeclaration declaration = HandoffDeclarationParser.parse(output).orElseThrow();

            assertEquals("first part second part", declaration.context().get("work_completed"));
        }

        @Test
        @DisplayName("bullets without a key are collected under notes")
        void keylessBullets() {
            String output = "HANDOFF DECLARATION:\nTo: sre_agent\nContext:\n  - remember the firewall\n";

            HandoffDeclaration declaration = HandoffDeclarationParser.parse(output).orElseThrow();

            assertEquals(List.of("remember the firewall"), declaration.context().get(HandoffDeclarationParser.NOTES_KEY));
        }

        @Test
        @DisplayName("decorated target name is unwrapped")
        void decoratedTarget() {
            HandoffDeclaration declaration =
                HandoffDeclarationParser.parse("HANDOFF DECLARATION:\nTo: `dns_specialist`\n").orElseThrow();

            assertEquals("dns_specialist", declaration.toAgent());
        }

        @Test
        @DisplayName("blank lines between Context: and the first bullet are tolerated")
        void blankLineAfterContextHeader() {
            String output = "HANDOFF DECLARATION:\nTo: sre_agent\nReason: latency\nContext:\n\n"
                + "  - Work completed: traced the slow query\n  - Next steps: tune the pool\n\nThanks.\n";

            HandoffDeclaration declaration = HandoffDeclarationParser.parse(output).orElseThrow();

            assertEquals(Map.of("work_completed", "traced the slow query", "next_steps", "tune the pool"),
                declaration.context());
        }

        @Test
        @DisplayName("block ends at the first blank line after the context")
        void trailingProseIgnored() {
            String output = "HANDOFF DECLARATION:\nTo: sre_agent\nContext:\n  - Step: one\n\n"
                + "  - Later: should not be read\n";

            HandoffDeclaration declaration = HandoffDeclarationParser.parse(output).orElseThrow();

            assertEquals(Map.of("step", "one"), declaration.context());
        }
    }

    @Nested
    @DisplayName("absent and malformed")
    class Failures {

        @Test
        @DisplayName("no header → ABSENT")
        void noHeader() {
            ParseResult result = HandoffDeclarationParser.parseResult("All done. Task complete.");

            assertEquals(ParseResult.Status.ABSENT, result.status());
            assertTrue(HandoffDeclarationParser.parse("All done.").isEmpty());
        }

        @Test
        @DisplayName("null output → ABSENT")
        void nullOutput() {
            assertEquals(ParseResult.Status.ABSENT, HandoffDeclarationParser.parseResult(null).status());
        }

        @Test
        @DisplayName("header without To: → MALFORMED")
        void missingTo() {
            ParseResult result = HandoffDeclarationParser.parseResult("HANDOFF DECLARATION:\nReason: no target\n");

            assertEquals(ParseResult.Status.MALFORMED, result.status());
            assertNotNull(result.detail());
            assertTrue(result.asOptional().isEmpty());
        }

        @Test
        @DisplayName("target with spaces → MALFORMED")
        void invalidTargetName() {
            ParseResult result = HandoffDeclarationParser.parseResult("HANDOFF DECLARATION:\nTo: the azure team\n");

            assertEquals(ParseResult.Status.MALFORMED, result.status());
        }

        @Test
        @DisplayName("header is case-sensitive")
        void lowercaseHeader() {
            assertEquals(ParseResult.Status.ABSENT,
                HandoffDeclarationParser.parseResult("handoff declaration:\nTo: sre_agent\n").status());
        }
    }

    @Nested
    @DisplayName("multiple blocks")
    class MultipleBlocks {

        @Test
        @DisplayName("malformed first block is skipped, first well-formed block wins")
        void firstWellFormedWins() {
            String output = "HANDOFF DECLARATION:\nReason: forgot target\n\n"
                + "HANDOFF DECLARATION:\nTo: first_agent\n\n"
                + "HANDOFF DECLARATION:\nTo: second_agent\n";

            HandoffDeclaration declaration = HandoffDeclarationParser.parse(output).orElseThrow();

            assertEquals("first_agent", declaration.toAgent());
        }

        @Test
        @DisplayName("no well-formed block → MALFORMED of the first failure")
        void allMalformed() {
            String output = "HANDOFF DECLARATION:\nReason: forgot target\n\n"
                + "HANDOFF DECLARATION:\nTo: bad name here\n";

            ParseResult result = HandoffDeclarationParser.parseResult(output);

            assertEquals(ParseResult.Status.MALFORMED, result.status());
            assertTrue(result.detail().contains("To:"));
        }
    }

    @Test
    @DisplayName("keys are normalized to lower snake case")
    void normalizeKey() {
        assertEquals("work_completed", HandoffDeclarationParser.normalizeKey("Work completed"));
        assertEquals("next_steps", HandoffDeclarationParser.normalizeKey("  Next-Steps "));
    }

    @Test
    @DisplayName("parsing never throws on arbitrary text")
    void neverThrows() {
        List<String> inputs = List.of("", "HANDOFF DECLARATION:", "HANDOFF DECLARATION:\n\n\n",
            "HANDOFF DECLARATION:\nTo:\n", "HANDOFF DECLARATION:HANDOFF DECLARATION:\nTo: x\n");
        for (String input : inputs) {
            Optional<HandoffDeclaration> ignored = assertDoesNotThrow(() -> HandoffDeclarationParser.parse(input));
            assertNotNull(ignored);
        }
    }
}
