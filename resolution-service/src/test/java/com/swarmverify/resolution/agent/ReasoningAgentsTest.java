package com.swarmverify.resolution.agent;

import com.swarmverify.common.model.AgentResult;
import com.swarmverify.common.model.Outcome;
import com.swarmverify.common.model.SanitizedMarket;
import com.swarmverify.resolution.ai.StubReasoningClient;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReasoningAgentsTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);
    private static final SanitizedMarket MARKET = new SanitizedMarket(
        "m1", "Will event X occur by date D", "Resolves YES if X happens.", "world", LocalDate.of(2026, 2, 20));

    private static final String WELL_FORMED = """
        OUTCOME: YES
        CONFIDENCE: 88
        RATIONALE: Official records show X happened.
        SOURCES: https://example.org/a https://example.org/b""";

    // ── research ──────────────────────────────────────────────────────────

    @Nested
    @DisplayName("research agent")
    class Research {

        @Test
        void parsesWellFormedResponse() {
            StubReasoningClient client = StubReasoningClient.replying(WELL_FORMED);

            AgentResult result = new ResearchAgent(client, CLOCK).evaluate(MARKET, List.of()).block();

            assertEquals("research", result.agent());
            assertEquals(Outcome.YES, result.outcome());
            assertEquals(88, result.confidence());
            assertEquals("Official records show X happened.", result.rationale());
            assertEquals(List.of("https://example.org/a", "https://example.org/b"), result.sources());
            assertEquals(NOW, result.timestamp());
            assertNull(result.error());
        }

        @Test
        void promptCarriesMarketFields() {
            StubReasoningClient client = StubReasoningClient.replying(WELL_FORMED);

            new ResearchAgent(client, CLOCK).evaluate(MARKET, List.of()).block();

            String prompt = client.lastCall().prompt();
            assertTrue(prompt.contains("Market Title: \"Will event X occur by date D\""));
            assertTrue(prompt.contains("Resolution Date: 2026-02-20"));
            assertTrue(client.lastCall().systemInstruction().contains("OUTCOME: YES|NO|AMBIGUOUS"));
            assertEquals(0.3, client.lastCall().config().temperature());
        }

        @Test
        @DisplayName("missing confidence falls back to 65")
        void defaultConfidence() {
            AgentResult result = new ResearchAgent(StubReasoningClient.replying("OUTCOME: NO"), CLOCK)
                .evaluate(MARKET, List.of()).block();

            assertEquals(Outcome.NO, result.outcome());
            assertEquals(65, result.confidence());
        }

        @Test
        @DisplayName("backend failure degrades to AMBIGUOUS/40")
        void backendFailure() {
            AgentResult result = new ResearchAgent(StubReasoningClient.failing(new IllegalStateException("boom")), CLOCK)
                .evaluate(MARKET, List.of()).block();

            assertEquals(Outcome.AMBIGUOUS, result.outcome());
            assertEquals(40, result.confidence());
            assertEquals("boom", result.error());
            assertEquals("research", result.agent());
        }
    }

    // ── skeptic ───────────────────────────────────────────────────────────

    @Nested
    @DisplayName("skeptic agent")
    class Skeptic {

        @Test
        @DisplayName("blind run defaults to AMBIGUOUS/50")
        void blindDefaults() {
            AgentResult result = new SkepticAgent(StubReasoningClient.replying("I have doubts."), CLOCK)
                .evaluate(MARKET, List.of()).block();

            assertEquals("skeptic", result.agent());
            assertEquals(Outcome.AMBIGUOUS, result.outcome());
            assertEquals(50, result.confidence());
        }

        @Test
        void crossCheckSummarisesFindings() {
            StubReasoningClient client = StubReasoningClient.replying("OUTCOME: YES\nCONFIDENCE: 75");
            AgentResult research = AgentResult.of("research", Outcome.YES, 88, "r".repeat(400), List.of(), NOW);
            AgentResult fact = AgentResult.of("web-fact-checker", Outcome.AMBIGUOUS, 45, "few hits", List.of(), NOW);

            AgentResult result = new SkepticAgent(client, CLOCK).evaluate(MARKET, List.of(research, fact)).block();

            assertEquals(SkepticAgent.CROSS_CHECK_NAME, result.agent());
            assertEquals(75, result.confidence());
            String prompt = client.lastCall().prompt();
            assertTrue(prompt.contains("OTHER AGENTS' FINDINGS"));
            assertTrue(prompt.contains("Agent 1 (research):"));
            assertTrue(prompt.contains("- Confidence: 88%"));
            assertTrue(prompt.contains("Agent 2 (web-fact-checker):"));
            assertTrue(prompt.contains("r".repeat(300)));
            assertFalse(prompt.contains("r".repeat(301)));
        }

        @Test
        @DisplayName("failure degrades to AMBIGUOUS/45")
        void failure() {
            AgentResult result = new SkepticAgent(StubReasoningClient.failing(new IllegalStateException("quota")), CLOCK)
                .evaluate(MARKET, List.of()).block();

            assertEquals(45, result.confidence());
            assertTrue(result.isDegraded());
        }
    }

    // ── investigator ──────────────────────────────────────────────────────

    @Nested
    @DisplayName("investigator agent")
    class Investigator {

        @Test
        void unavailableWithoutCredentials() {
            assertFalse(new InvestigatorAgent(StubReasoningClient.unconfigured(), CLOCK).isAvailable());
        }

        @Test
        void usesSearchGroundingAndDefaults() {
            String response = "After searching, the outcome is unclear. " + "x".repeat(400);
            StubReasoningClient client = StubReasoningClient.replying(response);

            AgentResult result = new InvestigatorAgent(client, CLOCK).evaluate(MARKET, List.of()).block();

            assertTrue(client.lastCall().config().searchGrounding());
            assertEquals("investigator", result.agent());
            assertEquals(Outcome.AMBIGUOUS, result.outcome());
            assertEquals(55, result.confidence());
            assertEquals(300, result.rationale().length());
            assertTrue(response.startsWith(result.rationale()));
        }
    }
}
