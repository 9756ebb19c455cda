package com.swarmverify.resolution.service;

import com.swarmverify.common.model.AgentResult;
import com.swarmverify.common.model.Outcome;
import com.swarmverify.common.model.SanitizedMarket;
import com.swarmverify.resolution.agent.AgentRole;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AgentDispatchServiceTest {

    private static final SanitizedMarket MARKET =
        new SanitizedMarket("m1", "title", "description", "category", LocalDate.of(2026, 2, 20));
    private static final Duration TIMEOUT = Duration.ofMillis(200);

    private final AgentDispatchService dispatch =
        new AgentDispatchService(Clock.fixed(ScriptedAgent.NOW, ZoneOffset.UTC));

    @Test
    @DisplayName("results keep fan-out order regardless of completion order")
    void preservesOrder() {
        ScriptedAgent slow = new ScriptedAgent("slow", AgentRole.RESEARCH, 40, true,
            prior -> Mono.just(AgentResult.of("slow", Outcome.YES, 80, "", List.of(), ScriptedAgent.NOW))
                .delayElement(Duration.ofMillis(80)));
        ScriptedAgent fast = ScriptedAgent.voting("fast", AgentRole.FACT_CHECKER, Outcome.NO, 60, "");

        List<AgentResult> results = dispatch.dispatchAll(List.of(slow, fast), MARKET, TIMEOUT).block();

        assertEquals(List.of("slow", "fast"), results.stream().map(AgentResult::agent).toList());
    }

    @Test
    void timeoutDegradesWithAgentsOwnConfidence() {
        ScriptedAgent hanging = new ScriptedAgent("skeptic", AgentRole.SKEPTIC, 45, true, prior -> Mono.never());

        AgentResult result = dispatch.invoke(hanging, MARKET, List.of(), Duration.ofMillis(50)).block();

        assertEquals("skeptic", result.agent());
        assertEquals(Outcome.AMBIGUOUS, result.outcome());
        assertEquals(45, result.confidence());
        assertEquals(AgentDispatchService.TIMEOUT_RATIONALE, result.rationale());
        assertEquals("Agent timeout after 50ms", result.error());
    }

    @Test
    void synchronousThrowDegrades() {
        ScriptedAgent throwing = new ScriptedAgent("research", AgentRole.RESEARCH, 40, true, prior -> {
            throw new IllegalStateException("parser exploded");
        });

        AgentResult result = dispatch.invoke(throwing, MARKET, List.of(), TIMEOUT).block();

        assertEquals(40, result.confidence());
        assertEquals(AgentDispatchService.FAILURE_RATIONALE, result.rationale());
        assertEquals("parser exploded", result.error());
    }

    @Test
    void emptyPublisherDegrades() {
        ScriptedAgent silent = new ScriptedAgent("research", AgentRole.RESEARCH, 40, true, prior -> Mono.empty());

        AgentResult result = dispatch.invoke(silent, MARKET, List.of(), TIMEOUT).block();

        assertTrue(result.isDegraded());
        assertEquals("Agent research completed without a result", result.error());
    }

    @Test
    void degradedCrossCheckCarriesCrossCheckName() {
        ScriptedAgent hanging = new ScriptedAgent("skeptic", AgentRole.SKEPTIC, 45, true, prior -> Mono.never());
        AgentResult prior = AgentResult.of("research", Outcome.YES, 80, "", List.of(), ScriptedAgent.NOW);

        AgentResult result = dispatch.invoke(hanging, MARKET, List.of(prior), Duration.ofMillis(50)).block();

        assertEquals("skeptic-cross-check", result.agent());
    }
}
