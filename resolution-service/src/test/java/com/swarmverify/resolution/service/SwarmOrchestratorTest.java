package com.swarmverify.resolution.service;

import com.swarmverify.common.consensus.GeometricMedianConsensusStrategy;
import com.swarmverify.common.exception.ReasoningBackendUnavailableException;
import com.swarmverify.common.model.AgentResult;
import com.swarmverify.common.model.AgentVote;
import com.swarmverify.common.model.Market;
import com.swarmverify.common.model.Outcome;
import com.swarmverify.common.model.Resolution;
import com.swarmverify.common.model.ResolutionPath;
import com.swarmverify.common.routing.ConfidenceRouter;
import com.swarmverify.resolution.agent.AgentRole;
import com.swarmverify.resolution.agent.ResolutionAgent;
import com.swarmverify.resolution.ai.ReasoningClient;
import com.swarmverify.resolution.ai.StubReasoningClient;
import com.swarmverify.resolution.config.SwarmSettings;
import com.swarmverify.resolution.logger.ResolutionFlowLogger;
import com.swarmverify.resolution.scoring.FactualScorer;
import com.swarmverify.resolution.scoring.MultiDimensionalScorer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SwarmOrchestratorTest {

    private static final Clock CLOCK = Clock.fixed(ScriptedAgent.NOW, ZoneOffset.UTC);
    private static final String RATIONALE = "Official records show the event took place.";
    private static final Market MARKET = Market.of("m1", "Will event X occur by date D",
        "Resolves YES if X happens before D.", "world", LocalDate.of(2026, 2, 20));

    private static SwarmOrchestrator orchestrator(ReasoningClient client, List<ResolutionAgent> agents,
                                                  SwarmSettings settings) {
        return new SwarmOrchestrator(
            client,
            agents,
            new AgentDispatchService(CLOCK),
            new GeometricMedianConsensusStrategy(),
            new MultiDimensionalScorer(new FactualScorer(client, settings), settings, CLOCK),
            new ConfidenceRouter(),
            new ResolutionFlowLogger(),
            settings,
            CLOCK);
    }

    /** Blind skeptic votes YES/70; the cross-check re-run votes YES/75. */
    private static ScriptedAgent skeptic() {
        return new ScriptedAgent("skeptic", AgentRole.SKEPTIC, 45, true, prior -> prior.isEmpty()
            ? Mono.just(AgentResult.of("skeptic", Outcome.YES, 70, RATIONALE, List.of(), ScriptedAgent.NOW))
            : Mono.just(AgentResult.of("skeptic-cross-check", Outcome.YES, 75, RATIONALE, List.of(), ScriptedAgent.NOW)));
    }

    // ── end-to-end ────────────────────────────────────────────────────────

    @Nested
    @DisplayName("end-to-end scenario")
    class EndToEnd {

        private final ScriptedAgent research =
            ScriptedAgent.voting("research", AgentRole.RESEARCH, Outcome.YES, 88, RATIONALE);
        private final ScriptedAgent skeptic = skeptic();
        private final ScriptedAgent factChecker =
            ScriptedAgent.voting("web-fact-checker", AgentRole.FACT_CHECKER, Outcome.AMBIGUOUS, 45, "Found 0 indicators.");
        private final ScriptedAgent investigator = ScriptedAgent.unavailable("investigator", AgentRole.INVESTIGATOR);

        private Resolution resolve() {
            SwarmOrchestrator orchestrator = orchestrator(StubReasoningClient.replying("SCORE: 80"),
                List.of(research, skeptic, factChecker, investigator), SwarmSettings.defaults());
            return orchestrator.resolve(MARKET).block();
        }

        @Test
        @DisplayName("YES wins with the geometric median of [88, 70, 75]")
        void consensus() {
            Resolution resolution = resolve();

            assertEquals("m1", resolution.marketId());
            assertEquals(Outcome.YES, resolution.outcome());
            assertEquals(75, resolution.scoringDetails().originalConfidence());
            assertEquals(3, resolution.agentVotes().get(Outcome.YES));
            assertEquals(0, resolution.agentVotes().get(Outcome.NO));
            assertEquals(1, resolution.agentVotes().get(Outcome.AMBIGUOUS));
        }

        @Test
        @DisplayName("scoring blend 80/100/100/100 routes to auto-resolve at 91")
        void scoredAndRouted() {
            Resolution resolution = resolve();

            assertEquals(80, resolution.scoringDetails().factual());
            assertEquals(100, resolution.scoringDetails().consistency());
            assertEquals(100, resolution.scoringDetails().timestamp());
            assertEquals(100, resolution.scoringDetails().sentiment());
            assertEquals(91, resolution.confidence());
            assertEquals(ResolutionPath.AUTO_RESOLVE, resolution.path());
        }

        @Test
        void crossCheckSeesOtherPhaseOneFindingsOnly() {
            resolve();

            assertEquals(2, skeptic.invocations());
            List<AgentResult> priors = skeptic.priorsSeen().get(1);
            assertEquals(List.of("research", "web-fact-checker"), priors.stream().map(AgentResult::agent).toList());
        }

        @Test
        void unavailableAgentRecordedAsSkippedAndNeverCalled() {
            Resolution resolution = resolve();

            assertEquals(0, investigator.invocations());
            assertEquals(List.of("research", "skeptic", "web-fact-checker", "investigator", "skeptic-cross-check"),
                resolution.agents().stream().map(AgentVote::agent).toList());
        }
    }

    // ── degradation ───────────────────────────────────────────────────────

    @Nested
    @DisplayName("degradation")
    class Degradation {

        @Test
        void hangingAndThrowingAgentsStillProduceResolution() {
            ScriptedAgent hanging = new ScriptedAgent("research", AgentRole.RESEARCH, 40, true, prior -> Mono.never());
            ScriptedAgent throwing = new ScriptedAgent("web-fact-checker", AgentRole.FACT_CHECKER, 40, true, prior -> {
                throw new IllegalStateException("search exploded");
            });
            SwarmOrchestrator orchestrator = orchestrator(StubReasoningClient.replying("SCORE: 50"),
                List.of(hanging, skeptic(), throwing),
                SwarmSettings.defaults().withAgentTimeout(Duration.ofMillis(100)));

            StepVerifier.create(orchestrator.resolve(MARKET))
                .assertNext(resolution -> {
                    assertEquals(Outcome.AMBIGUOUS, resolution.outcome());
                    assertEquals(2, resolution.agentVotes().get(Outcome.AMBIGUOUS));
                    assertEquals(2, resolution.agentVotes().get(Outcome.YES));
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("backend answering with no body still produces a scored resolution")
        void emptyScoringReplyStillProducesResolution() {
            SwarmOrchestrator orchestrator = orchestrator(StubReasoningClient.silent(),
                List.of(ScriptedAgent.voting("research", AgentRole.RESEARCH, Outcome.YES, 88, RATIONALE), skeptic()),
                SwarmSettings.defaults());

            StepVerifier.create(orchestrator.resolve(MARKET))
                .assertNext(resolution -> {
                    assertEquals(Outcome.YES, resolution.outcome());
                    assertEquals(FactualScorer.DEFAULT_SCORE, resolution.scoringDetails().factual());
                })
                .verifyComplete();
        }

        @Test
        void scoringDisabledPassesConsensusConfidenceThrough() {
            SwarmOrchestrator orchestrator = orchestrator(StubReasoningClient.replying("SCORE: 99"),
                List.of(ScriptedAgent.voting("research", AgentRole.RESEARCH, Outcome.NO, 86, "Did not happen.")),
                SwarmSettings.defaults().withScoringEnabled(false));

            Resolution resolution = orchestrator.resolve(MARKET).block();

            assertEquals(Outcome.NO, resolution.outcome());
            assertEquals(86, resolution.confidence());
            assertTrue(resolution.scoringDetails().degraded());
            assertEquals(ResolutionPath.SECOND_PASS, resolution.path());
        }

        @Test
        void withoutSkepticThereIsNoCrossCheck() {
            SwarmOrchestrator orchestrator = orchestrator(StubReasoningClient.replying("SCORE: 80"),
                List.of(ScriptedAgent.voting("research", AgentRole.RESEARCH, Outcome.YES, 88, RATIONALE)),
                SwarmSettings.defaults());

            Resolution resolution = orchestrator.resolve(MARKET).block();

            assertEquals(1, resolution.agents().size());
        }
    }

    // ── fatal configuration ───────────────────────────────────────────────

    @Test
    @DisplayName("unconfigured primary backend fails before any agent runs")
    void unconfiguredBackendIsFatal() {
        ScriptedAgent research = ScriptedAgent.voting("research", AgentRole.RESEARCH, Outcome.YES, 88, RATIONALE);
        SwarmOrchestrator orchestrator = orchestrator(StubReasoningClient.unconfigured(),
            List.of(research, skeptic()), SwarmSettings.defaults());

        StepVerifier.create(orchestrator.resolve(MARKET))
            .expectError(ReasoningBackendUnavailableException.class)
            .verify();
        assertEquals(0, research.invocations());
    }
}
