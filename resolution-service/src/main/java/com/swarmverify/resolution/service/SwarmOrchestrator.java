package com.swarmverify.resolution.service;

import com.swarmverify.common.consensus.ConsensusEngine;
import com.swarmverify.common.consensus.ConsensusResult;
import com.swarmverify.common.exception.ReasoningBackendUnavailableException;
import com.swarmverify.common.model.AgentResult;
import com.swarmverify.common.model.AgentVote;
import com.swarmverify.common.model.Market;
import com.swarmverify.common.model.Resolution;
import com.swarmverify.common.model.ResolutionPath;
import com.swarmverify.common.model.SanitizedMarket;
import com.swarmverify.common.model.ScoringResult;
import com.swarmverify.common.parse.MarketSanitizer;
import com.swarmverify.common.routing.ConfidenceRouter;
import com.swarmverify.common.trace.TraceContextUtil;
import com.swarmverify.resolution.agent.AgentRole;
import com.swarmverify.resolution.agent.ResolutionAgent;
import com.swarmverify.resolution.ai.ReasoningClient;
import com.swarmverify.resolution.config.SwarmSettings;
import com.swarmverify.resolution.logger.ResolutionFlowLogger;
import com.swarmverify.resolution.scoring.MultiDimensionalScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Drives one market through the swarm.
 *
 * <ol>
 *   <li>Fatal check: the primary reasoning backend must be configured.</li>
 *   <li>Parallel research: every available agent evaluates blind, concurrently.</li>
 *   <li>Cross-check: the skeptic re-runs over the other phase-1 findings.</li>
 *   <li>Consensus over phase-1 and cross-check results.</li>
 *   <li>Multi-dimensional scoring.</li>
 *   <li>Routing by the scored confidence.</li>
 * </ol>
 *
 * <p>Only step 1 can fail the returned {@code Mono}. Agent, scorer and timeout failures
 * degrade in place.
 */
@Service
public class SwarmOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(SwarmOrchestrator.class);

    private final ReasoningClient reasoningClient;
    private final List<ResolutionAgent> activeAgents;
    private final List<ResolutionAgent> unavailableAgents;
    private final ResolutionAgent crossChecker;
    private final AgentDispatchService dispatchService;
    private final ConsensusEngine consensusEngine;
    private final MultiDimensionalScorer scorer;
    private final ConfidenceRouter router;
    private final ResolutionFlowLogger flowLogger;
    private final SwarmSettings settings;
    private final Clock clock;

    public SwarmOrchestrator(ReasoningClient reasoningClient,
                             List<ResolutionAgent> agents,
                             AgentDispatchService dispatchService,
                             ConsensusEngine consensusEngine,
                             MultiDimensionalScorer scorer,
                             ConfidenceRouter router,
                             ResolutionFlowLogger flowLogger,
                             SwarmSettings settings,
                             Clock clock) {
        this.reasoningClient   = reasoningClient;
        this.activeAgents      = agents.stream().filter(ResolutionAgent::isAvailable).toList();
        this.unavailableAgents = agents.stream().filter(a -> !a.isAvailable()).toList();
        this.crossChecker      = activeAgents.stream()
            .filter(a -> a.role() == AgentRole.SKEPTIC)
            .findFirst()
            .orElse(null);
        this.dispatchService   = dispatchService;
        this.consensusEngine   = consensusEngine;
        this.scorer            = scorer;
        this.router            = router;
        this.flowLogger        = flowLogger;
        this.settings          = settings;
        this.clock             = clock;

        unavailableAgents.forEach(agent ->
            log.warn("[Swarm] Agent not configured, will be recorded as skipped. agent={}", agent.name()));
        log.info("[Swarm] Roster fixed. active={} skipped={} timeoutMs={}",
            activeAgents.stream().map(ResolutionAgent::name).toList(),
            unavailableAgents.stream().map(ResolutionAgent::name).toList(),
            settings.agentTimeout().toMillis());
    }

    /**
     * @throws ReasoningBackendUnavailableException when the primary reasoning backend has no credentials
     */
    public void ensureBackendAvailable() {
        if (!reasoningClient.isConfigured()) {
            throw new ReasoningBackendUnavailableException(
                "Primary reasoning backend is not configured; set swarm.reasoning.api-key");
        }
    }

    public Mono<Resolution> resolve(Market market) {
        return Mono.defer(() -> {
            ensureBackendAvailable();
            String traceId = UUID.randomUUID().toString();
            SanitizedMarket sanitized = MarketSanitizer.sanitize(market, clock);
            flowLogger.logWithTraceId(ResolutionFlowLogger.RESOLUTION_STARTED, market.id(), traceId);

            Mono<Resolution> pipeline = dispatchService
                .dispatchAll(activeAgents, sanitized, settings.agentTimeout())
                .map(this::withSkipped)
                .doOnEach(flowLogger.stage(ResolutionFlowLogger.PARALLEL_RESEARCH_COMPLETED))
                .flatMap(phaseOne -> crossCheck(sanitized, phaseOne))
                .doOnEach(flowLogger.stage(ResolutionFlowLogger.CROSS_CHECK_COMPLETED))
                .flatMap(results -> {
                    ConsensusResult consensus = consensusEngine.compute(results);
                    flowLogger.logWithTraceId(ResolutionFlowLogger.CONSENSUS_COMPUTED, market.id(), traceId);
                    log.info("[Swarm] Consensus. marketId={} outcome={} confidence={} votes={}",
                        market.id(), consensus.outcome(), consensus.confidence(), consensus.agentVotes());
                    return scorer.score(sanitized, consensus)
                        .doOnEach(flowLogger.stage(ResolutionFlowLogger.SCORING_COMPLETED))
                        .map(scoring -> assemble(market.id(), consensus, scoring, results));
                })
                .doOnNext(resolution -> flowLogger.logResolution(resolution, traceId));

            return TraceContextUtil.withTraceId(pipeline, traceId);
        });
    }

    private List<AgentResult> withSkipped(List<AgentResult> phaseOne) {
        if (unavailableAgents.isEmpty()) return phaseOne;
        List<AgentResult> all = new ArrayList<>(phaseOne);
        Instant now = Instant.now(clock);
        unavailableAgents.forEach(agent ->
            all.add(AgentResult.skipped(agent.name(), agent.name() + " backend not configured", now)));
        return all;
    }

    private Mono<List<AgentResult>> crossCheck(SanitizedMarket market, List<AgentResult> phaseOne) {
        if (crossChecker == null) return Mono.just(phaseOne);
        List<AgentResult> findings = phaseOne.stream()
            .filter(r -> !r.skipped())
            .filter(r -> !r.agent().equals(crossChecker.name()))
            .toList();
        if (findings.isEmpty()) {
            // nothing to cross-check; the blind skeptic vote stands alone
            return Mono.just(phaseOne);
        }
        return dispatchService.invoke(crossChecker, market, findings, settings.agentTimeout())
            .map(crossCheck -> {
                List<AgentResult> all = new ArrayList<>(phaseOne);
                all.add(crossCheck);
                return all;
            });
    }

    private Resolution assemble(String marketId, ConsensusResult consensus, ScoringResult scoring,
                                List<AgentResult> results) {
        int confidence = scoring.finalConfidence();
        ResolutionPath path = router.route(confidence);
        return new Resolution(
            marketId,
            consensus.outcome(),
            confidence,
            consensus.rationale(),
            consensus.sources(),
            consensus.agentVotes(),
            scoring,
            results.stream().map(AgentVote::from).toList(),
            path,
            Instant.now(clock));
    }
}
