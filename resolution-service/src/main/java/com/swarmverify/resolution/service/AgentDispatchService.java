package com.swarmverify.resolution.service;

import com.swarmverify.common.exception.AgentResultMissingException;
import com.swarmverify.common.model.AgentResult;
import com.swarmverify.common.model.SanitizedMarket;
import com.swarmverify.resolution.agent.ResolutionAgent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Runs agents under an individual deadline and turns every failure into a degraded result.
 * The returned publishers never signal an error.
 */
@Service
public class AgentDispatchService {

    private static final Logger log = LoggerFactory.getLogger(AgentDispatchService.class);

    static final String TIMEOUT_RATIONALE = "Agent timeout";
    static final String FAILURE_RATIONALE = "Agent failed to process market";

    private final Clock clock;

    public AgentDispatchService(Clock clock) {
        this.clock = clock;
    }

    /** Fans out blind evaluations concurrently; results keep the order of {@code agents}. */
    public Mono<List<AgentResult>> dispatchAll(List<ResolutionAgent> agents, SanitizedMarket market,
                                               Duration timeout) {
        log.info("Dispatching {} agents in parallel for marketId={}", agents.size(), market.id());
        return Flux.fromIterable(agents)
            .flatMapSequential(agent -> invoke(agent, market, List.of(), timeout))
            .collectList();
    }

    public Mono<AgentResult> invoke(ResolutionAgent agent, SanitizedMarket market,
                                    List<AgentResult> priorFindings, Duration timeout) {
        return Mono.defer(() -> agent.evaluate(market, priorFindings))
            .subscribeOn(Schedulers.boundedElastic())
            .timeout(timeout)
            .switchIfEmpty(Mono.error(() -> new AgentResultMissingException(agent.name())))
            .doOnSuccess(result -> log.debug("Agent={} settled. outcome={} confidence={} degraded={}",
                result.agent(), result.outcome(), result.confidence(), result.isDegraded()))
            .onErrorResume(e -> Mono.just(degrade(agent, priorFindings, e, timeout)));
    }

    private AgentResult degrade(ResolutionAgent agent, List<AgentResult> priorFindings,
                                Throwable error, Duration timeout) {
        String name = resultName(agent, priorFindings);
        if (error instanceof TimeoutException) {
            log.warn("Agent={} timed out after {}ms", name, timeout.toMillis());
            return AgentResult.degraded(name, agent.degradedConfidence(), TIMEOUT_RATIONALE,
                "Agent timeout after " + timeout.toMillis() + "ms", Instant.now(clock));
        }
        if (error instanceof AgentResultMissingException missing) {
            log.warn("Agent={} returned nothing. agent={}", name, missing.getAgentName());
        } else {
            log.error("Agent={} failed", name, error);
        }
        return AgentResult.degraded(name, agent.degradedConfidence(), FAILURE_RATIONALE,
            error.getMessage(), Instant.now(clock));
    }

    private static String resultName(ResolutionAgent agent, List<AgentResult> priorFindings) {
        return priorFindings.isEmpty() ? agent.name() : agent.name() + "-cross-check";
    }
}
