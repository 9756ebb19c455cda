package com.swarmverify.resolution.agent;

import com.swarmverify.common.model.AgentResult;
import com.swarmverify.common.model.SanitizedMarket;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * One independent evaluator in the swarm.
 *
 * <p>Implementations never signal an error for backend trouble: they emit a degraded
 * {@code AMBIGUOUS} result at {@link #degradedConfidence()} carrying the cause in {@code error}.
 * The orchestrator applies the same degradation to timeouts and to anything that still escapes.
 */
public interface ResolutionAgent {

    String name();

    AgentRole role();

    /** Confidence attached to this agent's degraded results. */
    int degradedConfidence();

    /** {@code false} when the agent's backend is not configured; such agents are never invoked. */
    default boolean isAvailable() {
        return true;
    }

    /**
     * @param market        sanitized market fields
     * @param priorFindings results of earlier agents this agent should weigh; empty for a blind evaluation
     */
    Mono<AgentResult> evaluate(SanitizedMarket market, List<AgentResult> priorFindings);
}
