package com.swarmverify.resolution.scoring;

import com.swarmverify.common.consensus.ConsensusResult;
import com.swarmverify.common.model.SanitizedMarket;
import com.swarmverify.common.parse.AgentResponseParser;
import com.swarmverify.resolution.agent.MarketPrompts;
import com.swarmverify.resolution.ai.GenerationConfig;
import com.swarmverify.resolution.ai.ReasoningClient;
import com.swarmverify.resolution.config.SwarmSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/** Asks the reasoning backend to rate the consensus rationale. Never errors. */
@Component
public class FactualScorer {

    private static final Logger log = LoggerFactory.getLogger(FactualScorer.class);

    public static final int DEFAULT_SCORE = 75;

    private static final String SYSTEM_INSTRUCTION =
        "You are a factual accuracy reviewer. Provide an accuracy score.";

    private final ReasoningClient reasoningClient;
    private final SwarmSettings settings;

    public FactualScorer(ReasoningClient reasoningClient, SwarmSettings settings) {
        this.reasoningClient = reasoningClient;
        this.settings        = settings;
    }

    public Mono<Integer> score(SanitizedMarket market, ConsensusResult consensus) {
        String prompt = """
            Verify factual accuracy of this resolution:

            Market: "%s"
            Consensus: %s (%d%% confidence)
            Rationale: %s

            Rate factual accuracy (0-100). Consider:
            - Are facts verifiable?
            - Is reasoning sound?
            - Any factual errors?

            Output: SCORE: <0-100>""".formatted(
                market.title(), consensus.outcome(), consensus.confidence(),
                MarketPrompts.excerpt(consensus.rationale(), 300));

        return Mono.defer(() -> reasoningClient.generate(prompt, SYSTEM_INSTRUCTION, GenerationConfig.defaults()))
            .timeout(settings.agentTimeout())
            .switchIfEmpty(Mono.error(() -> new IllegalStateException("Empty reply from reasoning backend")))
            .map(text -> AgentResponseParser.score(text, DEFAULT_SCORE))
            .onErrorResume(e -> {
                log.warn("[Scoring] Factual scorer failed, using default. marketId={} reason={}",
                    market.id(), e.getMessage());
                return Mono.just(DEFAULT_SCORE);
            });
    }
}
