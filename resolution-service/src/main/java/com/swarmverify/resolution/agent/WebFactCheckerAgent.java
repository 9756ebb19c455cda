package com.swarmverify.resolution.agent;

import com.swarmverify.common.model.AgentResult;
import com.swarmverify.common.model.Outcome;
import com.swarmverify.common.model.SanitizedMarket;
import com.swarmverify.common.scoring.HeuristicScorers;
import com.swarmverify.resolution.search.InstantAnswer;
import com.swarmverify.resolution.search.InstantAnswerClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Keyword vote over the instant-answer abstract for {@code "<title> <category>"}.
 *
 * <p>A side wins when its hit count exceeds {@value #DOMINANCE_RATIO} times the other side's;
 * confidence is then {@code min(65, 45 + 4 * hits)}. No dominance yields AMBIGUOUS at 45.
 */
@Component
@Order(3)
public class WebFactCheckerAgent implements ResolutionAgent {

    private static final Logger log = LoggerFactory.getLogger(WebFactCheckerAgent.class);

    public static final String NAME = "web-fact-checker";

    static final List<String> POSITIVE_KEYWORDS =
        List.of("confirmed", "verified", "true", "yes", "successful", "achieved", "passed", "approved");
    static final List<String> NEGATIVE_KEYWORDS =
        List.of("false", "denied", "failed", "no", "rejected", "unsuccessful");

    private static final Pattern POSITIVE_PATTERN = HeuristicScorers.keywordPattern(POSITIVE_KEYWORDS);
    private static final Pattern NEGATIVE_PATTERN = HeuristicScorers.keywordPattern(NEGATIVE_KEYWORDS);

    static final double DOMINANCE_RATIO     = 1.5;
    static final int    BASE_CONFIDENCE     = 45;
    static final int    PER_HIT_CONFIDENCE  = 4;
    static final int    MAX_CONFIDENCE      = 65;
    static final int    DEGRADED_CONFIDENCE = 40;

    private final InstantAnswerClient searchClient;
    private final Clock clock;

    public WebFactCheckerAgent(InstantAnswerClient searchClient, Clock clock) {
        this.searchClient = searchClient;
        this.clock        = clock;
    }

    @Override public String name()            { return NAME; }
    @Override public AgentRole role()         { return AgentRole.FACT_CHECKER; }
    @Override public int degradedConfidence() { return DEGRADED_CONFIDENCE; }

    @Override
    public Mono<AgentResult> evaluate(SanitizedMarket market, List<AgentResult> priorFindings) {
        String query = market.title() + " " + market.category();
        return Mono.defer(() -> searchClient.lookup(query))
            .map(answer -> classify(answer, Instant.now(clock)))
            .onErrorResume(e -> {
                log.warn("[Agent] {} failed. marketId={} reason={}", NAME, market.id(), e.getMessage());
                return Mono.just(AgentResult.degraded(NAME, DEGRADED_CONFIDENCE,
                    "Agent failed to fetch search results", e.getMessage(), Instant.now(clock)));
            });
    }

    AgentResult classify(InstantAnswer answer, Instant timestamp) {
        String content = answer.abstractText();
        int yes = HeuristicScorers.countKeywords(content, POSITIVE_PATTERN);
        int no  = HeuristicScorers.countKeywords(content, NEGATIVE_PATTERN);

        Outcome outcome = Outcome.AMBIGUOUS;
        int confidence  = BASE_CONFIDENCE;
        if (yes > no * DOMINANCE_RATIO) {
            outcome    = Outcome.YES;
            confidence = Math.min(MAX_CONFIDENCE, BASE_CONFIDENCE + yes * PER_HIT_CONFIDENCE);
        } else if (no > yes * DOMINANCE_RATIO) {
            outcome    = Outcome.NO;
            confidence = Math.min(MAX_CONFIDENCE, BASE_CONFIDENCE + no * PER_HIT_CONFIDENCE);
        }

        List<String> sources = answer.abstractUrl().isBlank() ? List.of() : List.of(answer.abstractUrl());
        return AgentResult.of(NAME, outcome, confidence,
            "Found " + yes + " positive and " + no + " negative indicators from search results.",
            sources, timestamp);
    }
}
