package com.swarmverify.resolution.review;

import com.swarmverify.common.model.Market;
import com.swarmverify.common.model.Outcome;
import com.swarmverify.common.model.Resolution;
import com.swarmverify.common.model.SanitizedMarket;
import com.swarmverify.common.model.SecondPassReview;
import com.swarmverify.common.parse.AgentResponseParser;
import com.swarmverify.common.parse.MarketSanitizer;
import com.swarmverify.resolution.agent.MarketPrompts;
import com.swarmverify.resolution.ai.GenerationConfig;
import com.swarmverify.resolution.ai.ReasoningClient;
import com.swarmverify.resolution.config.SwarmSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;

/**
 * Independent low-temperature re-verification for resolutions routed to {@code second-pass}.
 *
 * <p>Never errors: on any failure the first-pass outcome is kept with confidence lowered by
 * {@value #FAILURE_PENALTY} (floored at 0).
 */
@Service
public class SecondPassReviewer {

    private static final Logger log = LoggerFactory.getLogger(SecondPassReviewer.class);

    static final double TEMPERATURE        = 0.1;
    static final int    FAILURE_PENALTY    = 5;
    static final String FAILURE_RATIONALE  = "Second pass failed";

    private final ReasoningClient reasoningClient;
    private final SwarmSettings settings;
    private final Clock clock;

    public SecondPassReviewer(ReasoningClient reasoningClient, SwarmSettings settings, Clock clock) {
        this.reasoningClient = reasoningClient;
        this.settings        = settings;
        this.clock           = clock;
    }

    public Mono<SecondPassReview> review(Market market, Resolution firstPass) {
        if (!settings.secondPassEnabled()) {
            return Mono.just(failed(firstPass, "Second pass disabled"));
        }
        log.info("[SecondPass] Reviewing. marketId={} firstOutcome={} firstConfidence={}",
            firstPass.marketId(), firstPass.outcome(), firstPass.confidence());

        return Mono.defer(() -> {
                SanitizedMarket sanitized = MarketSanitizer.sanitize(market, clock);
                String userPrompt = "Market: \"" + sanitized.title() + "\"\n"
                                  + "Description: \"" + sanitized.description() + "\"\n\n"
                                  + "Perform independent verification of the first pass outcome.";
                return reasoningClient.generate(userPrompt, systemInstruction(firstPass),
                    GenerationConfig.defaults().withTemperature(TEMPERATURE));
            })
            .timeout(settings.agentTimeout())
            .switchIfEmpty(Mono.error(() -> new IllegalStateException("Empty reply from reasoning backend")))
            .map(text -> parse(text, firstPass))
            .doOnSuccess(review -> log.info("[SecondPass] Complete. marketId={} outcome={} confidence={}",
                firstPass.marketId(), review.outcome(), review.confidence()))
            .onErrorResume(e -> {
                log.warn("[SecondPass] Review failed. marketId={} reason={}", firstPass.marketId(), e.getMessage());
                return Mono.just(failed(firstPass, e.getMessage() != null ? e.getMessage() : e.toString()));
            });
    }

    private SecondPassReview parse(String text, Resolution firstPass) {
        Outcome outcome = AgentResponseParser.outcome(text, firstPass.outcome());
        int confidence  = AgentResponseParser.confidence(text, firstPass.confidence());
        return SecondPassReview.of(outcome, confidence, AgentResponseParser.verification(text),
            firstPass.confidence(), Instant.now(clock));
    }

    private SecondPassReview failed(Resolution firstPass, String error) {
        return new SecondPassReview(firstPass.outcome(),
            Math.max(0, firstPass.confidence() - FAILURE_PENALTY), FAILURE_RATIONALE,
            true, firstPass.confidence(), Instant.now(clock), error);
    }

    private static String systemInstruction(Resolution firstPass) {
        return """
            You are a senior market resolution reviewer performing a second-pass verification.

            First Pass Results:
            - Outcome: %s
            - Confidence: %d%%
            - Rationale: %s

            Your task: Independently verify if this outcome is correct. Consider:
            1. Are there any contradictions in the evidence?
            2. Could the outcome be interpreted differently?
            3. Is the confidence level appropriate?

            Output format:
            OUTCOME: YES|NO|AMBIGUOUS
            CONFIDENCE: <0-100>
            VERIFICATION: <brief verification>""".formatted(
                firstPass.outcome(), firstPass.confidence(),
                MarketPrompts.excerpt(firstPass.rationale(), 300));
    }
}
