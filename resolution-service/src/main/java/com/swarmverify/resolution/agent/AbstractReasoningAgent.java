package com.swarmverify.resolution.agent;

import com.swarmverify.common.model.AgentResult;
import com.swarmverify.common.model.SanitizedMarket;
import com.swarmverify.common.parse.AgentResponseParser;
import com.swarmverify.common.parse.ParsedResponse;
import com.swarmverify.resolution.ai.GenerationConfig;
import com.swarmverify.resolution.ai.ReasoningClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Prompt, call, parse, degrade. Subclasses supply the prompts and the role defaults.
 */
public abstract class AbstractReasoningAgent implements ResolutionAgent {

    private static final Logger log = LoggerFactory.getLogger(AbstractReasoningAgent.class);

    protected static final String FAILURE_RATIONALE = "Agent failed to process market";

    protected final ReasoningClient reasoningClient;
    protected final Clock clock;

    protected AbstractReasoningAgent(ReasoningClient reasoningClient, Clock clock) {
        this.reasoningClient = reasoningClient;
        this.clock           = clock;
    }

    protected abstract String systemInstruction();

    protected abstract String userPrompt(SanitizedMarket market, List<AgentResult> priorFindings);

    /** Confidence used when the response carries no parsable {@code CONFIDENCE:} field. */
    protected abstract int defaultConfidence();

    protected GenerationConfig generationConfig() {
        return GenerationConfig.defaults();
    }

    /** Name the result is recorded under. */
    protected String resultName(List<AgentResult> priorFindings) {
        return name();
    }

    @Override
    public Mono<AgentResult> evaluate(SanitizedMarket market, List<AgentResult> priorFindings) {
        String resultName = resultName(priorFindings);
        return Mono.defer(() -> reasoningClient.generate(
                userPrompt(market, priorFindings), systemInstruction(), generationConfig()))
            .map(text -> toResult(resultName, text, Instant.now(clock)))
            .doOnSuccess(result -> log.info("[Agent] {} complete. marketId={} outcome={} confidence={}",
                resultName, market.id(), result.outcome(), result.confidence()))
            .onErrorResume(e -> {
                log.warn("[Agent] {} failed. marketId={} reason={}", resultName, market.id(), e.getMessage());
                return Mono.just(AgentResult.degraded(resultName, degradedConfidence(),
                    FAILURE_RATIONALE, e.getMessage(), Instant.now(clock)));
            });
    }

    protected AgentResult toResult(String resultName, String text, Instant timestamp) {
        ParsedResponse parsed = AgentResponseParser.parse(text, defaultConfidence());
        return AgentResult.of(resultName, parsed.outcome(), parsed.confidence(),
            parsed.rationale(), parsed.sources(), timestamp);
    }
}
