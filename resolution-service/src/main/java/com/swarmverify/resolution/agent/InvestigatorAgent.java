package com.swarmverify.resolution.agent;

import com.swarmverify.common.model.AgentResult;
import com.swarmverify.common.model.Outcome;
import com.swarmverify.common.model.SanitizedMarket;
import com.swarmverify.common.parse.AgentResponseParser;
import com.swarmverify.resolution.ai.GenerationConfig;
import com.swarmverify.resolution.ai.ReasoningClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Optional agent on a second, search-grounded reasoning client with its own credentials.
 * Unavailable when that client is not configured.
 */
@Component
@Order(4)
public class InvestigatorAgent extends AbstractReasoningAgent {

    public static final String NAME = "investigator";

    static final int DEFAULT_CONFIDENCE  = 55;
    static final int DEGRADED_CONFIDENCE = 40;
    static final int RATIONALE_EXCERPT   = 300;

    private static final String SYSTEM_INSTRUCTION =
        "You are an investigative agent for prediction markets. Determine YES, NO, or AMBIGUOUS.";

    public InvestigatorAgent(@Qualifier("investigatorReasoningClient") ReasoningClient reasoningClient,
                             Clock clock) {
        super(reasoningClient, clock);
    }

    @Override public String name()               { return NAME; }
    @Override public AgentRole role()            { return AgentRole.INVESTIGATOR; }
    @Override public int degradedConfidence()    { return DEGRADED_CONFIDENCE; }
    @Override protected int defaultConfidence()  { return DEFAULT_CONFIDENCE; }
    @Override protected String systemInstruction() { return SYSTEM_INSTRUCTION; }

    @Override
    public boolean isAvailable() {
        return reasoningClient.isConfigured();
    }

    @Override
    protected GenerationConfig generationConfig() {
        return GenerationConfig.defaults().withSearchGrounding();
    }

    @Override
    protected String userPrompt(SanitizedMarket market, List<AgentResult> priorFindings) {
        return "Market: \"" + market.title() + "\"\n"
             + "Description: \"" + market.description() + "\"\n"
             + "Determine the outcome and provide confidence (0-100).\n\n"
             + MarketPrompts.OUTPUT_FORMAT;
    }

    @Override
    protected AgentResult toResult(String resultName, String text, Instant timestamp) {
        return AgentResult.of(resultName,
            AgentResponseParser.outcome(text, Outcome.AMBIGUOUS),
            AgentResponseParser.confidence(text, DEFAULT_CONFIDENCE),
            MarketPrompts.excerpt(text, RATIONALE_EXCERPT),
            AgentResponseParser.extractSources(text),
            timestamp);
    }
}
