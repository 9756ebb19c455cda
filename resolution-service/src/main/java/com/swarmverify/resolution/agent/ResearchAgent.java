package com.swarmverify.resolution.agent;

import com.swarmverify.common.model.AgentResult;
import com.swarmverify.common.model.SanitizedMarket;
import com.swarmverify.resolution.ai.ReasoningClient;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/** Neutral fact-finding agent. */
@Component
@Order(1)
public class ResearchAgent extends AbstractReasoningAgent {

    public static final String NAME = "research";

    static final int DEFAULT_CONFIDENCE  = 65;
    static final int DEGRADED_CONFIDENCE = 40;

    private static final String SYSTEM_INSTRUCTION = """
        You are a factual research agent for prediction market resolution.
        Your task is to determine if the following market outcome is TRUE or FALSE.

        Rules:
        1. Use credible reasoning and established facts
        2. If evidence is inconclusive or contradictory, return AMBIGUOUS
        3. Provide confidence score (0-100) based on evidence quality
        4. Be thorough but concise

        """ + MarketPrompts.OUTPUT_FORMAT;

    public ResearchAgent(ReasoningClient reasoningClient, Clock clock) {
        super(reasoningClient, clock);
    }

    @Override public String name()               { return NAME; }
    @Override public AgentRole role()            { return AgentRole.RESEARCH; }
    @Override public int degradedConfidence()    { return DEGRADED_CONFIDENCE; }
    @Override protected int defaultConfidence()  { return DEFAULT_CONFIDENCE; }
    @Override protected String systemInstruction() { return SYSTEM_INSTRUCTION; }

    @Override
    protected String userPrompt(SanitizedMarket market, List<AgentResult> priorFindings) {
        return MarketPrompts.describe(market) + "\n\nDetermine the outcome with maximum accuracy.";
    }
}
