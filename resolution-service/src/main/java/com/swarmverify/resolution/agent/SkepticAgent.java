package com.swarmverify.resolution.agent;

import com.swarmverify.common.model.AgentResult;
import com.swarmverify.common.model.SanitizedMarket;
import com.swarmverify.resolution.ai.ReasoningClient;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Adversarial agent that defaults to AMBIGUOUS on any doubt.
 *
 * <p>Runs twice per market: blind in the parallel phase, then as {@value #CROSS_CHECK_NAME}
 * with the other agents' findings summarised into its prompt.
 */
@Component
@Order(2)
public class SkepticAgent extends AbstractReasoningAgent {

    public static final String NAME             = "skeptic";
    public static final String CROSS_CHECK_NAME = "skeptic-cross-check";

    static final int DEFAULT_CONFIDENCE  = 50;
    static final int DEGRADED_CONFIDENCE = 45;
    static final int FINDING_EXCERPT     = 300;

    private static final String SYSTEM_INSTRUCTION = """
        You are a PARANOID SKEPTIC agent for market resolution.

        Your role:
        1. ASSUME all claims are false until proven with overwhelming evidence
        2. Look for contradictions, biases, and unreliable reasoning
        3. Challenge assumptions and question weak evidence
        4. Only accept outcomes backed by strong logical proof
        5. Default to AMBIGUOUS if ANY doubt exists

        Be extremely critical and conservative.

        """ + MarketPrompts.OUTPUT_FORMAT;

    public SkepticAgent(ReasoningClient reasoningClient, Clock clock) {
        super(reasoningClient, clock);
    }

    @Override public String name()               { return NAME; }
    @Override public AgentRole role()            { return AgentRole.SKEPTIC; }
    @Override public int degradedConfidence()    { return DEGRADED_CONFIDENCE; }
    @Override protected int defaultConfidence()  { return DEFAULT_CONFIDENCE; }
    @Override protected String systemInstruction() { return SYSTEM_INSTRUCTION; }

    @Override
    protected String resultName(List<AgentResult> priorFindings) {
        return priorFindings.isEmpty() ? NAME : CROSS_CHECK_NAME;
    }

    @Override
    protected String userPrompt(SanitizedMarket market, List<AgentResult> priorFindings) {
        StringBuilder prompt = new StringBuilder(MarketPrompts.describe(market))
            .append("\n\nCritically evaluate this market.");
        if (!priorFindings.isEmpty()) {
            prompt.append("\n\nOTHER AGENTS' FINDINGS (verify these critically):");
            for (int i = 0; i < priorFindings.size(); i++) {
                AgentResult finding = priorFindings.get(i);
                prompt.append("\nAgent ").append(i + 1).append(" (").append(finding.agent()).append("):")
                      .append("\n- Outcome: ").append(finding.outcome())
                      .append("\n- Confidence: ").append(finding.confidence()).append('%')
                      .append("\n- Rationale: ").append(MarketPrompts.excerpt(finding.rationale(), FINDING_EXCERPT));
            }
        }
        return prompt.toString();
    }
}
