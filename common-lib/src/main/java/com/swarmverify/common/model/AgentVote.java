package com.swarmverify.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Compact per-agent summary carried on a {@link Resolution}. */
public record AgentVote(
    @JsonProperty("agent") String agent,
    @JsonProperty("outcome") Outcome outcome,
    @JsonProperty("confidence") int confidence
) {
    public static AgentVote from(AgentResult result) {
        return new AgentVote(result.agent(), result.outcome(), result.confidence());
    }
}
