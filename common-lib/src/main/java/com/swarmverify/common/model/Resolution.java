package com.swarmverify.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * First-pass verdict for one market. Immutable once returned; persistence and any
 * follow-up second pass are the caller's responsibility.
 */
public record Resolution(
    @JsonProperty("marketId") String marketId,
    @JsonProperty("outcome") Outcome outcome,
    @JsonProperty("confidence") int confidence,
    @JsonProperty("rationale") String rationale,
    @JsonProperty("sources") List<String> sources,
    @JsonProperty("agentVotes") Map<Outcome, Integer> agentVotes,
    @JsonProperty("scoringDetails") ScoringResult scoringDetails,
    @JsonProperty("agents") List<AgentVote> agents,
    @JsonProperty("path") ResolutionPath path,
    @JsonProperty("timestamp") Instant timestamp
) {
    public Resolution {
        sources    = sources != null ? List.copyOf(sources) : List.of();
        agentVotes = agentVotes == null || agentVotes.isEmpty() ? Map.of()
                   : Collections.unmodifiableMap(new EnumMap<>(agentVotes));
        agents     = agents != null ? List.copyOf(agents) : List.of();
    }

    public boolean requiresSecondPass() {
        return path == ResolutionPath.SECOND_PASS;
    }
}
