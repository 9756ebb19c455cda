package com.swarmverify.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Normalised output of one agent invocation.
 *
 * <p>Invariants enforced by the compact constructor:
 * <ul>
 *   <li>{@code outcome} is never {@code null} (defaults to {@link Outcome#AMBIGUOUS})</li>
 *   <li>{@code confidence} is clamped to [0, 100]</li>
 *   <li>{@code sources} holds at most {@value #MAX_SOURCES} entries and is never {@code null}</li>
 * </ul>
 *
 * <p>{@code error} is populated only for degraded results; {@code skipped} marks an
 * agent that was never invoked and must not take part in vote grouping.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AgentResult(
    @JsonProperty("agent") String agent,
    @JsonProperty("outcome") Outcome outcome,
    @JsonProperty("confidence") int confidence,
    @JsonProperty("rationale") String rationale,
    @JsonProperty("sources") List<String> sources,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("error") String error,
    @JsonProperty("skipped") boolean skipped
) {
    public static final int MAX_SOURCES = 3;

    public AgentResult {
        outcome    = outcome != null ? outcome : Outcome.AMBIGUOUS;
        confidence = Math.max(0, Math.min(100, confidence));
        rationale  = rationale != null ? rationale : "";
        sources    = sources == null ? List.of()
                   : List.copyOf(sources.subList(0, Math.min(MAX_SOURCES, sources.size())));
        timestamp  = timestamp != null ? timestamp : Instant.now();
    }

    public static AgentResult of(String agent, Outcome outcome, int confidence,
                                 String rationale, List<String> sources, Instant timestamp) {
        return new AgentResult(agent, outcome, confidence, rationale, sources, timestamp, null, false);
    }

    /** AMBIGUOUS placeholder for an agent that failed, timed out or returned unusable output. */
    public static AgentResult degraded(String agent, int confidence, String rationale,
                                       String error, Instant timestamp) {
        return new AgentResult(agent, Outcome.AMBIGUOUS, confidence, rationale, List.of(),
                               timestamp, error != null ? error : "unknown error", false);
    }

    /** Marker for an agent whose backend is not configured. Excluded from consensus. */
    public static AgentResult skipped(String agent, String reason, Instant timestamp) {
        return new AgentResult(agent, Outcome.AMBIGUOUS, 0, reason, List.of(), timestamp, null, true);
    }

    public boolean isDegraded() {
        return error != null;
    }
}
