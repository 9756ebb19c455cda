package com.swarmverify.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Four quality dimensions of a consensus, each in [0, 100], and their weighted blend.
 *
 * <p>{@code originalConfidence} is the raw consensus confidence the blend replaced.
 * {@code degraded} is {@code true} when scoring did not run and {@code finalConfidence}
 * fell back to the consensus confidence.
 */
public record ScoringResult(
    @JsonProperty("factual") int factual,
    @JsonProperty("consistency") int consistency,
    @JsonProperty("timestamp") int timestamp,
    @JsonProperty("sentiment") int sentiment,
    @JsonProperty("finalConfidence") int finalConfidence,
    @JsonProperty("originalConfidence") int originalConfidence,
    @JsonProperty("degraded") boolean degraded
) {
    public static final int FALLBACK_FACTUAL     = 70;
    public static final int FALLBACK_CONSISTENCY = 70;
    public static final int FALLBACK_TIMESTAMP   = 100;
    public static final int FALLBACK_SENTIMENT   = 100;

    /** Scoring did not run; the consensus confidence is carried through unchanged. */
    public static ScoringResult fallback(int consensusConfidence) {
        return new ScoringResult(FALLBACK_FACTUAL, FALLBACK_CONSISTENCY, FALLBACK_TIMESTAMP,
                                 FALLBACK_SENTIMENT, consensusConfidence, consensusConfidence, true);
    }
}
