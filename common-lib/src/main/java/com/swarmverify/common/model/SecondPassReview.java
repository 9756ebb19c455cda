package com.swarmverify.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Independent re-verification of a mid-confidence {@link Resolution}.
 * Stored by the caller as a separate evidence record; it never rewrites the first pass.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SecondPassReview(
    @JsonProperty("outcome") Outcome outcome,
    @JsonProperty("confidence") int confidence,
    @JsonProperty("rationale") String rationale,
    @JsonProperty("isSecondPass") boolean isSecondPass,
    @JsonProperty("firstPassConfidence") int firstPassConfidence,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("error") String error
) {
    public static SecondPassReview of(Outcome outcome, int confidence, String rationale,
                                      int firstPassConfidence, Instant timestamp) {
        return new SecondPassReview(outcome, Math.max(0, Math.min(100, confidence)), rationale,
                                    true, firstPassConfidence, timestamp, null);
    }
}
