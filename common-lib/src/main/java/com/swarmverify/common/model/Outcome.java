package com.swarmverify.common.model;

import java.util.Locale;

/**
 * Resolution vote an agent can cast for a market question.
 *
 * <p>Declaration order is significant: it is the tie-break order used by
 * {@link com.swarmverify.common.consensus.GeometricMedianConsensusStrategy} when two
 * or more outcome groups have the same number of votes.
 */
public enum Outcome {
    YES,
    NO,
    AMBIGUOUS;

    /**
     * Lenient lookup used when reading free-text agent output.
     * Unknown, blank or {@code null} labels map to {@code fallback}.
     */
    public static Outcome fromLabel(String label, Outcome fallback) {
        if (label == null || label.isBlank()) return fallback;
        try {
            return Outcome.valueOf(label.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return fallback;
        }
    }
}
