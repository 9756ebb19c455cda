package com.swarmverify.common.scoring;

/**
 * Blend weights for the four scoring dimensions. The defaults sum to 1.0.
 */
public record ScoringWeights(double factual, double consistency, double timestamp, double sentiment) {

    public static final ScoringWeights DEFAULT = new ScoringWeights(0.45, 0.25, 0.20, 0.10);

    /** Weighted sum, rounded half-up and clamped to [0, 100]. */
    public int blend(int factualScore, int consistencyScore, int timestampScore, int sentimentScore) {
        double blended = factualScore     * factual
                       + consistencyScore * consistency
                       + timestampScore   * timestamp
                       + sentimentScore   * sentiment;
        return (int) Math.max(0, Math.min(100, Math.round(blended)));
    }
}
