package com.swarmverify.resolution.config;

import com.swarmverify.common.scoring.ScoringWeights;

import java.time.Duration;

/**
 * Immutable runtime settings shared by the orchestration services. Built once by
 * {@link ResolutionConfig} from {@code swarm.*} properties.
 *
 * @param agentTimeout      per-agent (and per scorer / reviewer call) deadline
 * @param scoringEnabled    {@code false} skips multi-dimensional scoring entirely
 * @param secondPassEnabled {@code false} makes the reviewer return its degraded result without a backend call
 * @param scoringWeights    blend weights for the four scoring dimensions
 */
public record SwarmSettings(
    Duration agentTimeout,
    boolean scoringEnabled,
    boolean secondPassEnabled,
    ScoringWeights scoringWeights
) {
    public static final Duration DEFAULT_AGENT_TIMEOUT = Duration.ofSeconds(12);

    public SwarmSettings {
        agentTimeout   = agentTimeout != null ? agentTimeout : DEFAULT_AGENT_TIMEOUT;
        scoringWeights = scoringWeights != null ? scoringWeights : ScoringWeights.DEFAULT;
    }

    public static SwarmSettings defaults() {
        return new SwarmSettings(DEFAULT_AGENT_TIMEOUT, true, true, ScoringWeights.DEFAULT);
    }

    public SwarmSettings withAgentTimeout(Duration timeout) {
        return new SwarmSettings(timeout, scoringEnabled, secondPassEnabled, scoringWeights);
    }

    public SwarmSettings withScoringEnabled(boolean enabled) {
        return new SwarmSettings(agentTimeout, enabled, secondPassEnabled, scoringWeights);
    }

    public SwarmSettings withSecondPassEnabled(boolean enabled) {
        return new SwarmSettings(agentTimeout, scoringEnabled, enabled, scoringWeights);
    }
}
