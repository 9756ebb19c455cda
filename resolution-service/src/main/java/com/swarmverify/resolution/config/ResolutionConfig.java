package com.swarmverify.resolution.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.github.benmanes.caffeine.cache.Ticker;
import com.swarmverify.common.consensus.ConsensusEngine;
import com.swarmverify.common.consensus.GeometricMedianConsensusStrategy;
import com.swarmverify.common.routing.ConfidenceRouter;
import com.swarmverify.common.scoring.ScoringWeights;
import com.swarmverify.resolution.guard.ResolutionRateLimiter;
import com.swarmverify.resolution.ledger.InMemoryMarketLedger;
import com.swarmverify.resolution.ledger.MarketLedger;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class ResolutionConfig {

    @Value("${swarm.agent-timeout-ms:12000}")
    private long agentTimeoutMs;

    @Value("${swarm.scoring.enabled:true}")
    private boolean scoringEnabled;

    @Value("${swarm.second-pass.enabled:true}")
    private boolean secondPassEnabled;

    // ── Scoring weights ──────────────────────────────────────────────────────
    @Value("${swarm.scoring.weights.factual:0.45}")
    private double factualWeight;

    @Value("${swarm.scoring.weights.consistency:0.25}")
    private double consistencyWeight;

    @Value("${swarm.scoring.weights.timestamp:0.20}")
    private double timestampWeight;

    @Value("${swarm.scoring.weights.sentiment:0.10}")
    private double sentimentWeight;

    // ── Routing thresholds ───────────────────────────────────────────────────
    @Value("${swarm.routing.auto-resolve-threshold:90}")
    private int autoResolveThreshold;

    @Value("${swarm.routing.second-pass-threshold:85}")
    private int secondPassThreshold;

    // ── Rate limiting ────────────────────────────────────────────────────────
    @Value("${swarm.rate-limit.capacity:100}")
    private int rateLimitCapacity;

    @Value("${swarm.rate-limit.refill-per-second:1}")
    private double rateLimitRefillPerSecond;

    @Value("${swarm.rate-limit.max-clients:10000}")
    private int rateLimitMaxClients;

    /** Layers onto Boot's mapper so its module discovery and lenient defaults stay in place. */
    @Bean
    public Jackson2ObjectMapperBuilderCustomizer swarmJacksonCustomizer() {
        return builder -> builder
            .featuresToDisable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS,
                               DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SwarmSettings swarmSettings() {
        return new SwarmSettings(
            Duration.ofMillis(agentTimeoutMs),
            scoringEnabled,
            secondPassEnabled,
            new ScoringWeights(factualWeight, consistencyWeight, timestampWeight, sentimentWeight));
    }

    @Bean
    public ConsensusEngine consensusEngine() {
        return new GeometricMedianConsensusStrategy();
    }

    @Bean
    public ConfidenceRouter confidenceRouter() {
        return new ConfidenceRouter(autoResolveThreshold, secondPassThreshold);
    }

    @Bean
    public ResolutionRateLimiter resolutionRateLimiter() {
        return new ResolutionRateLimiter(rateLimitCapacity, rateLimitRefillPerSecond,
                                         rateLimitMaxClients, Ticker.systemTicker());
    }

    @Bean
    public MarketLedger marketLedger() {
        return new InMemoryMarketLedger();
    }
}
