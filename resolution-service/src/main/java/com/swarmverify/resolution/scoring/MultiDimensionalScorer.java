package com.swarmverify.resolution.scoring;

import com.swarmverify.common.consensus.ConsensusResult;
import com.swarmverify.common.model.SanitizedMarket;
import com.swarmverify.common.model.ScoringResult;
import com.swarmverify.common.scoring.HeuristicScorers;
import com.swarmverify.common.scoring.ScoringWeights;
import com.swarmverify.resolution.config.SwarmSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.function.IntSupplier;

/**
 * Blends four independent quality dimensions into the final confidence.
 *
 * <p>Dimensions and default weights: factual 0.45 (backend-rated), consistency 0.25,
 * timestamp 0.20, sentiment 0.10 (heuristics). Each heuristic that throws falls back to
 * its own default; if the blend itself cannot be produced the consensus confidence is
 * passed through and the result is flagged {@code degraded}.
 */
@Service
public class MultiDimensionalScorer {

    private static final Logger log = LoggerFactory.getLogger(MultiDimensionalScorer.class);

    private final FactualScorer factualScorer;
    private final SwarmSettings settings;
    private final Clock clock;

    public MultiDimensionalScorer(FactualScorer factualScorer, SwarmSettings settings, Clock clock) {
        this.factualScorer = factualScorer;
        this.settings      = settings;
        this.clock         = clock;
    }

    public Mono<ScoringResult> score(SanitizedMarket market, ConsensusResult consensus) {
        if (!settings.scoringEnabled()) {
            return Mono.just(ScoringResult.fallback(consensus.confidence()));
        }
        return factualScorer.score(market, consensus)
            .map(factual -> blend(market, consensus, factual))
            .onErrorResume(e -> {
                log.warn("[Scoring] Multi-dimensional scoring failed, passing consensus confidence through. "
                         + "marketId={} reason={}", market.id(), e.getMessage());
                return Mono.just(ScoringResult.fallback(consensus.confidence()));
            });
    }

    private ScoringResult blend(SanitizedMarket market, ConsensusResult consensus, int factual) {
        int consistency = safely("consistency", ScoringResult.FALLBACK_CONSISTENCY,
            () -> HeuristicScorers.consistency(consensus));
        int timestamp   = safely("timestamp", ScoringResult.FALLBACK_TIMESTAMP,
            () -> HeuristicScorers.timestamp(market.resolutionDate(), clock));
        int sentiment   = safely("sentiment", ScoringResult.FALLBACK_SENTIMENT,
            () -> HeuristicScorers.sentiment(consensus.rationale()));

        ScoringWeights weights = settings.scoringWeights();
        int finalConfidence = weights.blend(factual, consistency, timestamp, sentiment);
        log.info("[Scoring] marketId={} factual={} consistency={} timestamp={} sentiment={} "
                 + "original={} final={}",
                 market.id(), factual, consistency, timestamp, sentiment,
                 consensus.confidence(), finalConfidence);
        return new ScoringResult(factual, consistency, timestamp, sentiment,
            finalConfidence, consensus.confidence(), false);
    }

    private static int safely(String dimension, int fallback, IntSupplier scorer) {
        try {
            return scorer.getAsInt();
        } catch (RuntimeException e) {
            log.warn("[Scoring] {} scorer failed, using {}. reason={}", dimension, fallback, e.getMessage());
            return fallback;
        }
    }
}
