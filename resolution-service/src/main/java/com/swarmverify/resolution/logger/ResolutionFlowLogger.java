package com.swarmverify.resolution.logger;

import com.swarmverify.common.model.Resolution;
import com.swarmverify.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Observability component for one market's trip through the swarm pipeline. Pure side-effects.
 *
 * <p>Stages (in order):
 * <ol>
 *   <li>{@link #RESOLUTION_STARTED}</li>
 *   <li>{@link #PARALLEL_RESEARCH_COMPLETED}: all phase-1 agents settled</li>
 *   <li>{@link #CROSS_CHECK_COMPLETED}: skeptic re-run over phase-1 findings settled</li>
 *   <li>{@link #CONSENSUS_COMPUTED}</li>
 *   <li>{@link #SCORING_COMPLETED}</li>
 *   <li>{@link #RESOLUTION_ROUTED}: path assigned, resolution assembled</li>
 * </ol>
 *
 * <pre>
 *     .doOnEach(flowLogger.stage(ResolutionFlowLogger.CONSENSUS_COMPUTED))
 * </pre>
 */
@Component
public class ResolutionFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(ResolutionFlowLogger.class);

    public static final String RESOLUTION_STARTED          = "RESOLUTION_STARTED";
    public static final String PARALLEL_RESEARCH_COMPLETED = "PARALLEL_RESEARCH_COMPLETED";
    public static final String CROSS_CHECK_COMPLETED       = "CROSS_CHECK_COMPLETED";
    public static final String CONSENSUS_COMPUTED          = "CONSENSUS_COMPUTED";
    public static final String SCORING_COMPLETED           = "SCORING_COMPLETED";
    public static final String RESOLUTION_ROUTED           = "RESOLUTION_ROUTED";

    /**
     * Returns a {@code doOnEach} consumer that logs {@code stageName} on {@code onNext} only,
     * reading the traceId from the signal's Reactor Context.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String traceId = TraceContextUtil.getTraceId(signal.getContextView());
            TraceContextUtil.withMdc(traceId, () ->
                log.info("[ResolutionFlow] stage={} traceId={}", stageName, traceId)
            );
        };
    }

    public void logWithTraceId(String stageName, String marketId, String traceId) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[ResolutionFlow] stage={} marketId={} traceId={}", stageName, marketId, traceId)
        );
    }

    /** One-line summary of the assembled resolution. */
    public void logResolution(Resolution resolution, String traceId) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[ResolutionFlow] stage={} marketId={} outcome={} confidence={} path={} "
                     + "votes={} scoringDegraded={} traceId={}",
                     RESOLUTION_ROUTED,
                     resolution.marketId(), resolution.outcome(), resolution.confidence(),
                     resolution.path().label(), resolution.agentVotes(),
                     resolution.scoringDetails() != null && resolution.scoringDetails().degraded(),
                     traceId)
        );
    }
}
