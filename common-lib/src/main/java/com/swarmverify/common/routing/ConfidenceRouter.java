package com.swarmverify.common.routing;

import com.swarmverify.common.model.ResolutionPath;

/**
 * Maps a final blended confidence to a {@link ResolutionPath}.
 *
 * <pre>
 *   confidence ≥ autoResolveThreshold (90)  → AUTO_RESOLVE
 *   confidence ≥ secondPassThreshold  (85)  → SECOND_PASS
 *   otherwise                               → MANUAL_REVIEW
 * </pre>
 *
 * <p>Pure function of its input; holds no state between calls.
 */
public class ConfidenceRouter {

    public static final int DEFAULT_AUTO_RESOLVE_THRESHOLD = 90;
    public static final int DEFAULT_SECOND_PASS_THRESHOLD  = 85;

    private final int autoResolveThreshold;
    private final int secondPassThreshold;

    public ConfidenceRouter() {
        this(DEFAULT_AUTO_RESOLVE_THRESHOLD, DEFAULT_SECOND_PASS_THRESHOLD);
    }

    public ConfidenceRouter(int autoResolveThreshold, int secondPassThreshold) {
        if (secondPassThreshold > autoResolveThreshold) {
            throw new IllegalArgumentException("secondPassThreshold (" + secondPassThreshold
                + ") must not exceed autoResolveThreshold (" + autoResolveThreshold + ")");
        }
        this.autoResolveThreshold = autoResolveThreshold;
        this.secondPassThreshold  = secondPassThreshold;
    }

    public ResolutionPath route(int finalConfidence) {
        if (finalConfidence >= autoResolveThreshold) return ResolutionPath.AUTO_RESOLVE;
        if (finalConfidence >= secondPassThreshold)  return ResolutionPath.SECOND_PASS;
        return ResolutionPath.MANUAL_REVIEW;
    }
}
