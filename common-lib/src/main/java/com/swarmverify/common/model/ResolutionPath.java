package com.swarmverify.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Terminal state of a resolution call, derived from the final blended confidence.
 *
 * @see com.swarmverify.common.routing.ConfidenceRouter
 */
public enum ResolutionPath {

    AUTO_RESOLVE("auto-resolve"),
    SECOND_PASS("second-pass"),
    MANUAL_REVIEW("manual-review");

    private final String label;

    ResolutionPath(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static ResolutionPath fromLabel(String label) {
        for (ResolutionPath path : values()) {
            if (path.label.equalsIgnoreCase(label) || path.name().equalsIgnoreCase(label)) {
                return path;
            }
        }
        throw new IllegalArgumentException("Unknown resolution path: " + label);
    }
}
