package com.swarmverify.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.LocalDate;

/**
 * Prediction-market question as stored by the external ledger.
 * Read-only for the duration of a resolution call.
 */
public record Market(
    @JsonProperty("id") String id,
    @JsonProperty("title") String title,
    @JsonProperty("description") String description,
    @JsonProperty("category") String category,
    @JsonProperty("resolutionDate") LocalDate resolutionDate
) {
    public static Market of(String id, String title, String description,
                            String category, LocalDate resolutionDate) {
        return new Market(id, title, description, category, resolutionDate);
    }
}
