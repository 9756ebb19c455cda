package com.swarmverify.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-market entry of a batch run. Failed markets carry only {@code marketId},
 * {@code status} and {@code error}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BatchResolutionItem(
    @JsonProperty("marketId") String marketId,
    @JsonProperty("status") Status status,
    @JsonProperty("outcome") Outcome outcome,
    @JsonProperty("confidence") Integer confidence,
    @JsonProperty("path") ResolutionPath path,
    @JsonProperty("error") String error,
    @JsonProperty("secondPass") SecondPassReview secondPass
) {
    public enum Status {
        @JsonProperty("success") SUCCESS,
        @JsonProperty("failed") FAILED
    }

    public static BatchResolutionItem success(String marketId, Resolution resolution,
                                              SecondPassReview secondPass) {
        return new BatchResolutionItem(marketId, Status.SUCCESS, resolution.outcome(),
                                       resolution.confidence(), resolution.path(), null, secondPass);
    }

    public static BatchResolutionItem failed(String marketId, String error) {
        return new BatchResolutionItem(marketId, Status.FAILED, null, null, null, error, null);
    }
}
