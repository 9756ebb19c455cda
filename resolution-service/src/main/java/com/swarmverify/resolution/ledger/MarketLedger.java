package com.swarmverify.resolution.ledger;

import com.swarmverify.common.model.Market;
import com.swarmverify.common.model.Resolution;
import com.swarmverify.common.model.SecondPassReview;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Storage port for markets and resolution evidence. The engine only reads markets and
 * appends evidence; payouts and market state transitions belong to the owner of this port.
 */
public interface MarketLedger {

    Optional<Market> findMarket(String marketId);

    void saveMarket(Market market);

    void recordResolution(String marketId, Resolution resolution);

    /** Stored next to the first-pass resolution, never replacing it. */
    void recordSecondPass(String marketId, SecondPassReview review);

    Optional<Resolution> latestResolution(String marketId);

    List<SecondPassReview> secondPassReviews(String marketId);

    /** Markets with no recorded resolution whose resolution date is on or before {@code asOf}. */
    List<Market> unresolvedDueMarkets(LocalDate asOf);
}
