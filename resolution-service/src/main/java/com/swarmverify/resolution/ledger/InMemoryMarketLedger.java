package com.swarmverify.resolution.ledger;

import com.swarmverify.common.model.Market;
import com.swarmverify.common.model.Resolution;
import com.swarmverify.common.model.SecondPassReview;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/** Process-local {@link MarketLedger}. Contents are lost on restart. */
public class InMemoryMarketLedger implements MarketLedger {

    private final Map<String, Market> markets = new ConcurrentHashMap<>();
    private final Map<String, List<Resolution>> resolutions = new ConcurrentHashMap<>();
    private final Map<String, List<SecondPassReview>> reviews = new ConcurrentHashMap<>();

    @Override
    public Optional<Market> findMarket(String marketId) {
        return Optional.ofNullable(markets.get(marketId));
    }

    @Override
    public void saveMarket(Market market) {
        markets.put(market.id(), market);
    }

    @Override
    public void recordResolution(String marketId, Resolution resolution) {
        resolutions.computeIfAbsent(marketId, id -> new CopyOnWriteArrayList<>()).add(resolution);
    }

    @Override
    public void recordSecondPass(String marketId, SecondPassReview review) {
        reviews.computeIfAbsent(marketId, id -> new CopyOnWriteArrayList<>()).add(review);
    }

    @Override
    public Optional<Resolution> latestResolution(String marketId) {
        List<Resolution> history = resolutions.getOrDefault(marketId, List.of());
        return history.isEmpty() ? Optional.empty() : Optional.of(history.get(history.size() - 1));
    }

    @Override
    public List<SecondPassReview> secondPassReviews(String marketId) {
        return List.copyOf(reviews.getOrDefault(marketId, List.of()));
    }

    @Override
    public List<Market> unresolvedDueMarkets(LocalDate asOf) {
        List<Market> due = new ArrayList<>();
        for (Market market : markets.values()) {
            if (resolutions.containsKey(market.id())) continue;
            if (market.resolutionDate() != null && !market.resolutionDate().isAfter(asOf)) {
                due.add(market);
            }
        }
        due.sort(Comparator.comparing(Market::resolutionDate).thenComparing(Market::id));
        return due;
    }
}
