package com.swarmverify.common.exception;

public class MarketNotFoundException extends RuntimeException {
    private final String marketId;

    public MarketNotFoundException(String marketId) {
        super("Market not found: " + marketId);
        this.marketId = marketId;
    }

    public MarketNotFoundException(String marketId, String message) {
        super(message);
        this.marketId = marketId;
    }

    public String getMarketId() {
        return marketId;
    }
}
