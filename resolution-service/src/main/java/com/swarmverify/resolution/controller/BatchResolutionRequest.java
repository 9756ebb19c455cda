package com.swarmverify.resolution.controller;

import java.util.List;

public record BatchResolutionRequest(List<String> marketIds) {

    public BatchResolutionRequest {
        marketIds = marketIds != null ? List.copyOf(marketIds) : List.of();
    }
}
