package com.swarmverify.common.model;

import java.time.LocalDate;

/**
 * Length-bounded, quote-escaped copy of a {@link Market}.
 * The only form of market text that is ever placed into a reasoning-backend prompt.
 *
 * @see com.swarmverify.common.parse.MarketSanitizer
 */
public record SanitizedMarket(
    String id,
    String title,
    String description,
    String category,
    LocalDate resolutionDate
) {}
