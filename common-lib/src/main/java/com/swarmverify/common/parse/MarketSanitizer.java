package com.swarmverify.common.parse;

import com.swarmverify.common.model.Market;
import com.swarmverify.common.model.SanitizedMarket;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Produces the prompt-safe form of a {@link Market}.
 *
 * <p>Market titles and descriptions are user-authored, so every free-text field is
 * truncated and its double quotes escaped before it is interpolated into a quoted
 * prompt section. Truncation happens before escaping, so an escaped field may exceed
 * its limit by the number of quotes it contained.
 */
public final class MarketSanitizer {

    public static final int MAX_TITLE_LENGTH       = 200;
    public static final int MAX_DESCRIPTION_LENGTH = 300;
    public static final int MAX_CATEGORY_LENGTH    = 50;

    private MarketSanitizer() {}

    public static SanitizedMarket sanitize(Market market, Clock clock) {
        LocalDate resolutionDate = market.resolutionDate() != null
            ? market.resolutionDate()
            : LocalDate.now(clock);
        return new SanitizedMarket(
            market.id(),
            clean(market.title(), MAX_TITLE_LENGTH),
            clean(market.description(), MAX_DESCRIPTION_LENGTH),
            clean(market.category(), MAX_CATEGORY_LENGTH),
            resolutionDate);
    }

    static String clean(String value, int maxLength) {
        if (value == null) return "";
        String truncated = value.length() > maxLength ? value.substring(0, maxLength) : value;
        return truncated.replace("\"", "\\\"");
    }
}
