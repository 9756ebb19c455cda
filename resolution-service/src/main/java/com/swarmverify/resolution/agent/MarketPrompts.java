package com.swarmverify.resolution.agent;

import com.swarmverify.common.model.SanitizedMarket;

/** Prompt fragments shared by the reasoning-backed agents. */
public final class MarketPrompts {

    public static final String OUTPUT_FORMAT = """
        Output format:
        OUTCOME: YES|NO|AMBIGUOUS
        CONFIDENCE: <0-100>
        RATIONALE: <detailed explanation>
        SOURCES: <any relevant URLs or references>""";

    private MarketPrompts() {}

    public static String describe(SanitizedMarket market) {
        return "Market Title: \"" + market.title() + "\"\n"
             + "Description: \"" + market.description() + "\"\n"
             + "Resolution Date: " + market.resolutionDate() + "\n"
             + "Category: " + market.category();
    }

    public static String excerpt(String text, int maxChars) {
        if (text == null) return "";
        return text.length() <= maxChars ? text : text.substring(0, maxChars);
    }
}
