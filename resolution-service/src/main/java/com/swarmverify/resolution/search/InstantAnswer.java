package com.swarmverify.resolution.search;

/** Abstract section of an instant-answer search response. Fields are never {@code null}. */
public record InstantAnswer(String abstractText, String abstractUrl) {

    public InstantAnswer {
        abstractText = abstractText != null ? abstractText : "";
        abstractUrl  = abstractUrl != null ? abstractUrl : "";
    }
}
