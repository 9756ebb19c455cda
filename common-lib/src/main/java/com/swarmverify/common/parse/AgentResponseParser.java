package com.swarmverify.common.parse;

import com.swarmverify.common.model.AgentResult;
import com.swarmverify.common.model.Outcome;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tolerant extractor for the line-oriented format every reasoning prompt asks for:
 *
 * <pre>
 *   OUTCOME: YES|NO|AMBIGUOUS
 *   CONFIDENCE: &lt;0-100&gt;
 *   RATIONALE: &lt;text&gt;
 *   SOURCES: &lt;urls&gt;
 * </pre>
 *
 * <p>Agent text is untrusted input. No method in this class throws: a missing or
 * malformed field yields the caller-supplied default, so a parse failure looks exactly
 * like an agent that honestly answered AMBIGUOUS with its role's default confidence.
 */
public final class AgentResponseParser {

    private static final Pattern OUTCOME      = Pattern.compile("OUTCOME:\\s*(YES|NO|AMBIGUOUS)", Pattern.CASE_INSENSITIVE);
    private static final Pattern CONFIDENCE   = Pattern.compile("CONFIDENCE:\\s*(\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern SCORE        = Pattern.compile("SCORE:\\s*(\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern RATIONALE    = Pattern.compile("RATIONALE:\\s*(.+?)(?=SOURCES:|$)",
                                                                Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern SOURCES      = Pattern.compile("SOURCES:\\s*(.+?)$",
                                                                Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern VERIFICATION = Pattern.compile("VERIFICATION:\\s*(.+?)$",
                                                                Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern URL          = Pattern.compile("https?://[^\\s)]+");

    private AgentResponseParser() {}

    /**
     * Parses a full agent response with {@link Outcome#AMBIGUOUS} as the outcome default.
     *
     * @param text              raw response, may be {@code null}
     * @param defaultConfidence role-specific confidence used when none is present
     */
    public static ParsedResponse parse(String text, int defaultConfidence) {
        return parse(text, Outcome.AMBIGUOUS, defaultConfidence);
    }

    public static ParsedResponse parse(String text, Outcome defaultOutcome, int defaultConfidence) {
        return new ParsedResponse(
            outcome(text, defaultOutcome),
            confidence(text, defaultConfidence),
            rationale(text),
            extractSources(section(SOURCES, text)));
    }

    public static Outcome outcome(String text, Outcome fallback) {
        return Outcome.fromLabel(section(OUTCOME, text), fallback);
    }

    /** {@code CONFIDENCE:} value clamped to [0, 100], or {@code fallback}. */
    public static int confidence(String text, int fallback) {
        return integer(CONFIDENCE, text).orElse(fallback);
    }

    /** {@code SCORE:} value clamped to [0, 100], or {@code fallback}. */
    public static int score(String text, int fallback) {
        return integer(SCORE, text).orElse(fallback);
    }

    public static String rationale(String text) {
        return section(RATIONALE, text).trim();
    }

    public static String verification(String text) {
        return section(VERIFICATION, text).trim();
    }

    /** Up to {@value AgentResult#MAX_SOURCES} URLs found anywhere in {@code text}. */
    public static List<String> extractSources(String text) {
        List<String> urls = new ArrayList<>();
        if (text == null || text.isEmpty()) return urls;
        Matcher m = URL.matcher(text);
        while (m.find() && urls.size() < AgentResult.MAX_SOURCES) {
            urls.add(m.group());
        }
        return urls;
    }

    private static OptionalInt integer(Pattern pattern, String text) {
        String raw = section(pattern, text);
        if (raw.isEmpty()) return OptionalInt.empty();
        try {
            int value = Integer.parseInt(raw);
            return OptionalInt.of(Math.max(0, Math.min(100, value)));
        } catch (NumberFormatException e) {
            // overflow
            return OptionalInt.empty();
        }
    }

    private static String section(Pattern pattern, String text) {
        if (text == null || text.isEmpty()) return "";
        Matcher m = pattern.matcher(text);
        return m.find() ? m.group(1) : "";
    }
}
