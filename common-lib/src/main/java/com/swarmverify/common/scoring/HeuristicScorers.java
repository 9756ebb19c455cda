package com.swarmverify.common.scoring;

import com.swarmverify.common.consensus.ConsensusResult;
import com.swarmverify.common.model.Outcome;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Keyword and calendar heuristics for the three non-LLM scoring dimensions.
 *
 * <p><b>Consistency</b>
 * <pre>
 *   score = 100 − 8 × (words contradicting the outcome in the rationale)
 *   score += 10 when more than one agent voted for the outcome
 * </pre>
 * AMBIGUOUS has no contradicting vocabulary.
 *
 * <p><b>Timestamp plausibility</b>
 * <pre>
 *   resolution date reached      → 100
 *   at most 7 days in the future → 70
 *   further out                  → 30
 * </pre>
 *
 * <p><b>Sentiment / bias</b>
 * <pre>
 *   score = 100 − 15 × (absolutist words in the rationale)
 * </pre>
 *
 * <p>All scores are clamped to [0, 100]. Stateless and thread-safe.
 */
public final class HeuristicScorers {

    static final int CONTRADICTION_PENALTY = 8;
    static final int AGREEMENT_BONUS       = 10;
    static final int ABSOLUTIST_PENALTY    = 15;
    static final long NEAR_FUTURE_DAYS     = 7;

    static final List<String> NEGATIVE_WORDS   = List.of("no", "not", "false", "failed", "unsuccessful", "rejected");
    static final List<String> POSITIVE_WORDS   = List.of("yes", "true", "successful", "approved", "confirmed");
    static final List<String> ABSOLUTIST_WORDS = List.of("obviously", "clearly", "definitely", "undoubtedly", "always", "never");

    private static final Pattern NEGATIVE_PATTERN   = keywordPattern(NEGATIVE_WORDS);
    private static final Pattern POSITIVE_PATTERN   = keywordPattern(POSITIVE_WORDS);
    private static final Pattern ABSOLUTIST_PATTERN = keywordPattern(ABSOLUTIST_WORDS);

    private HeuristicScorers() {}

    public static int consistency(ConsensusResult consensus) {
        String rationale = consensus.rationale();
        int score = 100;
        if (consensus.outcome() == Outcome.YES) {
            score -= countKeywords(rationale, NEGATIVE_PATTERN) * CONTRADICTION_PENALTY;
        } else if (consensus.outcome() == Outcome.NO) {
            score -= countKeywords(rationale, POSITIVE_PATTERN) * CONTRADICTION_PENALTY;
        }
        if (consensus.votesFor(consensus.outcome()) > 1) {
            score += AGREEMENT_BONUS;
        }
        return clamp(score);
    }

    public static int timestamp(LocalDate resolutionDate, Clock clock) {
        if (resolutionDate == null) return 100;
        Instant resolvesAt = resolutionDate.atStartOfDay(ZoneOffset.UTC).toInstant();
        Instant now = clock.instant();
        if (!resolvesAt.isAfter(now)) return 100;
        Duration until = Duration.between(now, resolvesAt);
        return until.compareTo(Duration.ofDays(NEAR_FUTURE_DAYS)) > 0 ? 30 : 70;
    }

    public static int sentiment(String rationale) {
        int hits = countKeywords(rationale, ABSOLUTIST_PATTERN);
        return clamp(100 - hits * ABSOLUTIST_PENALTY);
    }

    /**
     * Compiles {@code keywords} into one whole-word, case-insensitive alternation.
     * Compile once per list and reuse with {@link #countKeywords(String, Pattern)}.
     */
    public static Pattern keywordPattern(List<String> keywords) {
        if (keywords.isEmpty()) {
            throw new IllegalArgumentException("keywords must not be empty");
        }
        String alternation = keywords.stream()
            .sorted(Comparator.comparingInt(String::length).reversed())
            .map(Pattern::quote)
            .collect(Collectors.joining("|"));
        return Pattern.compile("\\b(?:" + alternation + ")\\b", Pattern.CASE_INSENSITIVE);
    }

    /** Occurrences of any keyword compiled into {@code keywords}. */
    public static int countKeywords(String text, Pattern keywords) {
        if (text == null || text.isEmpty()) return 0;
        int count = 0;
        Matcher m = keywords.matcher(text);
        while (m.find()) count++;
        return count;
    }

    private static int clamp(int score) {
        return Math.max(0, Math.min(100, score));
    }
}
