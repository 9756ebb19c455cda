package com.swarmverify.common.scoring;

import com.swarmverify.common.consensus.ConsensusResult;
import com.swarmverify.common.model.Outcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

class HeuristicScorersTest {

    private static ConsensusResult consensus(Outcome outcome, String rationale, int votesForOutcome) {
        return new ConsensusResult(outcome, 80, rationale, List.of(), Map.of(outcome, votesForOutcome));
    }

    // ── consistency ───────────────────────────────────────────────────────

    @Nested
    @DisplayName("consistency()")
    class Consistency {

        @Test
        @DisplayName("YES penalised 8 per negation word, +10 for agreement")
        void yesWithNegations() {
            // "not", "failed" → −16, two agreeing agents → +10
            int score = HeuristicScorers.consistency(
                consensus(Outcome.YES, "It did not stall and nothing failed.", 2));
            assertEquals(94, score);
        }

        @Test
        @DisplayName("NO penalised per affirmative word")
        void noWithAffirmatives() {
            int score = HeuristicScorers.consistency(
                consensus(Outcome.NO, "Reports confirmed it was approved, yes.", 1));
            assertEquals(76, score);
        }

        @Test
        @DisplayName("words inside other words do not count")
        void wholeWordsOnly() {
            int score = HeuristicScorers.consistency(consensus(Outcome.YES, "Notable knowledge", 1));
            assertEquals(100, score);
        }

        @Test
        @DisplayName("AMBIGUOUS has no contradicting vocabulary; bonus still capped at 100")
        void ambiguousCapped() {
            assertEquals(100, HeuristicScorers.consistency(consensus(Outcome.AMBIGUOUS, "no not false", 3)));
        }

        @Test
        @DisplayName("score never drops below zero")
        void floorsAtZero() {
            String rationale = "no ".repeat(20);
            assertEquals(0, HeuristicScorers.consistency(consensus(Outcome.YES, rationale, 1)));
        }
    }

    // ── timestamp ─────────────────────────────────────────────────────────

    @Nested
    @DisplayName("timestamp()")
    class Timestamp {

        private final Clock clock = Clock.fixed(Instant.parse("2026-05-10T12:00:00Z"), ZoneOffset.UTC);

        @Test
        void pastDate() {
            assertEquals(100, HeuristicScorers.timestamp(LocalDate.of(2026, 5, 1), clock));
        }

        @Test
        void todayAlreadyStarted() {
            assertEquals(100, HeuristicScorers.timestamp(LocalDate.of(2026, 5, 10), clock));
        }

        @Test
        void withinAWeek() {
            assertEquals(70, HeuristicScorers.timestamp(LocalDate.of(2026, 5, 17), clock));
        }

        @Test
        void furtherOut() {
            assertEquals(30, HeuristicScorers.timestamp(LocalDate.of(2026, 6, 30), clock));
        }

        @Test
        void missingDate() {
            assertEquals(100, HeuristicScorers.timestamp(null, clock));
        }
    }

    // ── sentiment ─────────────────────────────────────────────────────────

    @Nested
    @DisplayName("sentiment()")
    class Sentiment {

        @Test
        void hedgedRationale() {
            assertEquals(100, HeuristicScorers.sentiment("Evidence suggests the vote likely passed."));
        }

        @Test
        void absolutistRationale() {
            assertEquals(55, HeuristicScorers.sentiment("Obviously it will always pass, definitely."));
        }

        @Test
        void floorsAtZero() {
            assertEquals(0, HeuristicScorers.sentiment("never ".repeat(10)));
        }
    }

    // ── keyword patterns ──────────────────────────────────────────────────

    @Nested
    @DisplayName("keywordPattern() / countKeywords()")
    class Keywords {

        private final Pattern negations = HeuristicScorers.keywordPattern(List.of("no", "not", "unsuccessful"));

        @Test
        @DisplayName("prefix-sharing keywords each count once per whole word")
        void prefixSharingKeywords() {
            assertEquals(3, HeuristicScorers.countKeywords("No, it was NOT held; the bid was unsuccessful.", negations));
        }

        @Test
        void partialWordsIgnored() {
            assertEquals(0, HeuristicScorers.countKeywords("Nothing noted; notably successful.", negations));
        }

        @Test
        void regexMetacharactersAreLiteral() {
            Pattern dotted = HeuristicScorers.keywordPattern(List.of("u.s"));
            assertEquals(1, HeuristicScorers.countKeywords("the u.s agreed", dotted));
            assertEquals(0, HeuristicScorers.countKeywords("the uks agreed", dotted));
        }

        @Test
        void nullOrEmptyTextCountsZero() {
            assertEquals(0, HeuristicScorers.countKeywords(null, negations));
            assertEquals(0, HeuristicScorers.countKeywords("", negations));
        }

        @Test
        void emptyKeywordListRejected() {
            assertThrows(IllegalArgumentException.class, () -> HeuristicScorers.keywordPattern(List.of()));
        }
    }

    // ── blend ─────────────────────────────────────────────────────────────

    @Test
    @DisplayName("blend uses 0.45 / 0.25 / 0.20 / 0.10 and rounds")
    void blend() {
        // 0.45·90 + 0.25·94 + 0.20·100 + 0.10·100 = 40.5 + 23.5 + 20 + 10 = 94
        assertEquals(94, ScoringWeights.DEFAULT.blend(90, 94, 100, 100));
        // 0.45·75 + 0.25·100 + 0.20·70 + 0.10·85 = 33.75 + 25 + 14 + 8.5 = 81.25
        assertEquals(81, ScoringWeights.DEFAULT.blend(75, 100, 70, 85));
    }
}
