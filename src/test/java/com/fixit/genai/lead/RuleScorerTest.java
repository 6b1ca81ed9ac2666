package com.fixit.genai.lead;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.offset;

class RuleScorerTest {

    private final RuleScorer scorer = new RuleScorer();

    @Nested
    @DisplayName("Recency")
    class Recency {

        @ParameterizedTest(name = "{0} minutes -> {1}")
        @CsvSource({"0, 1.0", "29, 1.0", "30, 0.85", "59, 0.85", "60, 0.70", "239, 0.70",
                "240, 0.50", "1439, 0.50", "1440, 0.25", "10079, 0.25", "10080, 0.10", "500000, 0.10"})
        void steps(long minutes, double expected) {
            assertThat(scorer.recency(minutes).score()).isEqualTo(expected);
        }

        @Test
        @DisplayName("should never increase as activity gets older")
        void monotonic() {
            double previous = Double.MAX_VALUE;
            for (long minutes = 0; minutes <= 20_000; minutes += 7) {
                double score = scorer.recency(minutes).score();
                assertThat(score).isLessThanOrEqualTo(previous);
                previous = score;
            }
        }
    }

    @Nested
    @DisplayName("Engagement")
    class Engagement {

        @Test
        @DisplayName("should add the status bonus to the interaction share")
        void bonus() {
            assertThat(scorer.engagement(5, LeadStatus.CONTACTED).score()).isEqualTo(0.6, offset(1e-9));
            assertThat(scorer.engagement(0, LeadStatus.NEW).score()).isEqualTo(0.0);
            assertThat(scorer.engagement(3, LeadStatus.FOLLOW_UP).score()).isEqualTo(0.45, offset(1e-9));
        }

        @Test
        @DisplayName("should cap at 1.0")
        void capped() {
            assertThat(scorer.engagement(40, LeadStatus.QUALIFIED).score()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should describe the engagement level")
        void reasons() {
            assertThat(scorer.engagement(5, LeadStatus.NEW).reason()).isEqualTo("Highly engaged (5 interactions)");
            assertThat(scorer.engagement(2, LeadStatus.NEW).reason()).startsWith("Moderate engagement");
            assertThat(scorer.engagement(1, LeadStatus.NEW).reason()).startsWith("Low engagement");
        }
    }

    @Nested
    @DisplayName("Source")
    class Source {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({"referral, 1.0", "walk-in, 0.9", "Walk_In, 0.9", "portal, 0.75", "magicbricks, 0.75",
                "housing.com, 0.7", "website, 0.6", "social_media, 0.4"})
        void table(String source, double expected) {
            assertThat(scorer.source(source).score()).isEqualTo(expected);
        }

        @Test
        @DisplayName("should fall back to a mid score for unknown or missing sources")
        void unknown() {
            assertThat(scorer.source("carrier pigeon").score()).isEqualTo(RuleScorer.UNKNOWN_SOURCE_SCORE);
            assertThat(scorer.source(null).score()).isEqualTo(RuleScorer.UNKNOWN_SOURCE_SCORE);
        }

        @Test
        @DisplayName("should label high-quality sources")
        void reason() {
            assertThat(scorer.source("referral").reason()).isEqualTo("High-quality source (referral)");
        }
    }

    @Nested
    @DisplayName("Budget")
    class Budget {

        @Test
        @DisplayName("should score 1.5Cr as a good budget")
        void goodBudget() {
            SubScore score = scorer.budget(15_000_000);

            assertThat(score.score()).isEqualTo(0.70);
            assertThat(score.reason()).isEqualTo("Good budget (₹1.5Cr)");
        }

        @Test
        @DisplayName("should never decrease as the budget grows")
        void monotonic() {
            double previous = -1;
            for (double budget = 0; budget <= 100_000_000; budget += 250_000) {
                double score = scorer.budget(budget).score();
                assertThat(score).isGreaterThanOrEqualTo(previous);
                previous = score;
            }
        }
    }
}
