package com.fixit.genai.lead;

import com.fixit.genai.analysis.Analysis;
import com.fixit.genai.analysis.AnalysisMode;
import com.fixit.genai.config.ScoringSettings;
import com.fixit.genai.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;

class PriorityAggregatorTest {

    private final PriorityAggregator aggregator = new PriorityAggregator(ScoringSettings.defaults());

    private static SubScore sub(double score) {
        return new SubScore(score, "r" + score);
    }

    private static ScoredLead scored(String id, double total, long minutes) {
        Lead lead = new Lead(id, "referral", 1, "Pune", "2BHK", minutes, 0, "", LeadStatus.NEW);
        ScoreBreakdown breakdown = new ScoreBreakdown(0, 0, 0, 0, 0, total, PriorityBucket.COLD,
                List.of(), AnalysisMode.HEURISTIC);
        return new ScoredLead(lead, breakdown);
    }

    @Nested
    @DisplayName("aggregate")
    class Aggregate {

        @Test
        @DisplayName("should equal the weighted sum of the sub-scores")
        void weightedSum() {
            ScoreBreakdown breakdown = aggregator.aggregate(sub(0.85), sub(0.6), sub(1.0), sub(0.7),
                    Analysis.heuristic(0.85, List.of("notes")));

            double expected = 0.25 * 0.85 + 0.20 * 0.6 + 0.15 * 1.0 + 0.20 * 0.7 + 0.20 * 0.85;
            assertThat(breakdown.priorityScore()).isEqualTo(expected, offset(1e-9));
            assertThat(breakdown.bucket()).isEqualTo(PriorityBucket.HOT);
            assertThat(breakdown.reasons()).containsExactly("r0.85", "r0.6", "r1.0", "r0.7", "notes");
        }

        @Test
        @DisplayName("should place totals in buckets by threshold")
        void buckets() {
            assertThat(aggregator.aggregate(sub(0.8), sub(0.8), sub(0.8), sub(0.8),
                    Analysis.heuristic(0.8, List.of())).bucket()).isEqualTo(PriorityBucket.HOT);
            assertThat(aggregator.aggregate(sub(0.55), sub(0.55), sub(0.55), sub(0.55),
                    Analysis.heuristic(0.55, List.of())).bucket()).isEqualTo(PriorityBucket.WARM);
            assertThat(aggregator.aggregate(sub(0.1), sub(0.1), sub(0.1), sub(0.1),
                    Analysis.heuristic(0.1, List.of())).bucket()).isEqualTo(PriorityBucket.COLD);
        }

        @Test
        @DisplayName("should put a total that sums exactly to a threshold in the higher bucket")
        void thresholdBoundary() {
            ScoreBreakdown breakdown = aggregator.aggregate(sub(0.1), sub(0.3), sub(0.5), sub(0.7),
                    Analysis.heuristic(0.5, List.of()));

            assertThat(breakdown.priorityScore()).isEqualTo(0.4);
            assertThat(breakdown.bucket()).isEqualTo(PriorityBucket.WARM);
        }

        @Test
        @DisplayName("should mark notes read heuristically because the model was down")
        void degradedNotes() {
            Analysis notes = Analysis.heuristic(0.5, List.of("No notes available")).withMode(AnalysisMode.DEGRADED);

            ScoreBreakdown breakdown = aggregator.aggregate(sub(1), sub(1), sub(1), sub(1), notes);

            assertThat(breakdown.reasons()).last().isEqualTo(PriorityAggregator.DEGRADED_NOTES_REASON);
            assertThat(breakdown.notesMode()).isEqualTo(AnalysisMode.DEGRADED);
        }
    }

    @Nested
    @DisplayName("rank")
    class Rank {

        @Test
        @DisplayName("should sort by total, then recency, then lead id, and truncate")
        void ordering() {
            List<RankedLead> ranked = aggregator.rank(List.of(
                    scored("L3", 0.5, 10),
                    scored("L1", 0.9, 100),
                    scored("L4", 0.5, 10),
                    scored("L2", 0.5, 5)), 3);

            assertThat(ranked).extracting(RankedLead::leadId).containsExactly("L1", "L2", "L3");
        }

        @Test
        @DisplayName("should reject max_results below 1")
        void invalidMax() {
            assertThatThrownBy(() -> aggregator.rank(List.of(), 0)).isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> aggregator.rank(List.of(), -3)).isInstanceOf(ValidationException.class);
        }
    }
}
