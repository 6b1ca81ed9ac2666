package com.fixit.genai.lead;

import com.fixit.genai.analysis.Analysis;
import com.fixit.genai.analysis.AnalysisMode;
import com.fixit.genai.config.LeadWeights;
import com.fixit.genai.config.ScoringSettings;
import com.fixit.genai.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Combines the five sub-scores into the priority score and ranks scored leads.
 */
@Component
@RequiredArgsConstructor
public class PriorityAggregator {

    static final String DEGRADED_NOTES_REASON = "Notes analysed heuristically (model unavailable)";

    /** Highest total first, then the more recent activity, then lead id. */
    static final Comparator<ScoredLead> RANKING = Comparator
            .comparingDouble((ScoredLead scored) -> scored.breakdown().priorityScore()).reversed()
            .thenComparingLong(scored -> scored.lead().minutesSinceActivity())
            .thenComparing(scored -> scored.lead().leadId());

    private final ScoringSettings settings;

    public ScoreBreakdown aggregate(SubScore recency, SubScore engagement, SubScore source,
                                    SubScore budget, Analysis notes) {
        LeadWeights weights = settings.leadWeights();
        double total = weights.recency() * recency.score()
                + weights.engagement() * engagement.score()
                + weights.source() * source.score()
                + weights.budget() * budget.score()
                + weights.notes() * notes.score();
        total = roundScore(Analysis.clamp(total));

        List<String> reasons = new ArrayList<>();
        reasons.add(recency.reason());
        reasons.add(engagement.reason());
        reasons.add(source.reason());
        reasons.add(budget.reason());
        reasons.addAll(notes.evidence());
        if (notes.mode() == AnalysisMode.DEGRADED) {
            reasons.add(DEGRADED_NOTES_REASON);
        }

        return new ScoreBreakdown(
                recency.score(),
                engagement.score(),
                source.score(),
                budget.score(),
                notes.score(),
                total,
                PriorityBucket.of(total, settings),
                reasons,
                notes.mode());
    }

    /** Drops floating-point noise so a total that sums to a threshold lands in its bucket. */
    static double roundScore(double score) {
        return Math.round(score * 1e9) / 1e9;
    }

    /**
     * Sorts by {@link #RANKING} and keeps the first {@code maxResults}.
     *
     * @throws ValidationException if {@code maxResults < 1}
     */
    public List<RankedLead> rank(List<ScoredLead> scored, int maxResults) {
        if (maxResults < 1) {
            throw new ValidationException("max_results must be at least 1 but was " + maxResults);
        }
        return scored.stream()
                .sorted(RANKING)
                .limit(maxResults)
                .map(s -> new RankedLead(s.lead().leadId(), s.breakdown()))
                .toList();
    }
}
