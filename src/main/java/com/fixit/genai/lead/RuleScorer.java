package com.fixit.genai.lead;

import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * The four deterministic lead dimensions: recency, engagement, source and budget.
 * <p>
 * All functions are total: any valid {@link Lead} yields a score in [0,1] and a reason.
 * Recency is non-increasing in minutes, budget non-decreasing in amount.
 * </p>
 */
@Component
public class RuleScorer {

    static final double CRORE = 10_000_000.0;
    static final double LAKH = 100_000.0;
    static final double UNKNOWN_SOURCE_SCORE = 0.5;

    private static final Map<LeadSource, Double> SOURCE_SCORES = new EnumMap<>(LeadSource.class);

    static {
        SOURCE_SCORES.put(LeadSource.REFERRAL, 1.0);
        SOURCE_SCORES.put(LeadSource.WALK_IN, 0.9);
        SOURCE_SCORES.put(LeadSource.PORTAL, 0.75);
        SOURCE_SCORES.put(LeadSource.HOUSING_PORTAL, 0.7);
        SOURCE_SCORES.put(LeadSource.WEBSITE, 0.6);
        SOURCE_SCORES.put(LeadSource.SOCIAL, 0.4);
    }

    public SubScore recency(long minutesAgo) {
        if (minutesAgo < 30) {
            return new SubScore(1.0, "Very recent activity (< 30 mins)");
        } else if (minutesAgo < 60) {
            return new SubScore(0.85, "Recent activity (< 1 hour)");
        } else if (minutesAgo < 240) {
            return new SubScore(0.70, "Activity within 4 hours");
        } else if (minutesAgo < 1440) {
            return new SubScore(0.50, "Activity within 24 hours");
        } else if (minutesAgo < 10080) {
            return new SubScore(0.25, "Activity within 7 days");
        }
        return new SubScore(0.10, "Old lead (> 7 days since activity)");
    }

    /**
     * Ten interactions saturate the interaction part; the status bonus is added on top, capped at 1.0.
     */
    public SubScore engagement(int pastInteractions, LeadStatus status) {
        double interactionScore = Math.min(pastInteractions / 10.0, 1.0);
        double score = Math.min(interactionScore + status.getEngagementBonus(), 1.0);

        String reason;
        if (pastInteractions >= 5) {
            reason = "Highly engaged (" + pastInteractions + " interactions)";
        } else if (pastInteractions >= 2) {
            reason = "Moderate engagement (" + pastInteractions + " interactions)";
        } else {
            reason = "Low engagement (" + pastInteractions + " interactions)";
        }
        return new SubScore(score, reason);
    }

    public SubScore source(String sourceLabel) {
        double score = SOURCE_SCORES.getOrDefault(LeadSource.fromLabel(sourceLabel), UNKNOWN_SOURCE_SCORE);
        String shown = sourceLabel == null || sourceLabel.isBlank() ? "unknown" : sourceLabel.strip();

        if (score >= 0.9) {
            return new SubScore(score, "High-quality source (" + shown + ")");
        } else if (score >= 0.7) {
            return new SubScore(score, "Good source (" + shown + ")");
        }
        return new SubScore(score, "Standard source (" + shown + ")");
    }

    public SubScore budget(double budget) {
        double crores = budget / CRORE;
        if (crores >= 5) {
            return new SubScore(1.0, String.format(Locale.ROOT, "Premium budget (₹%.1fCr)", crores));
        } else if (crores >= 2) {
            return new SubScore(0.85, String.format(Locale.ROOT, "High budget (₹%.1fCr)", crores));
        } else if (crores >= 1) {
            return new SubScore(0.70, String.format(Locale.ROOT, "Good budget (₹%.1fCr)", crores));
        } else if (crores >= 0.5) {
            return new SubScore(0.55, String.format(Locale.ROOT, "Moderate budget (₹%.0fL)", budget / LAKH));
        }
        return new SubScore(0.40, String.format(Locale.ROOT, "Lower budget segment (₹%.0fL)", budget / LAKH));
    }
}
