package com.fixit.genai.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-dimension weights of the lead priority score. Must sum to 1.0.
 */
public record LeadWeights(
        @JsonProperty("recency")    double recency,
        @JsonProperty("engagement") double engagement,
        @JsonProperty("source")     double source,
        @JsonProperty("budget")     double budget,
        @JsonProperty("notes")      double notes
) {

    public LeadWeights {
        WeightChecks.requireUnitSum("lead",
                new String[] {"recency", "engagement", "source", "budget", "notes"},
                new double[] {recency, engagement, source, budget, notes});
    }

    public static LeadWeights defaults() {
        return new LeadWeights(0.25, 0.20, 0.15, 0.20, 0.20);
    }
}
