package com.fixit.genai.lead;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fixit.genai.config.LeadWeights;

/**
 * What a ranking was computed with, returned next to the ranking for auditability.
 * {@code llm_enabled} is true only when the model scored at least one lead's notes.
 */
public record ScoringMetadata(
        @JsonProperty("model_used")      String modelUsed,
        @JsonProperty("llm_enabled")     boolean llmEnabled,
        @JsonProperty("scoring_weights") LeadWeights weights,
        @JsonProperty("hot_threshold")   double hotThreshold,
        @JsonProperty("warm_threshold")  double warmThreshold
) {
}
