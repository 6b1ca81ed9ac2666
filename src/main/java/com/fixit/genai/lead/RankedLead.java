package com.fixit.genai.lead;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RankedLead(
        @JsonProperty("lead_id")   String leadId,
        @JsonProperty("breakdown") ScoreBreakdown breakdown
) {
}
