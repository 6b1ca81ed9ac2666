package com.fixit.genai.lead;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record LeadPriorityResult(
        @JsonProperty("ranked_leads")    List<RankedLead> rankedLeads,
        @JsonProperty("total_processed") int totalProcessed,
        @JsonProperty("model_metadata")  ScoringMetadata metadata
) {

    public LeadPriorityResult {
        rankedLeads = List.copyOf(rankedLeads);
    }
}
