package com.fixit.genai.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fixit.genai.exception.ValidationException;
import com.fixit.genai.lead.LeadBatch;

import java.util.List;

public record LeadPriorityRequest(
        @JsonProperty("leads")       List<LeadInput> leads,
        @JsonProperty("max_results") Integer maxResults
) {

    public LeadBatch toBatch() {
        if (leads == null) {
            throw new ValidationException("leads is required");
        }
        return new LeadBatch(
                leads.stream().map(LeadInput::toLead).toList(),
                maxResults == null ? LeadBatch.DEFAULT_MAX_RESULTS : maxResults);
    }
}
