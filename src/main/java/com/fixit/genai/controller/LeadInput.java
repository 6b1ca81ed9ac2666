package com.fixit.genai.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fixit.genai.exception.ValidationException;
import com.fixit.genai.lead.Lead;
import com.fixit.genai.lead.LeadStatus;

/**
 * Wire form of a lead. Numeric fields are boxed so a missing value is reported, not defaulted.
 */
public record LeadInput(
        @JsonProperty("lead_id")                   String leadId,
        @JsonProperty("source")                    String source,
        @JsonProperty("budget")                    Double budget,
        @JsonProperty("city")                      String city,
        @JsonProperty("property_type")             String propertyType,
        @JsonProperty("last_activity_minutes_ago") Long lastActivityMinutesAgo,
        @JsonProperty("past_interactions")         Integer pastInteractions,
        @JsonProperty("notes")                     String notes,
        @JsonProperty("status")                    String status
) {

    public Lead toLead() {
        return new Lead(
                leadId,
                source,
                require(budget, "budget"),
                city,
                propertyType,
                require(lastActivityMinutesAgo, "last_activity_minutes_ago"),
                require(pastInteractions, "past_interactions"),
                notes == null ? "" : notes,
                LeadStatus.fromLabel(status));
    }

    private <T> T require(T value, String field) {
        if (value == null) {
            throw new ValidationException("Lead '" + leadId + "': " + field + " is required");
        }
        return value;
    }
}
