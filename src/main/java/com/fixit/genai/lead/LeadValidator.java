package com.fixit.genai.lead;

import com.fixit.genai.exception.ValidationException;

import java.util.HashSet;
import java.util.Set;

/**
 * Rejects malformed batches before any scoring happens.
 */
final class LeadValidator {

    private LeadValidator() {
    }

    static void validate(LeadBatch batch) {
        if (batch == null) {
            throw new ValidationException("Lead batch is required");
        }
        if (batch.maxResults() < 1) {
            throw new ValidationException("max_results must be at least 1 but was " + batch.maxResults());
        }
        Set<String> seen = new HashSet<>();
        for (Lead lead : batch.leads()) {
            validate(lead);
            if (!seen.add(lead.leadId())) {
                throw new ValidationException("Duplicate lead_id '" + lead.leadId() + "'");
            }
        }
    }

    static void validate(Lead lead) {
        if (lead == null) {
            throw new ValidationException("Lead entries must not be null");
        }
        if (lead.leadId() == null || lead.leadId().isBlank()) {
            throw new ValidationException("lead_id is required");
        }
        String id = lead.leadId();
        if (lead.status() == null) {
            throw new ValidationException("Lead " + id + ": status is required");
        }
        if (Double.isNaN(lead.budget()) || lead.budget() < 0) {
            throw new ValidationException("Lead " + id + ": budget must be non-negative but was " + lead.budget());
        }
        if (lead.minutesSinceActivity() < 0) {
            throw new ValidationException("Lead " + id + ": last_activity_minutes_ago must be non-negative but was "
                    + lead.minutesSinceActivity());
        }
        if (lead.pastInteractions() < 0) {
            throw new ValidationException("Lead " + id + ": past_interactions must be non-negative but was "
                    + lead.pastInteractions());
        }
    }
}
