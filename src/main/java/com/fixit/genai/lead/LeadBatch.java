package com.fixit.genai.lead;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Leads to rank, in caller order, and how many of the ranked leads to return.
 */
public record LeadBatch(List<Lead> leads, int maxResults) {

    public static final int DEFAULT_MAX_RESULTS = 10;

    public LeadBatch {
        leads = leads == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(leads));
    }
}
