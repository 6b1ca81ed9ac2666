package com.fixit.genai.lead;

/**
 * A sales lead as received from the caller. Never modified by scoring.
 *
 * @param leadId               unique identifier within a batch
 * @param source               source label as given ("referral", "magicbricks", ...)
 * @param budget               budget in INR, non-negative
 * @param city                 city of interest
 * @param propertyType         2BHK, villa, ...
 * @param minutesSinceActivity minutes since the last activity, non-negative
 * @param pastInteractions     number of past interactions, non-negative
 * @param notes                free-text agent notes, may be empty
 * @param status               funnel status
 */
public record Lead(
        String leadId,
        String source,
        double budget,
        String city,
        String propertyType,
        long minutesSinceActivity,
        int pastInteractions,
        String notes,
        LeadStatus status
) {
}
