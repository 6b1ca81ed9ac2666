package com.fixit.genai.lead;

/**
 * A lead paired with its breakdown, before ranking.
 */
public record ScoredLead(Lead lead, ScoreBreakdown breakdown) {
}
