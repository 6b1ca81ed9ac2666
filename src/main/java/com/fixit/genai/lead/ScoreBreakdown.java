package com.fixit.genai.lead;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fixit.genai.analysis.AnalysisMode;

import java.util.List;

/**
 * Full audit trail of one lead's priority score.
 *
 * @param recencyScore    recency sub-score
 * @param engagementScore engagement sub-score
 * @param sourceScore     source quality sub-score
 * @param budgetScore     budget sub-score
 * @param notesScore      notes/urgency sub-score
 * @param priorityScore   weighted total of the five sub-scores
 * @param bucket          hot / warm / cold for {@code priorityScore}
 * @param reasons         rule reasons first, then notes reasons
 * @param notesMode       how the notes sub-score was produced
 */
public record ScoreBreakdown(
        @JsonProperty("recency_score")    double recencyScore,
        @JsonProperty("engagement_score") double engagementScore,
        @JsonProperty("source_score")     double sourceScore,
        @JsonProperty("budget_score")     double budgetScore,
        @JsonProperty("notes_score")      double notesScore,
        @JsonProperty("priority_score")   double priorityScore,
        @JsonProperty("priority_bucket")  PriorityBucket bucket,
        @JsonProperty("reasons")          List<String> reasons,
        @JsonProperty("notes_mode")       AnalysisMode notesMode
) {

    public ScoreBreakdown {
        reasons = List.copyOf(reasons);
    }
}
