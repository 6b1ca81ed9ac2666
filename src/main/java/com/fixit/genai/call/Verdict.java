package com.fixit.genai.call;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fixit.genai.state.StageOutput;

import java.util.List;

/**
 * Final result of a call evaluation.
 */
public record Verdict(
        @JsonProperty("call_id")         String callId,
        @JsonProperty("lead_id")         String leadId,
        @JsonProperty("quality_score")   double qualityScore,
        @JsonProperty("labels")          CallLabels labels,
        @JsonProperty("is_good_call")    boolean isGoodCall,
        @JsonProperty("summary")         String summary,
        @JsonProperty("key_points")      List<String> keyPoints,
        @JsonProperty("next_actions")    List<String> nextActions,
        @JsonProperty("degraded_stages") List<String> degradedStages,
        @JsonProperty("heuristic_stages") List<String> heuristicStages,
        @JsonProperty("model_metadata")  ModelMetadata modelMetadata
) implements StageOutput {

    public static final String STAGE_NAME = "aggregate";

    public Verdict {
        keyPoints = List.copyOf(keyPoints);
        nextActions = List.copyOf(nextActions);
        degradedStages = List.copyOf(degradedStages);
        heuristicStages = List.copyOf(heuristicStages);
    }

    @Override
    public String stageName() {
        return STAGE_NAME;
    }
}
