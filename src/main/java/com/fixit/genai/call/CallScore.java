package com.fixit.genai.call;

import com.fixit.genai.state.StageResult;

import java.util.List;
import java.util.Map;

/**
 * Aggregated numbers of a call, before the summary is written.
 *
 * @param results         stage results that completed, by stage
 * @param degradedStages  stages that failed and were scored with the neutral default
 * @param heuristicStages stages scored by the heuristic because the model was unavailable
 */
public record CallScore(
        CallLabels labels,
        double qualityScore,
        boolean isGoodCall,
        Map<CallStage, StageResult> results,
        List<String> degradedStages,
        List<String> heuristicStages
) {

    public CallScore {
        results = Map.copyOf(results);
        degradedStages = List.copyOf(degradedStages);
        heuristicStages = List.copyOf(heuristicStages);
    }

    public boolean isDegraded() {
        return !degradedStages.isEmpty() || !heuristicStages.isEmpty();
    }
}
