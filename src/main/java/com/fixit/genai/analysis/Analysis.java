package com.fixit.genai.analysis;

import com.fixit.genai.llm.ModelResponse;

import java.util.List;

/**
 * Score in [0,1] with the evidence behind it.
 *
 * @param score     clamped to [0,1] on construction
 * @param evidence  human readable reasons, in order of relevance
 * @param mode      which path produced the score
 * @param modelCall metadata of the model call, null on heuristic paths
 */
public record Analysis(double score, List<String> evidence, AnalysisMode mode, ModelResponse modelCall) {

    public Analysis {
        score = clamp(score);
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }

    public static Analysis heuristic(double score, List<String> evidence) {
        return new Analysis(score, evidence, AnalysisMode.HEURISTIC, null);
    }

    public Analysis withMode(AnalysisMode newMode) {
        return new Analysis(score, evidence, newMode, modelCall);
    }

    public static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
