package com.fixit.genai.call;

import com.fixit.genai.llm.ModelResponse;

import java.util.List;

/**
 * Narrative part of a verdict.
 *
 * @param modelCall null when the summary was templated
 */
public record CallSummary(String summary, List<String> keyPoints, List<String> nextActions, ModelResponse modelCall) {

    public CallSummary {
        keyPoints = List.copyOf(keyPoints);
        nextActions = List.copyOf(nextActions);
    }
}
