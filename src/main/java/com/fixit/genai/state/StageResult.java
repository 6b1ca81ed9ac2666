package com.fixit.genai.state;

import com.fixit.genai.analysis.Analysis;
import com.fixit.genai.analysis.AnalysisMode;
import com.fixit.genai.call.CallStage;
import com.fixit.genai.llm.ModelResponse;

import java.util.List;

/**
 * Output of one analysis stage of the call workflow.
 *
 * @param label     stage score in [0,1]
 * @param modelCall null unless the model produced the label
 */
public record StageResult(
        CallStage stage,
        double label,
        List<String> evidence,
        AnalysisMode mode,
        ModelResponse modelCall
) implements StageOutput {

    public StageResult {
        evidence = List.copyOf(evidence);
    }

    public static StageResult of(CallStage stage, Analysis analysis) {
        return new StageResult(stage, analysis.score(), analysis.evidence(), analysis.mode(), analysis.modelCall());
    }

    @Override
    public String stageName() {
        return stage.getNodeName();
    }
}
