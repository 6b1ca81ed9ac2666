package com.fixit.genai.call;

import com.fasterxml.jackson.databind.JsonNode;
import com.fixit.genai.analysis.Analysis;
import com.fixit.genai.analysis.AnalysisMode;
import com.fixit.genai.analysis.ModelBackedAnalyzer;
import com.fixit.genai.llm.ModelClient;
import com.fixit.genai.llm.ModelOutputParser;
import com.fixit.genai.llm.ModelResponse;
import com.fixit.genai.llm.PromptTemplates;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Asks the model to rate one call dimension. Expects {@code {"score": .., "evidence": ".."}}.
 */
public class ModelStageAnalyzer extends ModelBackedAnalyzer<ParsedTranscript> {

    private final CallStage stage;

    public ModelStageAnalyzer(CallStage stage, ModelClient modelClient, ModelOutputParser parser, Duration timeout) {
        super(modelClient, parser, timeout);
        this.stage = stage;
    }

    @Override
    protected String systemPrompt() {
        return PromptTemplates.CALL_SYSTEM;
    }

    @Override
    protected String userPrompt(ParsedTranscript transcript) {
        return render(PromptTemplates.CALL_STAGE, Map.of(
                "dimension", stage.getNodeName(),
                "criteria", stage.getCriteria(),
                "direction", stage.direction(),
                "transcript", transcript.text()));
    }

    @Override
    protected Analysis toAnalysis(JsonNode json, ModelResponse response) {
        double score = parser.readUnitScore(json, "score");
        String evidence = parser.readText(json, "evidence", "");
        return new Analysis(score, evidence.isBlank() ? List.of() : List.of(evidence), AnalysisMode.MODEL, response);
    }
}
