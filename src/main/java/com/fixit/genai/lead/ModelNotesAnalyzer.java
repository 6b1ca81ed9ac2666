package com.fixit.genai.lead;

import com.fasterxml.jackson.databind.JsonNode;
import com.fixit.genai.analysis.Analysis;
import com.fixit.genai.analysis.AnalysisMode;
import com.fixit.genai.analysis.ModelBackedAnalyzer;
import com.fixit.genai.llm.ModelClient;
import com.fixit.genai.llm.ModelOutputParser;
import com.fixit.genai.llm.ModelResponse;
import com.fixit.genai.llm.PromptTemplates;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Asks the model to rate lead notes. Expects {@code {"score": .., "reasons": [..], "red_flags": [..]}}.
 */
public class ModelNotesAnalyzer extends ModelBackedAnalyzer<String> {

    public ModelNotesAnalyzer(ModelClient modelClient, ModelOutputParser parser, Duration timeout) {
        super(modelClient, parser, timeout);
    }

    @Override
    protected String systemPrompt() {
        return null;
    }

    @Override
    protected String userPrompt(String notes) {
        return render(PromptTemplates.LEAD_NOTES, Map.of("notes", notes));
    }

    @Override
    protected Analysis toAnalysis(JsonNode json, ModelResponse response) {
        double score = parser.readUnitScore(json, "score");
        List<String> reasons = new ArrayList<>(parser.readStrings(json, "reasons"));
        List<String> redFlags = parser.readStrings(json, "red_flags");
        if (!redFlags.isEmpty()) {
            reasons.add("Red flags: " + String.join(", ", redFlags));
        }
        return new Analysis(score, reasons, AnalysisMode.MODEL, response);
    }
}
