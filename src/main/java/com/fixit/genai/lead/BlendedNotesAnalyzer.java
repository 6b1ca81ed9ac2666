package com.fixit.genai.lead;

import com.fixit.genai.analysis.Analysis;
import com.fixit.genai.analysis.AnalysisMode;
import com.fixit.genai.analysis.TextAnalyzer;

import java.util.ArrayList;
import java.util.List;

/**
 * Weighted blend of the model's notes score with the keyword score:
 * {@code modelWeight * model + (1 - modelWeight) * keywords}. Keyword reasons are kept
 * after the model's reasons so keyword evidence is never lost.
 */
public class BlendedNotesAnalyzer implements TextAnalyzer<String> {

    private final TextAnalyzer<String> model;
    private final TextAnalyzer<String> heuristic;
    private final double modelWeight;

    public BlendedNotesAnalyzer(TextAnalyzer<String> model, TextAnalyzer<String> heuristic, double modelWeight) {
        this.model = model;
        this.heuristic = heuristic;
        this.modelWeight = modelWeight;
    }

    @Override
    public Analysis analyze(String notes) {
        Analysis fromModel = model.analyze(notes);
        Analysis fromKeywords = heuristic.analyze(notes);

        double blended = modelWeight * fromModel.score() + (1.0 - modelWeight) * fromKeywords.score();
        List<String> reasons = new ArrayList<>(fromModel.evidence());
        for (String reason : fromKeywords.evidence()) {
            if (!reasons.contains(reason)) {
                reasons.add(reason);
            }
        }
        return new Analysis(blended, reasons, AnalysisMode.HYBRID, fromModel.modelCall());
    }
}
