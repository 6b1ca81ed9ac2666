package com.fixit.genai.lead;

import com.fixit.genai.analysis.Analysis;
import com.fixit.genai.analysis.FallbackTextAnalyzer;
import com.fixit.genai.config.ScoringSettings;
import com.fixit.genai.llm.ModelClient;
import com.fixit.genai.llm.ModelOutputParser;
import org.springframework.stereotype.Component;

/**
 * Fifth lead dimension: urgency and intent read from the free-text notes.
 * <p>
 * Empty notes skip the model; there is nothing for it to read.
 * </p>
 */
@Component
public class NotesScorer {

    private final FallbackTextAnalyzer<String> analyzer;

    public NotesScorer(ModelClient modelClient,
                       ModelOutputParser parser,
                       HeuristicNotesAnalyzer heuristic,
                       ScoringSettings settings) {
        ModelNotesAnalyzer model = new ModelNotesAnalyzer(modelClient, parser, settings.llmTimeout());
        this.analyzer = new FallbackTextAnalyzer<>("lead-notes",
                new BlendedNotesAnalyzer(model, heuristic, settings.notesModelWeight()),
                heuristic);
    }

    public Analysis score(String notes, boolean useModel) {
        if (!useModel || notes == null || notes.isBlank()) {
            return analyzer.analyzeHeuristically(notes);
        }
        return analyzer.analyze(notes);
    }
}
