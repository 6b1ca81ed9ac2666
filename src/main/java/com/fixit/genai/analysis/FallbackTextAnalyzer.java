package com.fixit.genai.analysis;

import com.fixit.genai.exception.ModelUnavailableException;
import lombok.extern.slf4j.Slf4j;

/**
 * Decorator that tries a model-backed analyser and falls back to a heuristic one.
 * <p>
 * On fallback the heuristic result is returned as-is, only its mode becomes
 * {@link AnalysisMode#DEGRADED}; score and evidence are identical to a pure heuristic run.
 * </p>
 */
@Slf4j
public class FallbackTextAnalyzer<I> implements TextAnalyzer<I> {

    private final String name;
    private final TextAnalyzer<I> primary;
    private final TextAnalyzer<I> fallback;

    public FallbackTextAnalyzer(String name, TextAnalyzer<I> primary, TextAnalyzer<I> fallback) {
        this.name = name;
        this.primary = primary;
        this.fallback = fallback;
    }

    @Override
    public Analysis analyze(I input) {
        try {
            return primary.analyze(input);
        } catch (ModelUnavailableException e) {
            log.warn("[{}] model unavailable ({}), using heuristic analysis: {}",
                    name, e.getKind(), e.getMessage());
            return fallback.analyze(input).withMode(AnalysisMode.DEGRADED);
        }
    }

    /** Runs the heuristic alone, for callers that opted out of the model. */
    public Analysis analyzeHeuristically(I input) {
        return fallback.analyze(input);
    }
}
