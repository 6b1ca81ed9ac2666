package com.fixit.genai.analysis;

/**
 * Turns a piece of text (lead notes, a transcript) into a scored {@link Analysis}.
 * <p>
 * Two families exist: model-backed analysers, which may throw
 * {@link com.fixit.genai.exception.ModelUnavailableException}, and heuristic ones, which
 * are total. {@link FallbackTextAnalyzer} composes one of each.
 * </p>
 *
 * @param <I> analysed input
 */
@FunctionalInterface
public interface TextAnalyzer<I> {

    Analysis analyze(I input);
}
