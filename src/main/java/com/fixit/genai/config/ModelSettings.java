package com.fixit.genai.config;

/**
 * Connection settings of the generative backend. The core only uses them to build the
 * {@link com.fixit.genai.llm.ModelClient}; connection lifecycle stays with LangChain4j.
 *
 * @param enabled     when false the application runs in pure heuristic mode
 * @param baseUrl     OpenAI-compatible endpoint (Ollama serves one under {@code /v1})
 * @param modelName   model identifier, reported in response metadata
 * @param apiKey      key sent to the backend; Ollama ignores it
 * @param maxTokens   cap on generated tokens per call
 * @param temperature sampling temperature, kept low for stable scores
 */
public record ModelSettings(
        boolean enabled,
        String baseUrl,
        String modelName,
        String apiKey,
        int maxTokens,
        double temperature
) {
}
