package com.fixit.genai.llm;

/**
 * Raw text returned by the model plus call metadata. Token counts are null when the
 * backend does not report usage.
 */
public record ModelResponse(
        String text,
        String modelName,
        long latencyMs,
        Integer inputTokens,
        Integer outputTokens
) {
}
