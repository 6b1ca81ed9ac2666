package com.fixit.genai.call;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Model usage across one call evaluation. Latency and tokens are summed over all model
 * calls that succeeded; token counts stay null when the backend reported none.
 */
public record ModelMetadata(
        @JsonProperty("model_name")    String modelName,
        @JsonProperty("latency_ms")    long latencyMs,
        @JsonProperty("input_tokens")  Integer inputTokens,
        @JsonProperty("output_tokens") Integer outputTokens
) {
}
