package com.fixit.genai.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-stage weights of the call quality score. Compliance is applied to {@code 1 - risk}.
 */
public record CallWeights(
        @JsonProperty("rapport")        double rapport,
        @JsonProperty("needDiscovery")  double needDiscovery,
        @JsonProperty("closing")        double closing,
        @JsonProperty("compliance")     double compliance
) {

    public CallWeights {
        WeightChecks.requireUnitSum("call",
                new String[] {"rapport", "needDiscovery", "closing", "compliance"},
                new double[] {rapport, needDiscovery, closing, compliance});
    }

    public static CallWeights defaults() {
        return new CallWeights(0.25, 0.30, 0.30, 0.15);
    }
}
