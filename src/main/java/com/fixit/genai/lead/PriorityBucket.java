package com.fixit.genai.lead;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fixit.genai.config.ScoringSettings;

public enum PriorityBucket {
    HOT("hot"),
    WARM("warm"),
    COLD("cold");

    private final String label;

    PriorityBucket(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public static PriorityBucket of(double total, ScoringSettings settings) {
        if (total >= settings.hotThreshold()) {
            return HOT;
        }
        if (total >= settings.warmThreshold()) {
            return WARM;
        }
        return COLD;
    }
}
