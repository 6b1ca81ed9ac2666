package com.fixit.genai.analysis;

/**
 * How an {@link Analysis} was produced.
 */
public enum AnalysisMode {
    /** Model answer only. */
    MODEL,
    /** Model answer blended with keyword evidence. */
    HYBRID,
    /** Heuristic only, by choice. */
    HEURISTIC,
    /** Heuristic only because the model was unavailable. */
    DEGRADED;

    public boolean usedModel() {
        return this == MODEL || this == HYBRID;
    }
}
