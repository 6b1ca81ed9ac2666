package com.fixit.genai.call;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The four independent analysis stages of a call evaluation.
 */
public enum CallStage {
    RAPPORT_BUILDING("rapport_building",
            "Did the agent greet properly, show empathy, personalize the conversation?",
            false),
    NEED_DISCOVERY("need_discovery",
            "Did the agent ask relevant questions to understand customer requirements (budget, location, timeline, property type)?",
            false),
    CLOSING_ATTEMPT("closing_attempt",
            "Did the agent attempt to close with clear next steps, commitment, or booking?",
            false),
    COMPLIANCE_RISK("compliance_risk",
            "Any false promises, guaranteed returns, pressure tactics, or unprofessional behavior?",
            true);

    private final String nodeName;
    private final String criteria;
    private final boolean inverted;

    CallStage(String nodeName, String criteria, boolean inverted) {
        this.nodeName = nodeName;
        this.criteria = criteria;
        this.inverted = inverted;
    }

    @JsonValue
    public String getNodeName() {
        return nodeName;
    }

    public String getCriteria() {
        return criteria;
    }

    /** Label as a quality contribution: inverted stages count as {@code 1 - label}. */
    public double quality(double label) {
        return inverted ? 1.0 - label : label;
    }

    public String direction() {
        return inverted ? "Higher means MORE risk (lower is better)." : "Higher is better.";
    }
}
