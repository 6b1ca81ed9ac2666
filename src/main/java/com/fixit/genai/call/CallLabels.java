package com.fixit.genai.call;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-dimension labels of a call, each in [0,1]. {@code complianceRisk}: higher is worse.
 */
public record CallLabels(
        @JsonProperty("rapport_building") double rapportBuilding,
        @JsonProperty("need_discovery")   double needDiscovery,
        @JsonProperty("closing_attempt")  double closingAttempt,
        @JsonProperty("compliance_risk")  double complianceRisk
) {

    public double get(CallStage stage) {
        switch (stage) {
            case RAPPORT_BUILDING:
                return rapportBuilding;
            case NEED_DISCOVERY:
                return needDiscovery;
            case CLOSING_ATTEMPT:
                return closingAttempt;
            case COMPLIANCE_RISK:
                return complianceRisk;
            default:
                throw new IllegalArgumentException("Unknown stage " + stage);
        }
    }
}
