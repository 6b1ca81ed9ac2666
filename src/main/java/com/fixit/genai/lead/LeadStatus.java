package com.fixit.genai.lead;

import com.fixit.genai.exception.ValidationException;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Pipeline status of a lead. The engagement bonus rewards leads further down the funnel.
 */
public enum LeadStatus {
    NEW("new", 0.0),
    CONTACTED("contacted", 0.10),
    FOLLOW_UP("follow_up", 0.15),
    QUALIFIED("qualified", 0.20);

    private final String label;
    private final double engagementBonus;

    LeadStatus(String label, double engagementBonus) {
        this.label = label;
        this.engagementBonus = engagementBonus;
    }

    public String getLabel() {
        return label;
    }

    public double getEngagementBonus() {
        return engagementBonus;
    }

    /**
     * Unlike sources, statuses have no safe default: an unknown status is rejected.
     */
    public static LeadStatus fromLabel(String label) {
        if (label != null) {
            String normalized = label.strip().toLowerCase(Locale.ROOT).replace('-', '_');
            for (LeadStatus status : values()) {
                if (status.label.equals(normalized)) {
                    return status;
                }
            }
        }
        throw new ValidationException("Unknown lead status '" + label + "', expected one of "
                + Arrays.stream(values()).map(LeadStatus::getLabel).collect(Collectors.joining(", ")));
    }
}
