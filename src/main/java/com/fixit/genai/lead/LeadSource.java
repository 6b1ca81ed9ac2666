package com.fixit.genai.lead;

import java.util.Locale;
import java.util.Set;

/**
 * Where a lead came from. Free-text source labels map onto these groups; anything
 * unrecognised becomes {@link #OTHER} rather than an error.
 */
public enum LeadSource {
    REFERRAL(Set.of("referral")),
    WALK_IN(Set.of("walk-in", "walk_in", "walkin")),
    PORTAL(Set.of("portal", "magicbricks", "99acres")),
    HOUSING_PORTAL(Set.of("housing.com", "housing")),
    WEBSITE(Set.of("website")),
    SOCIAL(Set.of("social", "social_media", "social-media")),
    OTHER(Set.of());

    private final Set<String> labels;

    LeadSource(Set<String> labels) {
        this.labels = labels;
    }

    public static LeadSource fromLabel(String label) {
        if (label == null) {
            return OTHER;
        }
        String normalized = label.strip().toLowerCase(Locale.ROOT);
        for (LeadSource source : values()) {
            if (source.labels.contains(normalized)) {
                return source;
            }
        }
        return OTHER;
    }
}
