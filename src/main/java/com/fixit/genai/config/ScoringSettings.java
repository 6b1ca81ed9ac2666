package com.fixit.genai.config;

import com.fixit.genai.exception.ConfigurationException;

import java.time.Duration;

/**
 * The one configuration value shared by every scoring component.
 * <p>
 * Immutable and validated on construction: an invalid combination never reaches a
 * scoring call. Built once by {@link ScoringConfig} from {@code application.yml};
 * tests build it directly via {@link #defaults()} and the {@code with*} copies.
 * </p>
 *
 * @param hotThreshold      minimum total for the "hot" bucket
 * @param warmThreshold     minimum total for the "warm" bucket
 * @param goodCallThreshold minimum quality for a call to count as good
 * @param llmTimeout        timeout applied to every model call
 * @param notesModelWeight  share of the model score when model and keyword notes scores are blended
 * @param leadWeights       lead dimension weights
 * @param callWeights       call stage weights
 */
public record ScoringSettings(
        double hotThreshold,
        double warmThreshold,
        double goodCallThreshold,
        Duration llmTimeout,
        double notesModelWeight,
        LeadWeights leadWeights,
        CallWeights callWeights
) {

    public ScoringSettings {
        WeightChecks.requireUnitInterval("hot_threshold", hotThreshold);
        WeightChecks.requireUnitInterval("warm_threshold", warmThreshold);
        WeightChecks.requireUnitInterval("good_call_threshold", goodCallThreshold);
        WeightChecks.requireUnitInterval("notes_model_weight", notesModelWeight);
        if (warmThreshold > hotThreshold) {
            throw new ConfigurationException("warm_threshold (" + warmThreshold
                    + ") must not exceed hot_threshold (" + hotThreshold + ")");
        }
        if (llmTimeout == null || llmTimeout.isZero() || llmTimeout.isNegative()) {
            throw new ConfigurationException("llm_timeout_ms must be positive but was " + llmTimeout);
        }
        if (leadWeights == null || callWeights == null) {
            throw new ConfigurationException("lead and call weights are required");
        }
    }

    public static ScoringSettings defaults() {
        return new ScoringSettings(0.7, 0.4, 0.6, Duration.ofSeconds(60), 0.6,
                LeadWeights.defaults(), CallWeights.defaults());
    }

    public ScoringSettings withLlmTimeout(Duration timeout) {
        return new ScoringSettings(hotThreshold, warmThreshold, goodCallThreshold, timeout,
                notesModelWeight, leadWeights, callWeights);
    }

    public ScoringSettings withThresholds(double hot, double warm) {
        return new ScoringSettings(hot, warm, goodCallThreshold, llmTimeout,
                notesModelWeight, leadWeights, callWeights);
    }

    public ScoringSettings withGoodCallThreshold(double threshold) {
        return new ScoringSettings(hotThreshold, warmThreshold, threshold, llmTimeout,
                notesModelWeight, leadWeights, callWeights);
    }
}
