package com.fixit.genai.config;

import com.fixit.genai.exception.ConfigurationException;

final class WeightChecks {

    static final double SUM_TOLERANCE = 1e-6;

    private WeightChecks() {
    }

    static void requireUnitSum(String group, String[] names, double[] weights) {
        double sum = 0.0;
        for (int i = 0; i < weights.length; i++) {
            requireUnitInterval(group + " weight '" + names[i] + "'", weights[i]);
            sum += weights[i];
        }
        if (Math.abs(sum - 1.0) > SUM_TOLERANCE) {
            throw new ConfigurationException(
                    "The " + group + " weights must sum to 1.0 but sum to " + sum);
        }
    }

    static void requireUnitInterval(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new ConfigurationException(name + " must be within [0,1] but was " + value);
        }
    }
}
