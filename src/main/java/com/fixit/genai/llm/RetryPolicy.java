package com.fixit.genai.llm;

import com.fixit.genai.exception.ConfigurationException;

import java.time.Duration;

/**
 * Bounded exponential backoff for model calls.
 *
 * @param maxAttempts    attempts in total, including the first; 1 disables retrying
 * @param initialBackoff wait before the second attempt, doubled for each further one
 * @param maxBackoff     cap on a single wait
 */
public record RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new ConfigurationException("llm max_retries must be at least 1 but was " + maxAttempts);
        }
        if (initialBackoff == null || initialBackoff.isNegative()
                || maxBackoff == null || maxBackoff.compareTo(initialBackoff) < 0) {
            throw new ConfigurationException("llm retry backoff must satisfy 0 <= initial <= max but was "
                    + initialBackoff + " / " + maxBackoff);
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofSeconds(2), Duration.ofSeconds(10));
    }

    /** Wait after the given failed attempt (1-based). */
    public Duration backoffAfter(int attempt) {
        long millis = initialBackoff.toMillis();
        for (int i = 1; i < attempt && millis < maxBackoff.toMillis(); i++) {
            millis *= 2;
        }
        return Duration.ofMillis(Math.min(millis, maxBackoff.toMillis()));
    }
}
