package com.fixit.genai.llm;

import com.fixit.genai.exception.ModelUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Retries transient model failures (TIMEOUT, UNREACHABLE) with exponential backoff.
 * <p>
 * The request timeout is the budget for all attempts together: each attempt gets what is
 * left of it, and no backoff is started that would end past it. A malformed answer is
 * never retried.
 * </p>
 */
public class RetryingModelClient implements ModelClient {

    private static final Logger log = LoggerFactory.getLogger(RetryingModelClient.class);

    private final ModelClient delegate;
    private final RetryPolicy policy;

    public RetryingModelClient(ModelClient delegate, RetryPolicy policy) {
        this.delegate = delegate;
        this.policy = policy;
    }

    @Override
    public ModelResponse generate(ModelRequest request) {
        long deadline = System.nanoTime() + request.timeout().toNanos();
        int attempt = 1;
        while (true) {
            Duration remaining = Duration.ofNanos(deadline - System.nanoTime());
            try {
                return delegate.generate(new ModelRequest(request.systemPrompt(), request.userPrompt(), remaining));
            } catch (ModelUnavailableException e) {
                if (e.getKind() == FailureKind.MALFORMED_RESPONSE || attempt >= policy.maxAttempts()) {
                    throw e;
                }
                Duration backoff = policy.backoffAfter(attempt);
                Duration left = Duration.ofNanos(deadline - System.nanoTime());
                if (left.compareTo(backoff) <= 0) {
                    throw e;
                }
                log.warn("Model {} attempt {}/{} failed ({}), retrying in {}ms",
                        delegate.modelName(), attempt, policy.maxAttempts(), e.getKind(), backoff.toMillis());
                sleep(backoff, e);
                attempt++;
            }
        }
    }

    @Override
    public String modelName() {
        return delegate.modelName();
    }

    @Override
    public boolean isAvailable() {
        return delegate.isAvailable();
    }

    private static void sleep(Duration backoff, ModelUnavailableException lastFailure) {
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw lastFailure;
        }
    }
}
