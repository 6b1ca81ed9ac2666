package com.fixit.genai.llm;

/**
 * Capability boundary to the generative-text backend.
 * <p>
 * Only {@link RetryingModelClient} retries; fallback policy belongs to callers. Every
 * implementation must return or fail within {@link ModelRequest#timeout()} plus a small
 * overhead, whether or not the backend honours the timeout itself.
 * </p>
 */
public interface ModelClient {

    /**
     * Sends one prompt.
     *
     * @return the model's text, never blank
     * @throws com.fixit.genai.exception.ModelUnavailableException on timeout, transport
     *         failure or an empty answer
     */
    ModelResponse generate(ModelRequest request);

    /** Name reported in response metadata ("deterministic" when no model is configured). */
    String modelName();

    /** Cheap liveness check for health endpoints. */
    boolean isAvailable();
}
