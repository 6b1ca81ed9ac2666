package com.fixit.genai.exception;

import com.fixit.genai.llm.FailureKind;

/**
 * The model backend could not produce a usable answer.
 * <p>
 * Only thrown from the model boundary. Callers always catch it and switch to the
 * heuristic path; it never reaches the REST layer.
 * </p>
 */
public class ModelUnavailableException extends RuntimeException {

    private final FailureKind kind;

    public ModelUnavailableException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ModelUnavailableException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FailureKind getKind() {
        return kind;
    }
}
