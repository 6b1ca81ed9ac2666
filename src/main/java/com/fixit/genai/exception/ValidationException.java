package com.fixit.genai.exception;

/**
 * Raised when a lead batch or call transcript is malformed or out of range.
 * Thrown before any scoring starts; never coerced into a default.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
