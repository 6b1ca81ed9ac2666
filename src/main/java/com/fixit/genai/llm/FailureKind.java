package com.fixit.genai.llm;

public enum FailureKind {
    TIMEOUT,
    UNREACHABLE,
    MALFORMED_RESPONSE
}
