package com.fixit.genai.llm;

import com.fixit.genai.exception.ModelUnavailableException;

/**
 * Stand-in used when {@code fixit.llm.enabled=false}: every call fails fast, so all
 * analysers run on their heuristic path.
 */
public class DisabledModelClient implements ModelClient {

    public static final String MODEL_NAME = "deterministic";

    @Override
    public ModelResponse generate(ModelRequest request) {
        throw new ModelUnavailableException(FailureKind.UNREACHABLE, "Model backend is disabled");
    }

    @Override
    public String modelName() {
        return MODEL_NAME;
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
