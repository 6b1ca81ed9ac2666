package com.fixit.genai.llm;

import com.fixit.genai.exception.ModelUnavailableException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * Test double answering every prompt through a function; never touches the network.
 */
public class ScriptedModelClient implements ModelClient {

    private final Function<ModelRequest, String> script;
    private final List<ModelRequest> requests = Collections.synchronizedList(new ArrayList<>());

    public ScriptedModelClient(Function<ModelRequest, String> script) {
        this.script = script;
    }

    public static ScriptedModelClient answering(String text) {
        return new ScriptedModelClient(request -> text);
    }

    public static ScriptedModelClient failing(FailureKind kind) {
        return new ScriptedModelClient(request -> {
            throw new ModelUnavailableException(kind, "scripted " + kind);
        });
    }

    @Override
    public ModelResponse generate(ModelRequest request) {
        requests.add(request);
        return new ModelResponse(script.apply(request), modelName(), 12L, 100, 20);
    }

    @Override
    public String modelName() {
        return "scripted-model";
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    public List<ModelRequest> getRequests() {
        return List.copyOf(requests);
    }
}
