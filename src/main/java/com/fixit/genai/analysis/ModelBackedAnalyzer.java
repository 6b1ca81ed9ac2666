package com.fixit.genai.analysis;

import com.fasterxml.jackson.databind.JsonNode;
import com.fixit.genai.llm.ModelClient;
import com.fixit.genai.llm.ModelOutputParser;
import com.fixit.genai.llm.ModelRequest;
import com.fixit.genai.llm.ModelResponse;
import dev.langchain4j.model.input.PromptTemplate;

import java.time.Duration;
import java.util.Map;

/**
 * Base for analysers that ask the model for a JSON verdict.
 * <p>
 * Subclasses provide the prompt and map the parsed JSON to an {@link Analysis}. Timeouts,
 * transport failures and unparseable answers surface as
 * {@link com.fixit.genai.exception.ModelUnavailableException}.
 * </p>
 */
public abstract class ModelBackedAnalyzer<I> implements TextAnalyzer<I> {

    protected final ModelClient modelClient;
    protected final ModelOutputParser parser;
    private final Duration timeout;

    protected ModelBackedAnalyzer(ModelClient modelClient, ModelOutputParser parser, Duration timeout) {
        this.modelClient = modelClient;
        this.parser = parser;
        this.timeout = timeout;
    }

    @Override
    public Analysis analyze(I input) {
        ModelRequest request = new ModelRequest(systemPrompt(), userPrompt(input), timeout);
        ModelResponse response = modelClient.generate(request);
        JsonNode json = parser.parseObject(response.text());
        return toAnalysis(json, response);
    }

    /** May return null when the prompt needs no system message. */
    protected abstract String systemPrompt();

    protected abstract String userPrompt(I input);

    protected abstract Analysis toAnalysis(JsonNode json, ModelResponse response);

    protected static String render(String template, Map<String, Object> variables) {
        return PromptTemplate.from(template).apply(variables).text();
    }
}
