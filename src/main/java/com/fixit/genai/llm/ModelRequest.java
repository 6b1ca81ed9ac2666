package com.fixit.genai.llm;

import java.time.Duration;

/**
 * One prompt for the model backend.
 *
 * @param systemPrompt optional instructions sent as a system message, may be null
 * @param userPrompt   the rendered prompt
 * @param timeout      hard limit for the whole call, enforced by the client
 */
public record ModelRequest(String systemPrompt, String userPrompt, Duration timeout) {

    public static ModelRequest of(String userPrompt, Duration timeout) {
        return new ModelRequest(null, userPrompt, timeout);
    }
}
