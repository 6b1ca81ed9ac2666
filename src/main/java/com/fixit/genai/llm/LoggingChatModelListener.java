package com.fixit.genai.llm;

import dev.langchain4j.model.chat.listener.ChatModelErrorContext;
import dev.langchain4j.model.chat.listener.ChatModelListener;
import dev.langchain4j.model.chat.listener.ChatModelRequestContext;
import dev.langchain4j.model.chat.listener.ChatModelResponseContext;
import dev.langchain4j.model.output.TokenUsage;
import lombok.extern.slf4j.Slf4j;

/**
 * Logs every chat model call with its wall time and token usage.
 */
@Slf4j
public class LoggingChatModelListener implements ChatModelListener {

    private static final String START_NANOS = "fixit_start_nanos";

    @Override
    public void onRequest(ChatModelRequestContext context) {
        context.attributes().put(START_NANOS, System.nanoTime());
        log.debug("Chat request: {} message(s)", context.chatRequest().messages().size());
    }

    @Override
    public void onResponse(ChatModelResponseContext context) {
        TokenUsage usage = context.chatResponse().tokenUsage();
        log.info("Chat response in {}ms (tokens in={}, out={})",
                elapsedMs(context.attributes().get(START_NANOS)),
                usage != null ? usage.inputTokenCount() : null,
                usage != null ? usage.outputTokenCount() : null);
    }

    @Override
    public void onError(ChatModelErrorContext context) {
        log.warn("Chat call failed after {}ms: {}",
                elapsedMs(context.attributes().get(START_NANOS)),
                context.error().getMessage());
    }

    private static long elapsedMs(Object startNanos) {
        if (startNanos instanceof Long start) {
            return (System.nanoTime() - start) / 1_000_000;
        }
        return -1;
    }
}
