package com.fixit.genai.llm;

import com.fixit.genai.exception.ModelUnavailableException;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link ModelClient} over a LangChain4j {@link ChatModel}.
 * <p>
 * The blocking chat call runs on {@code modelExecutor}; the caller waits at most the
 * request timeout and then abandons the call. The underlying HTTP request may still
 * finish in the background, its result is discarded.
 * </p>
 * <p>
 * {@link #isAvailable()} runs a short generation at most once per cache period and
 * answers from the last result in between.
 * </p>
 */
public class ChatModelClient implements ModelClient {

    private static final Logger log = LoggerFactory.getLogger(ChatModelClient.class);

    static final Duration HEALTH_CHECK_TIMEOUT = Duration.ofSeconds(2);
    static final Duration HEALTH_CHECK_CACHE = Duration.ofSeconds(30);
    private static final String HEALTH_CHECK_PROMPT = "Reply with {\"status\": \"ok\"}";

    private final ChatModel chatModel;
    private final String modelName;
    private final Executor modelExecutor;
    private final Duration healthCheckTimeout;
    private final long healthCheckCacheNanos;

    private final Object healthLock = new Object();
    private long lastHealthCheckNanos;
    private Boolean lastHealthResult;

    public ChatModelClient(ChatModel chatModel, String modelName, Executor modelExecutor) {
        this(chatModel, modelName, modelExecutor, HEALTH_CHECK_TIMEOUT, HEALTH_CHECK_CACHE);
    }

    public ChatModelClient(ChatModel chatModel, String modelName, Executor modelExecutor,
                           Duration healthCheckTimeout, Duration healthCheckCache) {
        this.chatModel = chatModel;
        this.modelName = modelName;
        this.modelExecutor = modelExecutor;
        this.healthCheckTimeout = healthCheckTimeout;
        this.healthCheckCacheNanos = healthCheckCache.toNanos();
    }

    @Override
    public ModelResponse generate(ModelRequest request) {
        ChatRequest chatRequest = ChatRequest.builder()
                .messages(toMessages(request))
                .build();

        long start = System.nanoTime();
        CompletableFuture<ChatResponse> call =
                CompletableFuture.supplyAsync(() -> chatModel.chat(chatRequest), modelExecutor);

        ChatResponse response;
        try {
            response = call.get(request.timeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            throw new ModelUnavailableException(FailureKind.TIMEOUT,
                    "Model " + modelName + " did not answer within " + request.timeout().toMillis() + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new ModelUnavailableException(FailureKind.UNREACHABLE,
                    "Model " + modelName + " call failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ModelUnavailableException(FailureKind.UNREACHABLE,
                    "Interrupted while waiting for model " + modelName, e);
        }
        long latencyMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        String text = response != null && response.aiMessage() != null ? response.aiMessage().text() : null;
        if (text == null || text.isBlank()) {
            throw new ModelUnavailableException(FailureKind.MALFORMED_RESPONSE,
                    "Model " + modelName + " returned an empty answer");
        }

        TokenUsage usage = response.tokenUsage();
        log.debug("Model {} answered in {}ms", modelName, latencyMs);
        return new ModelResponse(text, modelName, latencyMs,
                usage != null ? usage.inputTokenCount() : null,
                usage != null ? usage.outputTokenCount() : null);
    }

    @Override
    public String modelName() {
        return modelName;
    }

    @Override
    public boolean isAvailable() {
        synchronized (healthLock) {
            Boolean cached = lastHealthResult;
            if (cached != null && System.nanoTime() - lastHealthCheckNanos < healthCheckCacheNanos) {
                return cached;
            }
            boolean available;
            try {
                generate(ModelRequest.of(HEALTH_CHECK_PROMPT, healthCheckTimeout));
                available = true;
            } catch (ModelUnavailableException e) {
                log.warn("Model health check failed ({}): {}", e.getKind(), e.getMessage());
                available = false;
            }
            lastHealthCheckNanos = System.nanoTime();
            lastHealthResult = available;
            return available;
        }
    }

    private static List<ChatMessage> toMessages(ModelRequest request) {
        List<ChatMessage> messages = new ArrayList<>(2);
        if (request.systemPrompt() != null && !request.systemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.systemPrompt()));
        }
        messages.add(UserMessage.from(request.userPrompt()));
        return messages;
    }
}
