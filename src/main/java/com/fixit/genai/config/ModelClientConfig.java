package com.fixit.genai.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fixit.genai.llm.ChatModelClient;
import com.fixit.genai.llm.DisabledModelClient;
import com.fixit.genai.llm.LoggingChatModelListener;
import com.fixit.genai.llm.ModelClient;
import com.fixit.genai.llm.ModelOutputParser;
import com.fixit.genai.llm.RetryPolicy;
import com.fixit.genai.llm.RetryingModelClient;
import com.fixit.genai.thread.MdcAwareExecutor;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;

/**
 * Builds the {@link ModelClient} the scoring core talks to.
 * <p>
 * The backend is any OpenAI-compatible chat endpoint; the default points at a local
 * Ollama ({@code http://localhost:11434/v1}). LangChain4j retries are switched off and
 * {@link RetryingModelClient} retries instead, inside the scoring timeout. The HTTP timeout
 * is set to the scoring timeout so abandoned calls do not linger.
 * </p>
 */
@Slf4j
@Configuration
public class ModelClientConfig {

    @Value("${fixit.llm.enabled:true}")
    private boolean enabled;

    @Value("${fixit.llm.base-url:http://localhost:11434/v1}")
    private String baseUrl;

    @Value("${fixit.llm.model-name:llama3.2:3b}")
    private String modelName;

    @Value("${fixit.llm.api-key:ollama}")
    private String apiKey;

    @Value("${fixit.llm.max-tokens:512}")
    private int maxTokens;

    @Value("${fixit.llm.temperature:0.1}")
    private double temperature;

    @Value("${fixit.llm.max-retries:3}")
    private int maxRetries;

    @Value("${fixit.llm.retry-backoff-ms:2000}")
    private long retryBackoffMs;

    @Value("${fixit.llm.retry-max-backoff-ms:10000}")
    private long retryMaxBackoffMs;

    @Value("${fixit.llm.health-check-timeout-ms:2000}")
    private long healthCheckTimeoutMs;

    @Value("${fixit.llm.health-check-cache-ms:30000}")
    private long healthCheckCacheMs;

    @Bean
    public RetryPolicy modelRetryPolicy() {
        return new RetryPolicy(maxRetries, Duration.ofMillis(retryBackoffMs), Duration.ofMillis(retryMaxBackoffMs));
    }

    @Bean
    public ModelSettings modelSettings() {
        return new ModelSettings(enabled, baseUrl, modelName, apiKey, maxTokens, temperature);
    }

    @Bean
    public ModelOutputParser modelOutputParser(ObjectMapper objectMapper) {
        return new ModelOutputParser(objectMapper);
    }

    @Bean
    public ModelClient modelClient(ModelSettings modelSettings,
                                   ScoringSettings scoringSettings,
                                   RetryPolicy modelRetryPolicy,
                                   @Qualifier("modelExecutor") MdcAwareExecutor modelExecutor) {
        if (!modelSettings.enabled()) {
            log.info("Model backend disabled, running in deterministic mode");
            return new DisabledModelClient();
        }
        ChatModel chatModel = OpenAiChatModel.builder()
                .baseUrl(modelSettings.baseUrl())
                .apiKey(modelSettings.apiKey())
                .modelName(modelSettings.modelName())
                .temperature(modelSettings.temperature())
                .maxTokens(modelSettings.maxTokens())
                .timeout(scoringSettings.llmTimeout())
                .maxRetries(0)
                .listeners(List.of(new LoggingChatModelListener()))
                .build();
        log.info("Model client initialised: model={} url={} attempts={}",
                modelSettings.modelName(), modelSettings.baseUrl(), modelRetryPolicy.maxAttempts());
        ChatModelClient client = new ChatModelClient(chatModel, modelSettings.modelName(), modelExecutor,
                Duration.ofMillis(healthCheckTimeoutMs), Duration.ofMillis(healthCheckCacheMs));
        return new RetryingModelClient(client, modelRetryPolicy);
    }
}
