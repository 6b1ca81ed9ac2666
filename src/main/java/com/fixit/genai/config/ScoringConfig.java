package com.fixit.genai.config;

import com.fixit.genai.thread.MdcAwareExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Reads the {@code fixit.*} options and publishes them as one validated {@link ScoringSettings}.
 * <p>
 * Any {@link com.fixit.genai.exception.ConfigurationException} thrown here aborts context startup.
 * </p>
 *
 * <pre>
 * fixit:
 *   scoring:
 *     hot-threshold: 0.7
 *     warm-threshold: 0.4
 *     notes-model-weight: 0.6
 *     weights: { recency: 0.25, engagement: 0.20, source: 0.15, budget: 0.20, notes: 0.20 }
 *   call:
 *     good-call-threshold: 0.6
 *     weights: { rapport: 0.25, need-discovery: 0.30, closing: 0.30, compliance: 0.15 }
 *   llm:
 *     timeout-ms: 60000
 *   executor:
 *     pool-size: 8
 * </pre>
 */
@Slf4j
@Configuration
public class ScoringConfig {

    // ── Thresholds ──────────────────────────────────────────────────────
    @Value("${fixit.scoring.hot-threshold:0.7}")
    private double hotThreshold;

    @Value("${fixit.scoring.warm-threshold:0.4}")
    private double warmThreshold;

    @Value("${fixit.call.good-call-threshold:0.6}")
    private double goodCallThreshold;

    // ── Model usage ─────────────────────────────────────────────────────
    @Value("${fixit.llm.timeout-ms:60000}")
    private long llmTimeoutMs;

    @Value("${fixit.scoring.notes-model-weight:0.6}")
    private double notesModelWeight;

    // ── Lead weights ────────────────────────────────────────────────────
    @Value("${fixit.scoring.weights.recency:0.25}")
    private double recencyWeight;

    @Value("${fixit.scoring.weights.engagement:0.20}")
    private double engagementWeight;

    @Value("${fixit.scoring.weights.source:0.15}")
    private double sourceWeight;

    @Value("${fixit.scoring.weights.budget:0.20}")
    private double budgetWeight;

    @Value("${fixit.scoring.weights.notes:0.20}")
    private double notesWeight;

    // ── Call weights ────────────────────────────────────────────────────
    @Value("${fixit.call.weights.rapport:0.25}")
    private double rapportWeight;

    @Value("${fixit.call.weights.need-discovery:0.30}")
    private double needDiscoveryWeight;

    @Value("${fixit.call.weights.closing:0.30}")
    private double closingWeight;

    @Value("${fixit.call.weights.compliance:0.15}")
    private double complianceWeight;

    @Value("${fixit.executor.pool-size:8}")
    private int poolSize;

    @Bean
    public ScoringSettings scoringSettings() {
        ScoringSettings settings = new ScoringSettings(
                hotThreshold,
                warmThreshold,
                goodCallThreshold,
                Duration.ofMillis(llmTimeoutMs),
                notesModelWeight,
                new LeadWeights(recencyWeight, engagementWeight, sourceWeight, budgetWeight, notesWeight),
                new CallWeights(rapportWeight, needDiscoveryWeight, closingWeight, complianceWeight));
        log.info("Scoring settings loaded: hot>={} warm>={} goodCall>={} llmTimeout={}",
                settings.hotThreshold(), settings.warmThreshold(),
                settings.goodCallThreshold(), settings.llmTimeout());
        return settings;
    }

    /**
     * Runs lead scoring and call stages. Kept apart from the model pool so a stage
     * waiting on the model never starves the model call it is waiting for.
     */
    @Bean(name = "stageExecutor", destroyMethod = "shutdown")
    public MdcAwareExecutor stageExecutor() {
        return MdcAwareExecutor.fixedPool("stage", poolSize);
    }

    @Bean(name = "modelExecutor", destroyMethod = "shutdown")
    public MdcAwareExecutor modelExecutor() {
        return MdcAwareExecutor.fixedPool("model", poolSize);
    }
}
