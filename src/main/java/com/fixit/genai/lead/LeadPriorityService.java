package com.fixit.genai.lead;

import com.fixit.genai.analysis.Analysis;
import com.fixit.genai.config.ScoringSettings;
import com.fixit.genai.llm.ModelClient;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Entry point for lead prioritisation.
 *
 * <h3>Flow:</h3>
 * <pre>
 * prioritize(batch, useModel)
 *   │
 *   ├── validate batch (ValidationException on bad input)
 *   ├── per lead, in parallel on stageExecutor:
 *   │     RuleScorer (recency, engagement, source, budget) + NotesScorer
 *   │     → PriorityAggregator.aggregate
 *   └── join → PriorityAggregator.rank (sort + truncate)
 * </pre>
 * Leads are independent, so the order in which they finish does not affect the ranking.
 */
@Slf4j
@Service
public class LeadPriorityService {

    private final RuleScorer ruleScorer;
    private final NotesScorer notesScorer;
    private final PriorityAggregator aggregator;
    private final ModelClient modelClient;
    private final ScoringSettings settings;
    private final Executor stageExecutor;

    public LeadPriorityService(RuleScorer ruleScorer,
                               NotesScorer notesScorer,
                               PriorityAggregator aggregator,
                               ModelClient modelClient,
                               ScoringSettings settings,
                               @Qualifier("stageExecutor") Executor stageExecutor) {
        this.ruleScorer = ruleScorer;
        this.notesScorer = notesScorer;
        this.aggregator = aggregator;
        this.modelClient = modelClient;
        this.settings = settings;
        this.stageExecutor = stageExecutor;
    }

    public LeadPriorityResult prioritize(LeadBatch batch, boolean useModel) {
        LeadValidator.validate(batch);

        String requestId = UUID.randomUUID().toString();
        MDC.put("requestId", requestId);
        try {
            log.info("Prioritising {} lead(s), max_results={}, useModel={}",
                    batch.leads().size(), batch.maxResults(), useModel);

            List<CompletableFuture<ScoredLead>> futures = batch.leads().stream()
                    .map(lead -> CompletableFuture.supplyAsync(() -> score(lead, useModel), stageExecutor))
                    .toList();
            List<ScoredLead> scored = futures.stream()
                    .map(LeadPriorityService::await)
                    .toList();

            List<RankedLead> ranked = aggregator.rank(scored, batch.maxResults());
            log.info("Ranked {} lead(s), returning {}", scored.size(), ranked.size());

            return new LeadPriorityResult(ranked, batch.leads().size(), metadata(scored));
        } finally {
            MDC.remove("requestId");
        }
    }

    /**
     * Scores one lead. Pure apart from the optional model call.
     */
    public ScoredLead score(Lead lead, boolean useModel) {
        SubScore recency = ruleScorer.recency(lead.minutesSinceActivity());
        SubScore engagement = ruleScorer.engagement(lead.pastInteractions(), lead.status());
        SubScore source = ruleScorer.source(lead.source());
        SubScore budget = ruleScorer.budget(lead.budget());
        Analysis notes = notesScorer.score(lead.notes(), useModel);

        ScoreBreakdown breakdown = aggregator.aggregate(recency, engagement, source, budget, notes);
        log.debug("Lead {} scored {} ({}), notes via {}",
                lead.leadId(), breakdown.priorityScore(), breakdown.bucket(), notes.mode());
        return new ScoredLead(lead, breakdown);
    }

    /** Reports the model only if it actually scored at least one lead's notes. */
    private ScoringMetadata metadata(List<ScoredLead> scored) {
        boolean modelUsed = scored.stream().anyMatch(s -> s.breakdown().notesMode().usedModel());
        return new ScoringMetadata(
                modelUsed ? modelClient.modelName() : "deterministic",
                modelUsed,
                settings.leadWeights(),
                settings.hotThreshold(),
                settings.warmThreshold());
    }

    private static ScoredLead await(CompletableFuture<ScoredLead> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }
}
