package com.fixit.genai.nodes;

import com.fixit.genai.call.CallAggregator;
import com.fixit.genai.call.CallContext;
import com.fixit.genai.call.CallScore;
import com.fixit.genai.call.CallStage;
import com.fixit.genai.call.CallSummarizer;
import com.fixit.genai.call.CallSummary;
import com.fixit.genai.call.ModelMetadata;
import com.fixit.genai.call.Verdict;
import com.fixit.genai.llm.ModelResponse;
import com.fixit.genai.state.StageOutput;
import com.fixit.genai.state.StageResult;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Joins the four analysis stages into a {@link Verdict}. Runs even when some stages failed.
 */
public class AggregationNode implements StageNode<CallContext> {

    private final CallAggregator aggregator;
    private final CallSummarizer summarizer;
    private final String modelName;

    public AggregationNode(CallAggregator aggregator, CallSummarizer summarizer, String modelName) {
        this.aggregator = aggregator;
        this.summarizer = summarizer;
        this.modelName = modelName;
    }

    @Override
    public String name() {
        return Verdict.STAGE_NAME;
    }

    @Override
    public Set<String> dependencies() {
        return Arrays.stream(CallStage.values())
                .map(CallStage::getNodeName)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    @Override
    public StageOutput run(CallContext context, Map<String, StageOutput> inputs) {
        Map<CallStage, StageResult> results = new EnumMap<>(CallStage.class);
        for (StageOutput output : inputs.values()) {
            if (output instanceof StageResult result) {
                results.put(result.stage(), result);
            }
        }

        CallScore score = aggregator.aggregate(results);
        CallSummary summary = summarizer.summarize(context.transcript(), score);

        List<ModelResponse> modelCalls = new ArrayList<>();
        results.values().stream().map(StageResult::modelCall).filter(Objects::nonNull).forEach(modelCalls::add);
        if (summary.modelCall() != null) {
            modelCalls.add(summary.modelCall());
        }

        return new Verdict(
                context.callId(),
                context.request().leadId(),
                score.qualityScore(),
                score.labels(),
                score.isGoodCall(),
                summary.summary(),
                summary.keyPoints(),
                summary.nextActions(),
                score.degradedStages(),
                score.heuristicStages(),
                metadata(modelCalls));
    }

    private ModelMetadata metadata(List<ModelResponse> calls) {
        if (calls.isEmpty()) {
            return new ModelMetadata(modelName, 0L, null, null);
        }
        long latency = calls.stream().mapToLong(ModelResponse::latencyMs).sum();
        return new ModelMetadata(calls.get(0).modelName(), latency,
                sum(calls.stream().map(ModelResponse::inputTokens).toList()),
                sum(calls.stream().map(ModelResponse::outputTokens).toList()));
    }

    private static Integer sum(List<Integer> counts) {
        List<Integer> known = counts.stream().filter(Objects::nonNull).toList();
        return known.isEmpty() ? null : known.stream().mapToInt(Integer::intValue).sum();
    }
}
