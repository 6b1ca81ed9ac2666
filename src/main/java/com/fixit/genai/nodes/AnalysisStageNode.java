package com.fixit.genai.nodes;

import com.fixit.genai.analysis.Analysis;
import com.fixit.genai.analysis.FallbackTextAnalyzer;
import com.fixit.genai.call.CallContext;
import com.fixit.genai.call.CallStage;
import com.fixit.genai.call.ParsedTranscript;
import com.fixit.genai.state.StageOutput;
import com.fixit.genai.state.StageResult;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Set;

/**
 * Scores one call dimension, model first with heuristic fallback. Has no dependencies.
 */
@Slf4j
public class AnalysisStageNode implements StageNode<CallContext> {

    private final CallStage stage;
    private final FallbackTextAnalyzer<ParsedTranscript> analyzer;

    public AnalysisStageNode(CallStage stage, FallbackTextAnalyzer<ParsedTranscript> analyzer) {
        this.stage = stage;
        this.analyzer = analyzer;
    }

    @Override
    public String name() {
        return stage.getNodeName();
    }

    @Override
    public Set<String> dependencies() {
        return Set.of();
    }

    @Override
    public StageOutput run(CallContext context, Map<String, StageOutput> inputs) {
        long start = System.nanoTime();
        Analysis analysis = analyzer.analyze(context.transcript());
        log.debug("Stage {} labelled {} via {} in {} ms", name(), analysis.score(), analysis.mode(),
                (System.nanoTime() - start) / 1_000_000);
        return StageResult.of(stage, analysis);
    }
}
