package com.fixit.genai.workflow;

import com.fixit.genai.analysis.FallbackTextAnalyzer;
import com.fixit.genai.call.CallAggregator;
import com.fixit.genai.call.CallContext;
import com.fixit.genai.call.CallStage;
import com.fixit.genai.call.CallSummarizer;
import com.fixit.genai.call.HeuristicStageAnalyzer;
import com.fixit.genai.call.ModelStageAnalyzer;
import com.fixit.genai.config.ScoringSettings;
import com.fixit.genai.llm.ModelClient;
import com.fixit.genai.llm.ModelOutputParser;
import com.fixit.genai.nodes.AggregationNode;
import com.fixit.genai.nodes.AnalysisStageNode;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the call evaluation graph.
 * <pre>
 *   rapport_building ─┐
 *   need_discovery   ─┤
 *   closing_attempt  ─┼──► aggregate
 *   compliance_risk  ─┘
 * </pre>
 */
@Configuration
public class CallWorkflowGraph {

    @Bean("callWorkflow")
    public StageGraph<CallContext> callWorkflow(ModelClient modelClient,
                                                ModelOutputParser parser,
                                                ScoringSettings settings,
                                                CallAggregator aggregator,
                                                CallSummarizer summarizer) {
        StageGraph.Builder<CallContext> graph = StageGraph.builder();
        for (CallStage stage : CallStage.values()) {
            graph.addNode(new AnalysisStageNode(stage, new FallbackTextAnalyzer<>(
                    stage.getNodeName(),
                    new ModelStageAnalyzer(stage, modelClient, parser, settings.llmTimeout()),
                    new HeuristicStageAnalyzer(stage))));
        }
        graph.addNode(new AggregationNode(aggregator, summarizer, modelClient.modelName()));
        return graph.build();
    }
}
