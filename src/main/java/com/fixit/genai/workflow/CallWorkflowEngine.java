package com.fixit.genai.workflow;

import com.fixit.genai.call.CallContext;
import com.fixit.genai.call.CallTranscript;
import com.fixit.genai.call.ParsedTranscript;
import com.fixit.genai.call.TranscriptParser;
import com.fixit.genai.call.Verdict;
import com.fixit.genai.state.WorkflowState;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Entry point for call evaluation.
 * <p>
 * Parses the transcript (rejecting invalid input before any stage runs), executes the call
 * graph and returns the verdict of the aggregation node.
 * </p>
 */
@Slf4j
@Service
public class CallWorkflowEngine {

    private final TranscriptParser parser;
    private final StageScheduler scheduler;
    private final StageGraph<CallContext> graph;

    public CallWorkflowEngine(TranscriptParser parser,
                              StageScheduler scheduler,
                              @Qualifier("callWorkflow") StageGraph<CallContext> graph) {
        this.parser = parser;
        this.scheduler = scheduler;
        this.graph = graph;
    }

    public Verdict evaluate(CallTranscript call) {
        ParsedTranscript transcript = parser.parse(call);

        MDC.put("callId", call.callId());
        try {
            log.info("Evaluating call, {} turn(s), lead={}", transcript.turns().size(), call.leadId());
            WorkflowState state = scheduler.run(graph, new CallContext(call, transcript), call.callId());

            Verdict verdict = state.getOutput(Verdict.STAGE_NAME, Verdict.class)
                    .orElseThrow(() -> new IllegalStateException("Aggregation failed for call " + call.callId()
                            + ": " + state.getError(Verdict.STAGE_NAME).orElse("no output")));
            log.info("Call quality {} good={} degraded={} heuristic={}", verdict.qualityScore(),
                    verdict.isGoodCall(), verdict.degradedStages(), verdict.heuristicStages());
            return verdict;
        } finally {
            MDC.remove("callId");
        }
    }
}
