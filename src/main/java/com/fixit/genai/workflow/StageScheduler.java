package com.fixit.genai.workflow;

import com.fixit.genai.nodes.StageNode;
import com.fixit.genai.state.StageOutput;
import com.fixit.genai.state.StageStatus;
import com.fixit.genai.state.WorkflowState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorCompletionService;

/**
 * Runs a {@link StageGraph} on the stage executor.
 * <p>
 * The calling thread drives the run: it submits every node whose dependencies have all
 * finished, waits for the next node to finish, records the outcome and repeats, so
 * independent nodes run concurrently while {@link WorkflowState} is only written by the
 * caller. A node that throws is marked {@link StageStatus#FAILED}; its dependents still run
 * and see no output for it.
 * </p>
 */
@Slf4j
@Component
public class StageScheduler {

    private final Executor stageExecutor;

    public StageScheduler(@Qualifier("stageExecutor") Executor stageExecutor) {
        this.stageExecutor = stageExecutor;
    }

    /**
     * Executes every node once and blocks until all of them completed or failed.
     */
    public <C> WorkflowState run(StageGraph<C> graph, C context, String runId) {
        WorkflowState state = new WorkflowState(runId, graph.topologicalOrder());
        CompletionService<StageOutcome> completion = new ExecutorCompletionService<>(stageExecutor);

        int finished = 0;
        while (finished < graph.size()) {
            for (String name : graph.topologicalOrder()) {
                StageNode<C> node = graph.node(name);
                if (state.getStatus(name) == StageStatus.PENDING && dependenciesDone(node, state)) {
                    Map<String, StageOutput> inputs = inputsOf(node, state);
                    state.markRunning(name);
                    completion.submit(() -> execute(node, context, inputs));
                }
            }

            StageOutcome outcome = next(completion, state.getRunId());
            if (outcome.error() == null) {
                state.complete(outcome.node(), outcome.output());
            } else {
                state.fail(outcome.node(), outcome.error());
            }
            finished++;
        }

        log.debug("Run {} finished: {}", state.getRunId(), state.getStatuses());
        return state;
    }

    private static <C> boolean dependenciesDone(StageNode<C> node, WorkflowState state) {
        return node.dependencies().stream().allMatch(dependency -> state.getStatus(dependency).isTerminal());
    }

    private static <C> Map<String, StageOutput> inputsOf(StageNode<C> node, WorkflowState state) {
        Map<String, StageOutput> inputs = new LinkedHashMap<>();
        for (String dependency : node.dependencies()) {
            state.getOutput(dependency).ifPresent(output -> inputs.put(dependency, output));
        }
        return Map.copyOf(inputs);
    }

    private static <C> StageOutcome execute(StageNode<C> node, C context, Map<String, StageOutput> inputs) {
        long start = System.nanoTime();
        try {
            StageOutput output = node.run(context, inputs);
            if (output == null) {
                throw new IllegalStateException("Node returned no output");
            }
            log.info("Stage {} completed in {} ms", node.name(), (System.nanoTime() - start) / 1_000_000);
            return new StageOutcome(node.name(), output, null);
        } catch (RuntimeException e) {
            log.error("Stage {} failed after {} ms", node.name(), (System.nanoTime() - start) / 1_000_000, e);
            String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return new StageOutcome(node.name(), null, error);
        }
    }

    private static StageOutcome next(CompletionService<StageOutcome> completion, String runId) {
        try {
            return completion.take().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while running " + runId, e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Stage task of run " + runId + " died", e.getCause());
        }
    }

    private record StageOutcome(String node, StageOutput output, String error) {
    }
}
