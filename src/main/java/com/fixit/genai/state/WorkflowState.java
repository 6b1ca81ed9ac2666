package com.fixit.genai.state;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Per-run record of node statuses and outputs.
 * <p>
 * Confined to the thread that created it, the one driving the run in
 * {@link com.fixit.genai.workflow.StageScheduler}. Nodes receive their inputs as an
 * immutable snapshot and never touch this object; a write from any other thread fails.
 * </p>
 */
public class WorkflowState {

    private final String runId;
    private final Thread owner = Thread.currentThread();
    private final Map<String, StageStatus> statuses = new LinkedHashMap<>();
    private final Map<String, StageOutput> outputs = new HashMap<>();
    private final Map<String, String> errors = new HashMap<>();

    public WorkflowState(String runId, Iterable<String> nodeNames) {
        this.runId = runId;
        for (String name : nodeNames) {
            statuses.put(name, StageStatus.PENDING);
        }
    }

    public String getRunId() {
        return runId;
    }

    public void markRunning(String node) {
        transition(node, StageStatus.PENDING, StageStatus.RUNNING);
    }

    public void complete(String node, StageOutput output) {
        transition(node, StageStatus.RUNNING, StageStatus.COMPLETED);
        outputs.put(node, output);
    }

    public void fail(String node, String error) {
        transition(node, StageStatus.RUNNING, StageStatus.FAILED);
        errors.put(node, error == null ? "unknown error" : error);
    }

    public StageStatus getStatus(String node) {
        StageStatus status = statuses.get(node);
        if (status == null) {
            throw new IllegalArgumentException("Unknown node: " + node);
        }
        return status;
    }

    public Map<String, StageStatus> getStatuses() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(statuses));
    }

    public Optional<StageOutput> getOutput(String node) {
        return Optional.ofNullable(outputs.get(node));
    }

    public <T extends StageOutput> Optional<T> getOutput(String node, Class<T> type) {
        return getOutput(node).filter(type::isInstance).map(type::cast);
    }

    public Optional<String> getError(String node) {
        return Optional.ofNullable(errors.get(node));
    }

    private void transition(String node, StageStatus from, StageStatus to) {
        if (Thread.currentThread() != owner) {
            throw new IllegalStateException("Run " + runId + " state written from " + Thread.currentThread().getName()
                    + ", owned by " + owner.getName());
        }
        StageStatus current = getStatus(node);
        if (current != from) {
            throw new IllegalStateException("Node " + node + " cannot move from " + current + " to " + to);
        }
        statuses.put(node, to);
    }
}
