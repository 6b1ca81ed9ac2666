package com.fixit.genai.nodes;

import com.fixit.genai.state.StageOutput;

import java.util.Map;
import java.util.Set;

/**
 * One node of a stage graph.
 *
 * @param <C> read-only context shared by all nodes of a run
 */
public interface StageNode<C> {

    String name();

    /** Names of nodes that must finish before this one starts. */
    Set<String> dependencies();

    /**
     * @param inputs outputs of the dependencies that completed; a failed dependency is absent
     */
    StageOutput run(C context, Map<String, StageOutput> inputs);
}
