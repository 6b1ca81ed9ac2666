package com.fixit.genai.workflow;

import com.fixit.genai.exception.ConfigurationException;
import com.fixit.genai.nodes.StageNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable, validated DAG of {@link StageNode}s.
 * <p>
 * {@link Builder#build()} rejects duplicate names, dependencies on unknown nodes and cycles
 * with a {@link ConfigurationException}, so a bad graph fails at startup rather than per request.
 * </p>
 *
 * @param <C> context type handed to every node
 */
public final class StageGraph<C> {

    private final Map<String, StageNode<C>> nodes;
    private final List<String> order;

    private StageGraph(Map<String, StageNode<C>> nodes, List<String> order) {
        this.nodes = nodes;
        this.order = order;
    }

    public static <C> Builder<C> builder() {
        return new Builder<>();
    }

    public StageNode<C> node(String name) {
        StageNode<C> node = nodes.get(name);
        if (node == null) {
            throw new IllegalArgumentException("No node named " + name);
        }
        return node;
    }

    /** Node names in an order where every node follows all of its dependencies. */
    public List<String> topologicalOrder() {
        return order;
    }

    public int size() {
        return nodes.size();
    }

    public static final class Builder<C> {

        private final Map<String, StageNode<C>> nodes = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder<C> addNode(StageNode<C> node) {
            if (nodes.putIfAbsent(node.name(), node) != null) {
                throw new ConfigurationException("Duplicate node: " + node.name());
            }
            return this;
        }

        public StageGraph<C> build() {
            Map<String, Integer> pending = new HashMap<>();
            Map<String, List<String>> dependents = new HashMap<>();
            for (StageNode<C> node : nodes.values()) {
                pending.put(node.name(), node.dependencies().size());
                for (String dependency : node.dependencies()) {
                    if (!nodes.containsKey(dependency)) {
                        throw new ConfigurationException(
                                "Node " + node.name() + " depends on unknown node " + dependency);
                    }
                    dependents.computeIfAbsent(dependency, k -> new ArrayList<>()).add(node.name());
                }
            }

            // Kahn's algorithm, seeded in insertion order so the result is stable
            Deque<String> ready = new ArrayDeque<>();
            for (String name : nodes.keySet()) {
                if (pending.get(name) == 0) {
                    ready.add(name);
                }
            }
            List<String> order = new ArrayList<>();
            while (!ready.isEmpty()) {
                String name = ready.poll();
                order.add(name);
                for (String dependent : dependents.getOrDefault(name, List.of())) {
                    if (pending.merge(dependent, -1, Integer::sum) == 0) {
                        ready.add(dependent);
                    }
                }
            }
            if (order.size() != nodes.size()) {
                List<String> cyclic = new ArrayList<>(nodes.keySet());
                cyclic.removeAll(order);
                throw new ConfigurationException("Cycle between nodes " + cyclic);
            }
            return new StageGraph<>(Collections.unmodifiableMap(new LinkedHashMap<>(nodes)), List.copyOf(order));
        }
    }
}
