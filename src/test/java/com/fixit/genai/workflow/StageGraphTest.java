package com.fixit.genai.workflow;

import com.fixit.genai.exception.ConfigurationException;
import com.fixit.genai.nodes.StageNode;
import com.fixit.genai.state.StageOutput;
import com.fixit.genai.state.StageStatus;
import com.fixit.genai.state.WorkflowState;
import com.fixit.genai.thread.MdcAwareExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BiFunction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StageGraphTest {

    record Text(String stageName, String value) implements StageOutput {
    }

    record Node(String name, Set<String> dependencies,
                BiFunction<String, Map<String, StageOutput>, StageOutput> body) implements StageNode<String> {

        static Node of(String name, String... dependencies) {
            return new Node(name, Set.of(dependencies), (context, inputs) -> new Text(name, context + ":" + name));
        }

        @Override
        public StageOutput run(String context, Map<String, StageOutput> inputs) {
            return body.apply(context, inputs);
        }
    }

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("should order every node after its dependencies")
        void topologicalOrder() {
            StageGraph<String> graph = StageGraph.<String>builder()
                    .addNode(Node.of("join", "a", "b"))
                    .addNode(Node.of("a"))
                    .addNode(Node.of("b", "a"))
                    .build();

            List<String> order = graph.topologicalOrder();
            assertThat(order).containsExactly("a", "b", "join");
        }

        @Test
        @DisplayName("should reject duplicate nodes, unknown dependencies and cycles")
        void invalidGraphs() {
            assertThatThrownBy(() -> StageGraph.<String>builder().addNode(Node.of("a")).addNode(Node.of("a")))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("Duplicate");
            assertThatThrownBy(() -> StageGraph.<String>builder().addNode(Node.of("a", "ghost")).build())
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("unknown node ghost");
            assertThatThrownBy(() -> StageGraph.<String>builder()
                    .addNode(Node.of("a", "c"))
                    .addNode(Node.of("b", "a"))
                    .addNode(Node.of("c", "b"))
                    .addNode(Node.of("d"))
                    .build())
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("Cycle");
        }
    }

    @Nested
    @DisplayName("Scheduling")
    class Scheduling {

        private final MdcAwareExecutor executor = MdcAwareExecutor.fixedPool("graph-test", 4);
        private final StageScheduler scheduler = new StageScheduler(executor);

        @AfterEach
        void tearDown() {
            executor.shutdown();
        }

        @Test
        @DisplayName("should run independent nodes concurrently and pass outputs to the join")
        void concurrentRoots() {
            CountDownLatch bothStarted = new CountDownLatch(2);
            BiFunction<String, Map<String, StageOutput>, StageOutput> waitForSibling = (context, inputs) -> {
                bothStarted.countDown();
                try {
                    if (!bothStarted.await(5, TimeUnit.SECONDS)) {
                        throw new IllegalStateException("sibling never started");
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException(e);
                }
                return new Text("root", context);
            };
            StageGraph<String> graph = StageGraph.<String>builder()
                    .addNode(new Node("left", Set.of(), waitForSibling))
                    .addNode(new Node("right", Set.of(), waitForSibling))
                    .addNode(new Node("join", Set.of("left", "right"),
                            (context, inputs) -> new Text("join", String.join(",", inputs.keySet().stream().sorted().toList()))))
                    .build();

            WorkflowState state = scheduler.run(graph, "ctx", "run-1");

            assertThat(state.getStatuses()).containsOnlyKeys("left", "right", "join")
                    .allSatisfy((name, status) -> assertThat(status).isEqualTo(StageStatus.COMPLETED));
            assertThat(state.getOutput("join", Text.class)).get().extracting(Text::value).isEqualTo("left,right");
        }

        @Test
        @DisplayName("should mark a throwing node FAILED and still run its dependents")
        void failedNode() {
            StageGraph<String> graph = StageGraph.<String>builder()
                    .addNode(new Node("broken", Set.of(), (context, inputs) -> {
                        throw new IllegalStateException("boom");
                    }))
                    .addNode(Node.of("healthy"))
                    .addNode(new Node("join", Set.of("broken", "healthy"),
                            (context, inputs) -> new Text("join", String.valueOf(inputs.keySet()))))
                    .build();

            WorkflowState state = scheduler.run(graph, "ctx", "run-2");

            assertThat(state.getStatus("broken")).isEqualTo(StageStatus.FAILED);
            assertThat(state.getError("broken")).contains("boom");
            assertThat(state.getStatus("join")).isEqualTo(StageStatus.COMPLETED);
            assertThat(state.getOutput("join", Text.class)).get().extracting(Text::value).isEqualTo("[healthy]");
        }
    }

    @Nested
    @DisplayName("Run state")
    class RunState {

        @Test
        @DisplayName("should reject writes from a thread other than the one driving the run")
        void confinedToDriver() {
            WorkflowState state = new WorkflowState("run-3", List.of("a"));
            state.markRunning("a");

            CompletableFuture<Void> foreign = CompletableFuture.runAsync(() -> state.complete("a", new Text("a", "x")));

            assertThatThrownBy(foreign::join).hasCauseInstanceOf(IllegalStateException.class);
            assertThat(state.getStatus("a")).isEqualTo(StageStatus.RUNNING);
        }

        @Test
        @DisplayName("should only move a node from pending to running to a terminal status")
        void transitions() {
            WorkflowState state = new WorkflowState("run-4", List.of("a"));

            assertThatThrownBy(() -> state.complete("a", new Text("a", "x")))
                    .isInstanceOf(IllegalStateException.class);
            state.markRunning("a");
            state.fail("a", "boom");

            assertThat(state.getStatus("a").isTerminal()).isTrue();
            assertThatThrownBy(() -> state.markRunning("a")).isInstanceOf(IllegalStateException.class);
        }
    }
}
