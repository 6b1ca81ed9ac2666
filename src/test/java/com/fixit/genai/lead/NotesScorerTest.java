package com.fixit.genai.lead;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fixit.genai.analysis.Analysis;
import com.fixit.genai.analysis.AnalysisMode;
import com.fixit.genai.config.ScoringSettings;
import com.fixit.genai.exception.ModelUnavailableException;
import com.fixit.genai.llm.FailureKind;
import com.fixit.genai.llm.ModelOutputParser;
import com.fixit.genai.llm.RetryPolicy;
import com.fixit.genai.llm.RetryingModelClient;
import com.fixit.genai.llm.ScriptedModelClient;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.offset;

class NotesScorerTest {

    private static final String NOTES = "Very interested, wants to visit this weekend!";

    private final ModelOutputParser parser = new ModelOutputParser(new ObjectMapper());
    private final HeuristicNotesAnalyzer heuristic = new HeuristicNotesAnalyzer();

    private NotesScorer scorer(ScriptedModelClient client) {
        return new NotesScorer(client, parser, heuristic, ScoringSettings.defaults());
    }

    @Nested
    @DisplayName("Model available")
    class ModelAvailable {

        @Test
        @DisplayName("should blend 0.6 model with 0.4 heuristic and keep the keyword evidence")
        void blends() {
            ScriptedModelClient client = ScriptedModelClient.answering(
                    "{\"score\": 0.5, \"reasons\": [\"Plans a weekend visit\"], \"red_flags\": [\"Price sensitive\"]}");

            Analysis result = scorer(client).score(NOTES, true);

            assertThat(result.score()).isEqualTo(0.6 * 0.5 + 0.4 * 0.85, offset(1e-9));
            assertThat(result.mode()).isEqualTo(AnalysisMode.HYBRID);
            assertThat(result.evidence()).containsExactly(
                    "Plans a weekend visit",
                    "Red flags: Price sensitive",
                    "Urgency signals detected: this weekend",
                    "Positive signals: interested");
            assertThat(result.modelCall()).isNotNull();
        }

        @Test
        @DisplayName("should keep the model score when a retry succeeds after an outage")
        void recoversAfterRetry() {
            AtomicInteger calls = new AtomicInteger();
            ScriptedModelClient flaky = new ScriptedModelClient(request -> {
                if (calls.incrementAndGet() == 1) {
                    throw new ModelUnavailableException(FailureKind.UNREACHABLE, "connection reset");
                }
                return "{\"score\": 0.5, \"reasons\": [\"Plans a weekend visit\"]}";
            });
            RetryPolicy policy = new RetryPolicy(3, Duration.ofMillis(5), Duration.ofMillis(20));
            NotesScorer scorer = new NotesScorer(new RetryingModelClient(flaky, policy), parser, heuristic,
                    ScoringSettings.defaults());

            Analysis result = scorer.score(NOTES, true);

            assertThat(result.mode()).isEqualTo(AnalysisMode.HYBRID);
            assertThat(result.score()).isEqualTo(0.6 * 0.5 + 0.4 * 0.85, offset(1e-9));
            assertThat(flaky.getRequests()).hasSize(2);
        }

        @Test
        @DisplayName("should not call the model when the caller opted out or notes are empty")
        void skipsModel() {
            ScriptedModelClient client = ScriptedModelClient.answering("{\"score\": 0.1}");
            NotesScorer scorer = scorer(client);

            assertThat(scorer.score(NOTES, false).mode()).isEqualTo(AnalysisMode.HEURISTIC);
            assertThat(scorer.score("  ", true).evidence()).containsExactly("No notes available");
            assertThat(client.getRequests()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Model unavailable")
    class ModelUnavailable {

        @ParameterizedTest(name = "{0}")
        @EnumSource(FailureKind.class)
        @DisplayName("should equal the pure heuristic result for every failure kind")
        void equalsHeuristic(FailureKind kind) {
            Analysis result = scorer(ScriptedModelClient.failing(kind)).score(NOTES, true);
            Analysis pure = heuristic.analyze(NOTES);

            assertThat(result.score()).isEqualTo(pure.score());
            assertThat(result.evidence()).isEqualTo(pure.evidence());
            assertThat(result.mode()).isEqualTo(AnalysisMode.DEGRADED);
        }

        @Test
        @DisplayName("should fall back when the model answers prose instead of JSON")
        void malformedAnswer() {
            Analysis result = scorer(ScriptedModelClient.answering("This lead looks hot!")).score(NOTES, true);

            assertThat(result.mode()).isEqualTo(AnalysisMode.DEGRADED);
            assertThat(result.score()).isEqualTo(0.85, offset(1e-9));
        }
    }
}
