package com.fixit.genai.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fixit.genai.exception.ModelUnavailableException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelOutputParserTest {

    private final ModelOutputParser parser = new ModelOutputParser(new ObjectMapper());

    @Nested
    @DisplayName("parseObject")
    class ParseObject {

        @Test
        @DisplayName("should accept plain JSON")
        void plain() {
            JsonNode node = parser.parseObject("{\"score\": 0.7}");

            assertThat(node.get("score").asDouble()).isEqualTo(0.7);
        }

        @Test
        @DisplayName("should accept JSON inside a markdown fence")
        void fenced() {
            JsonNode node = parser.parseObject("Here you go:\n```json\n{\"score\": 0.4}\n```\nHope it helps");

            assertThat(node.get("score").asDouble()).isEqualTo(0.4);
        }

        @Test
        @DisplayName("should accept JSON surrounded by prose")
        void prose() {
            JsonNode node = parser.parseObject("Sure! {\"score\": 0.9, \"reasons\": [\"urgent\"]} Thanks.");

            assertThat(node.get("reasons").get(0).asText()).isEqualTo("urgent");
        }

        @Test
        @DisplayName("should keep looking when the text starts with a JSON value that is not an object")
        void leadingScalar() {
            JsonNode node = parser.parseObject("0.8 {\"score\": 0.7}");

            assertThat(node.get("score").asDouble()).isEqualTo(0.7);
        }

        @Test
        @DisplayName("should reject a lone JSON array")
        void rejectsArray() {
            assertThatThrownBy(() -> parser.parseObject("[0.8, 0.7]"))
                    .isInstanceOf(ModelUnavailableException.class);
        }

        @Test
        @DisplayName("should reject text without a JSON object as MALFORMED_RESPONSE")
        void rejectsProse() {
            assertThatThrownBy(() -> parser.parseObject("The lead looks promising."))
                    .isInstanceOf(ModelUnavailableException.class)
                    .extracting(e -> ((ModelUnavailableException) e).getKind())
                    .isEqualTo(FailureKind.MALFORMED_RESPONSE);
        }
    }

    @Nested
    @DisplayName("Field readers")
    class Fields {

        @Test
        @DisplayName("should clamp scores into [0,1] and accept numeric strings")
        void clampsScores() {
            assertThat(parser.readUnitScore(parser.parseObject("{\"score\": 1.7}"), "score")).isEqualTo(1.0);
            assertThat(parser.readUnitScore(parser.parseObject("{\"score\": -2}"), "score")).isEqualTo(0.0);
            assertThat(parser.readUnitScore(parser.parseObject("{\"score\": \"0.35\"}"), "score")).isEqualTo(0.35);
        }

        @Test
        @DisplayName("should treat a missing or non-numeric score as malformed")
        void missingScore() {
            JsonNode node = parser.parseObject("{\"score\": \"high\"}");

            assertThatThrownBy(() -> parser.readUnitScore(node, "score"))
                    .isInstanceOf(ModelUnavailableException.class);
            assertThatThrownBy(() -> parser.readUnitScore(node, "rating"))
                    .isInstanceOf(ModelUnavailableException.class);
        }

        @Test
        @DisplayName("should read string arrays, single strings and absent fields")
        void strings() {
            JsonNode node = parser.parseObject("{\"a\": [\"x\", \" \", \"y\"], \"b\": \"z\"}");

            assertThat(parser.readStrings(node, "a")).containsExactly("x", "y");
            assertThat(parser.readStrings(node, "b")).containsExactly("z");
            assertThat(parser.readStrings(node, "c")).isEmpty();
            assertThat(parser.readText(node, "c", "fallback")).isEqualTo("fallback");
        }
    }
}
