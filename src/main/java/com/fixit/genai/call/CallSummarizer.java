package com.fixit.genai.call;

import com.fasterxml.jackson.databind.JsonNode;
import com.fixit.genai.config.ScoringSettings;
import com.fixit.genai.exception.ModelUnavailableException;
import com.fixit.genai.llm.FailureKind;
import com.fixit.genai.llm.ModelClient;
import com.fixit.genai.llm.ModelOutputParser;
import com.fixit.genai.llm.ModelRequest;
import com.fixit.genai.llm.ModelResponse;
import com.fixit.genai.llm.PromptTemplates;
import com.fixit.genai.state.StageResult;
import dev.langchain4j.model.input.PromptTemplate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Writes the narrative of a verdict: model summary when available, templated otherwise.
 * <p>
 * The templated path sorts dimensions into strengths and weaknesses around {@link #STRONG_LABEL}
 * (compliance risk inverted) and proposes one action per weak dimension.
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CallSummarizer {

    static final double STRONG_LABEL = 0.5;
    static final String CONFIRM_NEXT_STEP = "Confirm the scheduled next step with the customer";

    private static final Map<CallStage, String> STRENGTHS = Map.of(
            CallStage.RAPPORT_BUILDING, "rapport building",
            CallStage.NEED_DISCOVERY, "need discovery",
            CallStage.CLOSING_ATTEMPT, "closing",
            CallStage.COMPLIANCE_RISK, "compliance");

    private static final Map<CallStage, String> ACTIONS = Map.of(
            CallStage.RAPPORT_BUILDING, "Open with a proper greeting and address the customer by name",
            CallStage.NEED_DISCOVERY, "Ask about budget, preferred location, timeline and property type",
            CallStage.CLOSING_ATTEMPT, "Propose a concrete next step such as a site visit with a date and time",
            CallStage.COMPLIANCE_RISK, "Avoid pressure tactics and promises of guaranteed returns");

    private final ModelClient modelClient;
    private final ModelOutputParser parser;
    private final ScoringSettings settings;

    public CallSummary summarize(ParsedTranscript transcript, CallScore score) {
        try {
            return fromModel(transcript, score);
        } catch (ModelUnavailableException e) {
            log.warn("[call-summary] model unavailable ({}), using templated summary: {}",
                    e.getKind(), e.getMessage());
            return templated(score);
        }
    }

    private CallSummary fromModel(ParsedTranscript transcript, CallScore score) {
        CallLabels labels = score.labels();
        Map<String, Object> variables = new HashMap<>();
        variables.put("rapport", format(labels.rapportBuilding()));
        variables.put("needDiscovery", format(labels.needDiscovery()));
        variables.put("closing", format(labels.closingAttempt()));
        variables.put("compliance", format(labels.complianceRisk()));
        variables.put("transcript", transcript.text());
        String prompt = PromptTemplate.from(PromptTemplates.CALL_SUMMARY).apply(variables).text();

        ModelResponse response = modelClient.generate(
                new ModelRequest(PromptTemplates.CALL_SYSTEM, prompt, settings.llmTimeout()));
        JsonNode json = parser.parseObject(response.text());
        String summary = parser.readText(json, "summary", "");
        if (summary.isBlank()) {
            throw new ModelUnavailableException(FailureKind.MALFORMED_RESPONSE,
                    "Model summary has no 'summary' field");
        }
        List<String> nextActions = new ArrayList<>(parser.readStrings(json, "next_actions"));
        if (nextActions.isEmpty()) {
            nextActions.addAll(templatedActions(score));
        }
        return new CallSummary(withDegradedNote(summary, score),
                parser.readStrings(json, "key_points"), nextActions, response);
    }

    /**
     * Summary built from the labels alone. Deterministic.
     */
    public CallSummary templated(CallScore score) {
        List<String> strengths = new ArrayList<>();
        List<String> weaknesses = new ArrayList<>();
        for (CallStage stage : CallStage.values()) {
            double quality = stage.quality(score.labels().get(stage));
            if (quality >= STRONG_LABEL) {
                strengths.add(STRENGTHS.get(stage));
            } else {
                weaknesses.add(STRENGTHS.get(stage));
            }
        }

        StringBuilder summary = new StringBuilder()
                .append(score.isGoodCall() ? "Good call" : "Call needs improvement")
                .append(String.format(Locale.ROOT, " (quality %.2f).", score.qualityScore()));
        if (!strengths.isEmpty()) {
            summary.append(" Strengths: ").append(String.join(", ", strengths)).append('.');
        }
        if (!weaknesses.isEmpty()) {
            summary.append(" Needs improvement: ").append(String.join(", ", weaknesses)).append('.');
        }

        List<String> keyPoints = new ArrayList<>();
        for (CallStage stage : CallStage.values()) {
            StageResult result = score.results().get(stage);
            if (result != null && !result.evidence().isEmpty()) {
                keyPoints.add(stage.getNodeName() + ": " + result.evidence().get(0));
            }
        }
        return new CallSummary(withDegradedNote(summary.toString(), score),
                keyPoints, templatedActions(score), null);
    }

    private List<String> templatedActions(CallScore score) {
        List<String> actions = new ArrayList<>();
        for (CallStage stage : CallStage.values()) {
            if (stage.quality(score.labels().get(stage)) < STRONG_LABEL) {
                actions.add(ACTIONS.get(stage));
            }
        }
        if (score.isGoodCall()) {
            actions.add(CONFIRM_NEXT_STEP);
        }
        return actions;
    }

    private static String withDegradedNote(String summary, CallScore score) {
        if (!score.isDegraded()) {
            return summary;
        }
        StringBuilder text = new StringBuilder(summary);
        if (!score.heuristicStages().isEmpty()) {
            text.append(" [Heuristic analysis (model unavailable): ")
                    .append(String.join(", ", score.heuristicStages())).append(']');
        }
        if (!score.degradedStages().isEmpty()) {
            text.append(" [Degraded: ")
                    .append(String.join(", ", score.degradedStages()))
                    .append(" failed, neutral score used]");
        }
        return text.toString();
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
