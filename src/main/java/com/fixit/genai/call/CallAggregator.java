package com.fixit.genai.call;

import com.fixit.genai.analysis.Analysis;
import com.fixit.genai.analysis.AnalysisMode;
import com.fixit.genai.config.CallWeights;
import com.fixit.genai.config.ScoringSettings;
import com.fixit.genai.state.StageResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Combines the four stage labels into the call quality score.
 * <pre>
 * quality = w_rapport * rapport + w_need * need_discovery + w_closing * closing
 *         + w_compliance * (1 - compliance_risk)
 * </pre>
 * A stage without a result contributes {@link #NEUTRAL_LABEL}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CallAggregator {

    public static final double NEUTRAL_LABEL = 0.5;

    private final ScoringSettings settings;

    public CallScore aggregate(Map<CallStage, StageResult> completed) {
        Map<CallStage, Double> labels = new EnumMap<>(CallStage.class);
        List<String> degraded = new ArrayList<>();
        List<String> heuristic = new ArrayList<>();

        for (CallStage stage : CallStage.values()) {
            StageResult result = completed.get(stage);
            if (result == null) {
                log.warn("Stage {} has no result, using neutral label {}", stage.getNodeName(), NEUTRAL_LABEL);
                labels.put(stage, NEUTRAL_LABEL);
                degraded.add(stage.getNodeName());
                continue;
            }
            labels.put(stage, result.label());
            if (result.mode() == AnalysisMode.DEGRADED) {
                heuristic.add(stage.getNodeName());
            }
        }

        CallLabels callLabels = new CallLabels(
                labels.get(CallStage.RAPPORT_BUILDING),
                labels.get(CallStage.NEED_DISCOVERY),
                labels.get(CallStage.CLOSING_ATTEMPT),
                labels.get(CallStage.COMPLIANCE_RISK));
        double quality = quality(callLabels);
        return new CallScore(callLabels, quality, quality >= settings.goodCallThreshold(),
                completed, degraded, heuristic);
    }

    public double quality(CallLabels labels) {
        double quality = 0.0;
        for (CallStage stage : CallStage.values()) {
            quality += weight(stage) * stage.quality(labels.get(stage));
        }
        return Analysis.clamp(quality);
    }

    private double weight(CallStage stage) {
        CallWeights weights = settings.callWeights();
        return switch (stage) {
            case RAPPORT_BUILDING -> weights.rapport();
            case NEED_DISCOVERY -> weights.needDiscovery();
            case CLOSING_ATTEMPT -> weights.closing();
            case COMPLIANCE_RISK -> weights.compliance();
        };
    }
}
