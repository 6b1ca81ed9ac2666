package com.fixit.genai.lead;

import com.fixit.genai.analysis.Analysis;
import com.fixit.genai.analysis.TextAnalyzer;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Keyword analysis of lead notes. Deterministic and total; the baseline for every notes score.
 * <p>
 * Starts at 0.5 and moves by fixed steps per signal group: urgency +0.20, timeline +0.15,
 * positive +0.15, negative -0.30. Negative phrases are removed before the positive pass, so
 * "not interested" never also counts as "interested".
 * </p>
 * <p>
 * Keywords match at the start of a word, so inflected forms count too: "urgently" is
 * urgency and "seriously" is a positive signal, but "already" is not "ready".
 * </p>
 */
@Component
public class HeuristicNotesAnalyzer implements TextAnalyzer<String> {

    static final double NEUTRAL = 0.5;
    static final double URGENCY_BOOST = 0.20;
    static final double TIMELINE_BOOST = 0.15;
    static final double POSITIVE_BOOST = 0.15;
    static final double NEGATIVE_PENALTY = 0.30;

    private static final List<String> URGENCY = List.of(
            "urgent", "asap", "immediately", "priority", "today", "tomorrow",
            "this week", "this weekend", "ready to book", "ready to buy",
            "booking amount ready", "cash ready", "!!", "vip");

    private static final List<String> TIMELINE = List.of(
            "march", "april", "diwali", "pongal", "next month", "by end of",
            "within", "before", "possession", "shifting", "relocating");

    private static final List<String> POSITIVE = List.of(
            "interested", "likes", "loved", "genuine", "serious", "confirmed",
            "scheduled", "ready", "approved", "flexible", "cash buyer");

    private static final List<String> NEGATIVE = List.of(
            "not serious", "fake", "spam", "wrong number", "window shopping",
            "not picking", "not interested", "unrealistic", "just browsing");

    @Override
    public Analysis analyze(String notes) {
        if (notes == null || notes.isBlank()) {
            return Analysis.heuristic(NEUTRAL, List.of("No notes available"));
        }

        String text = notes.toLowerCase(Locale.ROOT);
        double score = NEUTRAL;
        List<String> reasons = new ArrayList<>();

        List<String> negative = matches(NEGATIVE, text);
        String withoutNegatives = text;
        for (String phrase : negative) {
            withoutNegatives = withoutNegatives.replace(phrase, " ");
        }

        List<String> urgency = matches(URGENCY, text);
        if (!urgency.isEmpty()) {
            score += URGENCY_BOOST;
            reasons.add("Urgency signals detected: " + firstTwo(urgency));
        }

        List<String> timeline = matches(TIMELINE, text);
        if (!timeline.isEmpty()) {
            score += TIMELINE_BOOST;
            reasons.add("Timeline mentioned: " + timeline.get(0));
        }

        List<String> positive = matches(POSITIVE, withoutNegatives);
        if (!positive.isEmpty()) {
            score += POSITIVE_BOOST;
            reasons.add("Positive signals: " + firstTwo(positive));
        }

        if (!negative.isEmpty()) {
            score -= NEGATIVE_PENALTY;
            reasons.add("Negative signals: " + firstTwo(negative));
        }

        if (reasons.isEmpty()) {
            reasons.add("Neutral notes content");
        }
        return Analysis.heuristic(score, reasons);
    }

    /**
     * Keywords found in {@code text}, in list order. A keyword that is part of a longer
     * matched keyword ("this week" inside "this weekend") is dropped.
     */
    static List<String> matches(List<String> keywords, String text) {
        List<String> found = new ArrayList<>();
        for (String keyword : keywords) {
            if (keywordPattern(keyword).matcher(text).find()) {
                found.add(keyword);
            }
        }
        List<String> result = new ArrayList<>();
        for (String keyword : found) {
            boolean shadowed = found.stream()
                    .anyMatch(other -> !other.equals(keyword) && other.contains(keyword));
            if (!shadowed) {
                result.add(keyword);
            }
        }
        return result;
    }

    private static Pattern keywordPattern(String keyword) {
        String prefix = Character.isLetterOrDigit(keyword.charAt(0)) ? "\\b" : "";
        return Pattern.compile(prefix + Pattern.quote(keyword));
    }

    private static String firstTwo(List<String> keywords) {
        return String.join(", ", keywords.subList(0, Math.min(2, keywords.size())));
    }
}
