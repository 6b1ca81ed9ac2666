package com.fixit.genai.call;

import com.fixit.genai.analysis.Analysis;
import com.fixit.genai.analysis.TextAnalyzer;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pattern-based scoring of one call dimension. Deterministic and total.
 *
 * <ul>
 *   <li>rapport: greeting, empathy phrases, personal address</li>
 *   <li>need discovery: clarifying questions asked by the agent, discovery vocabulary</li>
 *   <li>closing: proposed next step, concrete time, customer agreement</li>
 *   <li>compliance risk: pressure, promise and dismissive phrases (higher is worse)</li>
 * </ul>
 */
public class HeuristicStageAnalyzer implements TextAnalyzer<ParsedTranscript> {

    private static final List<String> GREETINGS = List.of(
            "good morning", "good afternoon", "good evening", "hello", "hi", "namaste",
            "welcome", "thank you for calling", "thanks for calling");
    private static final List<String> EMPATHY = List.of(
            "i understand", "sorry", "happy to help", "absolutely", "appreciate", "glad",
            "of course", "no problem", "looking forward");
    private static final List<String> PERSONAL_ADDRESS = List.of(
            "mr", "mrs", "ms", "sir", "ma'am", "madam", "speaking with");

    private static final List<String> DISCOVERY_TOPICS = List.of(
            "budget", "requirement", "looking for", "prefer", "how many", "which area", "location",
            "timeline", "family", "bedroom", "bhk", "what kind", "enquired", "move in");

    private static final List<String> NEXT_STEPS = List.of(
            "schedule", "site visit", "visit", "book", "booking", "appointment", "meeting",
            "i'll send", "i will send", "send you", "call you back", "follow up", "show you", "confirm");
    private static final List<String> AGREEMENT = List.of(
            "yes", "that works", "sounds good", "sure", "okay", "ok", "great", "perfect", "agreed");
    private static final Pattern CONCRETE_TIME = Pattern.compile(
            "\\b(monday|tuesday|wednesday|thursday|friday|saturday|sunday|today|tomorrow|weekend"
                    + "|\\d{1,2}(:\\d{2})?\\s?(am|pm))\\b");

    private static final List<String> PRESSURE = List.of(
            "limited time", "only today", "last chance", "decide now", "decide today", "hurry",
            "prices will go up", "price will increase", "before it's gone", "act fast", "final offer");
    private static final List<String> PROMISES = List.of(
            "guaranteed returns", "guarantee", "100%", "assured returns", "i promise", "no risk",
            "risk-free", "double your money");
    private static final List<String> DISMISSIVE = List.of(
            "can't help", "cannot help", "too low", "not my problem", "waste of time", "whatever");

    private static final Pattern SENTENCE_END = Pattern.compile("(?<=[.?!])\\s+");
    private static final Pattern HONORIFIC_DOT = Pattern.compile("\\b(mr|mrs|ms|dr)\\.", Pattern.CASE_INSENSITIVE);
    static final int CLARIFYING_QUESTION_MIN_WORDS = 4;

    private final CallStage stage;

    public HeuristicStageAnalyzer(CallStage stage) {
        this.stage = stage;
    }

    @Override
    public Analysis analyze(ParsedTranscript transcript) {
        switch (stage) {
            case RAPPORT_BUILDING:
                return rapport(transcript);
            case NEED_DISCOVERY:
                return needDiscovery(transcript);
            case CLOSING_ATTEMPT:
                return closing(transcript);
            case COMPLIANCE_RISK:
                return complianceRisk(transcript);
            default:
                throw new IllegalStateException("Unhandled stage " + stage);
        }
    }

    private Analysis rapport(ParsedTranscript transcript) {
        String agent = transcript.agentText();
        double score = 0.2;
        List<String> evidence = new ArrayList<>();

        List<String> greetings = found(GREETINGS, agent);
        if (!greetings.isEmpty()) {
            score += 0.3;
            evidence.add("Greeting: " + greetings.get(0));
        } else {
            evidence.add("No greeting detected");
        }

        List<String> empathy = found(EMPATHY, agent);
        if (empathy.size() >= 2) {
            score += 0.3;
        } else if (empathy.size() == 1) {
            score += 0.2;
        }
        if (!empathy.isEmpty()) {
            evidence.add("Empathy: " + String.join(", ", empathy));
        }

        if (!found(PERSONAL_ADDRESS, agent).isEmpty()) {
            score += 0.2;
            evidence.add("Customer addressed personally");
        }
        return Analysis.heuristic(score, evidence);
    }

    private Analysis needDiscovery(ParsedTranscript transcript) {
        double score = 0.2;
        List<String> evidence = new ArrayList<>();

        int questions = clarifyingQuestions(transcript);
        score += 0.15 * Math.min(questions, 4);
        evidence.add(questions + " clarifying question(s) across "
                + transcript.agentTurns().size() + " agent turn(s)");

        List<String> topics = found(DISCOVERY_TOPICS, transcript.agentText());
        if (!topics.isEmpty()) {
            score += 0.2;
            evidence.add("Discovery topics: " + String.join(", ", topics));
        }
        return Analysis.heuristic(score, evidence);
    }

    private Analysis closing(ParsedTranscript transcript) {
        String agent = transcript.agentText();
        double score = 0.1;
        List<String> evidence = new ArrayList<>();

        List<String> nextSteps = found(NEXT_STEPS, agent);
        if (nextSteps.isEmpty()) {
            evidence.add("No next step proposed");
            return Analysis.heuristic(score, evidence);
        }
        score += 0.4;
        evidence.add("Next step proposed: " + nextSteps.get(0));

        Matcher time = CONCRETE_TIME.matcher(agent);
        if (time.find()) {
            score += 0.25;
            evidence.add("Concrete time: " + time.group());
        }
        if (!found(AGREEMENT, transcript.customerText()).isEmpty()) {
            score += 0.25;
            evidence.add("Customer agreed");
        }
        return Analysis.heuristic(score, evidence);
    }

    private Analysis complianceRisk(ParsedTranscript transcript) {
        String agent = transcript.agentText();
        double risk = 0.05;
        List<String> evidence = new ArrayList<>();

        List<String> pressure = found(PRESSURE, agent);
        List<String> promises = found(PROMISES, agent);
        risk += 0.3 * (pressure.size() + promises.size());
        if (!pressure.isEmpty()) {
            evidence.add("Pressure language: " + String.join(", ", pressure));
        }
        if (!promises.isEmpty()) {
            evidence.add("Promise language: " + String.join(", ", promises));
        }
        List<String> dismissive = found(DISMISSIVE, agent);
        if (!dismissive.isEmpty()) {
            risk += 0.15;
            evidence.add("Dismissive language: " + String.join(", ", dismissive));
        }
        if (evidence.isEmpty()) {
            evidence.add("No pressure or promise language detected");
        }
        return Analysis.heuristic(risk, evidence);
    }

    /**
     * Agent questions of at least {@value #CLARIFYING_QUESTION_MIN_WORDS} words; one-word
     * prompts such as "Budget?" do not count as discovery.
     */
    static int clarifyingQuestions(ParsedTranscript transcript) {
        int count = 0;
        for (Turn turn : transcript.agentTurns()) {
            String text = HONORIFIC_DOT.matcher(turn.text()).replaceAll("$1");
            for (String sentence : SENTENCE_END.split(text)) {
                String trimmed = sentence.strip();
                if (trimmed.endsWith("?") && trimmed.split("\\s+").length >= CLARIFYING_QUESTION_MIN_WORDS) {
                    count++;
                }
            }
        }
        return count;
    }

    private static List<String> found(List<String> phrases, String text) {
        List<String> result = new ArrayList<>();
        for (String phrase : phrases) {
            if (phrasePattern(phrase).matcher(text).find()) {
                result.add(phrase);
            }
        }
        return result;
    }

    private static Pattern phrasePattern(String phrase) {
        String prefix = Character.isLetterOrDigit(phrase.charAt(0)) ? "\\b" : "";
        String suffix = Character.isLetterOrDigit(phrase.charAt(phrase.length() - 1)) ? "\\b" : "";
        return Pattern.compile(prefix + Pattern.quote(phrase) + suffix);
    }
}
