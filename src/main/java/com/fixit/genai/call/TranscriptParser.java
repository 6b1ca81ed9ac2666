package com.fixit.genai.call;

import com.fixit.genai.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Validates and splits a transcript into turns. Recognised tags: {@code Agent:}/{@code A:}
 * and {@code Customer:}/{@code C:}/{@code Client:}; untagged lines continue the previous turn.
 */
@Slf4j
@Component
public class TranscriptParser {

    static final int MIN_TRANSCRIPT_LENGTH = 10;

    private static final Pattern SPEAKER_LINE = Pattern.compile(
            "^\\s*(agent|a|sales|customer|c|client|caller)\\s*:\\s*(.*)$", Pattern.CASE_INSENSITIVE);

    public ParsedTranscript parse(CallTranscript call) {
        if (call == null) {
            throw new ValidationException("Call transcript is required");
        }
        if (call.callId() == null || call.callId().isBlank()) {
            throw new ValidationException("call_id is required");
        }
        if (call.durationSeconds() != null && call.durationSeconds() < 0) {
            throw new ValidationException("duration_seconds must be non-negative but was " + call.durationSeconds());
        }
        String cleaned = call.transcript() == null ? "" : call.transcript().strip();
        if (cleaned.length() < MIN_TRANSCRIPT_LENGTH) {
            throw new ValidationException("Transcript too short or empty (minimum "
                    + MIN_TRANSCRIPT_LENGTH + " characters)");
        }

        List<Turn> turns = new ArrayList<>();
        Speaker currentSpeaker = null;
        StringBuilder current = new StringBuilder();
        boolean tagged = false;

        for (String line : cleaned.split("\\R")) {
            if (line.isBlank()) {
                continue;
            }
            Matcher matcher = SPEAKER_LINE.matcher(line);
            if (matcher.matches()) {
                tagged = true;
                if (currentSpeaker != null) {
                    turns.add(new Turn(currentSpeaker, current.toString().strip()));
                }
                currentSpeaker = speakerOf(matcher.group(1));
                current = new StringBuilder(matcher.group(2));
            } else {
                if (currentSpeaker == null) {
                    currentSpeaker = Speaker.UNKNOWN;
                }
                current.append(' ').append(line.strip());
            }
        }
        if (currentSpeaker != null) {
            turns.add(new Turn(currentSpeaker, current.toString().strip()));
        }

        if (!tagged) {
            log.warn("Call {}: transcript has no speaker tags, analysing it as a monologue", call.callId());
        }
        return new ParsedTranscript(call.callId(), cleaned, turns, tagged);
    }

    private static Speaker speakerOf(String tag) {
        switch (tag.toLowerCase(Locale.ROOT)) {
            case "agent":
            case "a":
            case "sales":
                return Speaker.AGENT;
            default:
                return Speaker.CUSTOMER;
        }
    }
}
