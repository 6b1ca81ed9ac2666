package com.fixit.genai.call;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Cleaned transcript split into speaker turns.
 *
 * @param callId      call identifier
 * @param text        trimmed raw text, as sent to the model
 * @param turns       turns in order; untagged transcripts become a single {@link Speaker#UNKNOWN} turn
 * @param hasDialogue whether speaker tags were found
 */
public record ParsedTranscript(String callId, String text, List<Turn> turns, boolean hasDialogue) {

    public ParsedTranscript {
        turns = List.copyOf(turns);
    }

    /** Agent turns; without speaker tags every turn is attributed to the agent. */
    public List<Turn> agentTurns() {
        return turns.stream()
                .filter(turn -> turn.speaker() != Speaker.CUSTOMER)
                .toList();
    }

    public String agentText() {
        return join(agentTurns());
    }

    public String customerText() {
        return join(turns.stream().filter(turn -> turn.speaker() == Speaker.CUSTOMER).toList());
    }

    private static String join(List<Turn> selected) {
        return selected.stream()
                .map(Turn::text)
                .collect(Collectors.joining("\n"))
                .toLowerCase(Locale.ROOT);
    }
}
