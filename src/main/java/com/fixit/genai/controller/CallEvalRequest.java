package com.fixit.genai.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fixit.genai.call.CallTranscript;

public record CallEvalRequest(
        @JsonProperty("call_id")          String callId,
        @JsonProperty("lead_id")          String leadId,
        @JsonProperty("transcript")       String transcript,
        @JsonProperty("duration_seconds") Integer durationSeconds
) {

    public CallTranscript toTranscript() {
        return new CallTranscript(callId, leadId, transcript, durationSeconds);
    }
}
