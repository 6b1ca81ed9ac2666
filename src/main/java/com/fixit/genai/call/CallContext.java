package com.fixit.genai.call;

/**
 * Read-only input shared by every node of one call evaluation.
 */
public record CallContext(CallTranscript request, ParsedTranscript transcript) {

    public String callId() {
        return request.callId();
    }
}
