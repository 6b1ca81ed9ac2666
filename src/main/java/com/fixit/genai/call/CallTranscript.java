package com.fixit.genai.call;

/**
 * A sales call to evaluate.
 *
 * @param callId          call identifier
 * @param leadId          associated lead, may be null
 * @param transcript      speaker-tagged turns ("Agent: ...", "Customer: ...")
 * @param durationSeconds call length, may be null
 */
public record CallTranscript(String callId, String leadId, String transcript, Integer durationSeconds) {
}
