package com.fixit.genai.lead;

/**
 * One rule-based dimension score with its explanation.
 */
public record SubScore(double score, String reason) {
}
