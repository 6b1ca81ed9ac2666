package com.fixit.genai.call;

public record Turn(Speaker speaker, String text) {
}
