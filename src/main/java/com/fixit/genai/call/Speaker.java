package com.fixit.genai.call;

public enum Speaker {
    AGENT,
    CUSTOMER,
    UNKNOWN
}
