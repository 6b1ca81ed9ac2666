package com.fixit.genai.state;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * What a workflow node hands to the nodes that depend on it.
 */
public interface StageOutput {

    @JsonIgnore
    String stageName();
}
