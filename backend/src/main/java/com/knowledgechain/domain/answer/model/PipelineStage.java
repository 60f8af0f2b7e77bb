package com.knowledgechain.domain.answer.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which path produced the final answer.
 */
public enum PipelineStage {
    CONSENSUS_VALIDATED("consensus_validated"),
    FULL_PIPELINE("full_pipeline");

    private final String value;

    PipelineStage(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
