package com.knowledgechain.domain.answer.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Confidence {
    HIGH("high"),     // validated consensus, no retrieval
    MEDIUM("medium"); // full retrieval + consolidation

    private final String value;

    Confidence(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
