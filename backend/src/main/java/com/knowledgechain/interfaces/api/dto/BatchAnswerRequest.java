package com.knowledgechain.interfaces.api.dto;

import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record BatchAnswerRequest(
        @NotEmpty(message = "At least one item is required")
        List<Item> items
) {
    /**
     * Question text is validated per item by the service, so one bad item does not reject the batch.
     */
    public record Item(String id, String question, String datasetHint) {}
}
