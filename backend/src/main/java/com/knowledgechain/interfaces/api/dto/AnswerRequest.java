package com.knowledgechain.interfaces.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record AnswerRequest(
        @NotBlank(message = "Question is required")
        String question,

        @Size(max = 50, message = "Dataset hint must not exceed 50 characters")
        String datasetHint
) {}
