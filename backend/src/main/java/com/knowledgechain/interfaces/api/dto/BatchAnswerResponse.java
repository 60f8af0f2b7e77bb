package com.knowledgechain.interfaces.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.knowledgechain.application.answer.AnswerAppService.BatchPrediction;
import com.knowledgechain.domain.answer.model.PipelineStage;

import java.util.List;

public record BatchAnswerResponse(List<Prediction> predictions) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Prediction(String id, String answer, PipelineStage stage, String error) {}

    public static BatchAnswerResponse from(List<BatchPrediction> predictions) {
        return new BatchAnswerResponse(predictions.stream()
                .map(p -> new Prediction(
                        p.id(),
                        p.answer(),
                        p.result() != null ? p.result().stage() : null,
                        p.errorCode()))
                .toList());
    }
}
