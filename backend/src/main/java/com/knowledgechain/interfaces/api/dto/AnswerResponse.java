package com.knowledgechain.interfaces.api.dto;

import com.knowledgechain.domain.answer.model.Confidence;
import com.knowledgechain.domain.answer.model.Domain;
import com.knowledgechain.domain.answer.model.PipelineResult;
import com.knowledgechain.domain.answer.model.PipelineStage;
import com.knowledgechain.domain.answer.model.PipelineState;
import com.knowledgechain.domain.answer.model.Rationale;

import java.util.List;
import java.util.Map;

public record AnswerResponse(
        String answer,
        PipelineStage stage,
        Confidence confidence,
        List<String> domains,
        List<String> rationales,
        List<String> correctedRationales,
        Map<String, String> modelsUsed,
        List<PipelineState> states
) {
    public static AnswerResponse from(PipelineResult result) {
        return new AnswerResponse(
                result.answer(),
                result.stage(),
                result.confidence(),
                result.domains().stream().map(Domain::label).toList(),
                result.rationales().stream().map(Rationale::text).toList(),
                result.correctedRationales(),
                result.modelsUsed(),
                result.states()
        );
    }
}
