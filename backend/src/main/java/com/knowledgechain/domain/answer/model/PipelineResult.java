package com.knowledgechain.domain.answer.model;

import java.util.List;
import java.util.Map;

/**
 * Final output of the question-answering pipeline.
 *
 * @param answer               consolidated (or early-stopped consensus) answer
 * @param stage                which path produced the answer
 * @param confidence           HIGH for validated consensus, MEDIUM for the full pipeline
 * @param domains              domains identified for the question, in order
 * @param rationales           the k sampled rationales
 * @param correctedRationales  same length and order as rationales; empty on early stop
 * @param modelsUsed           stage name to model name
 * @param states               state-machine trace traversed for this question
 */
public record PipelineResult(
        String answer,
        PipelineStage stage,
        Confidence confidence,
        List<Domain> domains,
        List<Rationale> rationales,
        List<String> correctedRationales,
        Map<String, String> modelsUsed,
        List<PipelineState> states
) {}
