package com.knowledgechain.infrastructure.ai.pipeline;

import com.knowledgechain.domain.answer.model.*;
import lombok.Data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable per-question state passed through the pipeline stages.
 */
@Data
public class PipelineContext {

    // --- Input ---
    private String question;
    private String datasetHint;

    // --- Stage 1: reasoning ---
    private List<Rationale> rationales = new ArrayList<>();
    private List<String> extractedAnswers = new ArrayList<>();
    private List<Domain> domains = new ArrayList<>();

    // --- Stage 2: retrieval + correction ---
    private List<String> correctedRationales = new ArrayList<>();

    // --- Result ---
    private String answer;
    private PipelineStage stage;
    private Confidence confidence;
    private Map<String, String> modelsUsed = new LinkedHashMap<>();
    private List<PipelineState> states = new ArrayList<>();

    public void enter(PipelineState state) {
        states.add(state);
    }

    public PipelineResult toPipelineResult() {
        return new PipelineResult(
                answer,
                stage,
                confidence,
                List.copyOf(domains),
                List.copyOf(rationales),
                List.copyOf(correctedRationales),
                Collections.unmodifiableMap(new LinkedHashMap<>(modelsUsed)),
                List.copyOf(states)
        );
    }
}
