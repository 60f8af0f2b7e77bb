package com.knowledgechain.domain.answer.service;

import com.knowledgechain.domain.answer.model.PipelineResult;

/**
 * Domain service interface for answering a question or verifying a claim.
 */
public interface QuestionAnsweringService {

    /**
     * Literal marker that makes a question claim-style (fact verification).
     */
    String CLAIM_MARKER = "Claim:";

    /**
     * Answer a question end to end.
     *
     * @param question    the question, or a claim prefixed with {@link #CLAIM_MARKER}
     * @param datasetHint optional benchmark hint steering the reasoning prompt (nullable)
     * @return the pipeline result
     */
    PipelineResult run(String question, String datasetHint);

    static boolean isClaimStyle(String question) {
        return question != null && question.contains(CLAIM_MARKER);
    }
}
