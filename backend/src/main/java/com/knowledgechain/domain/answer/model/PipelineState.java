package com.knowledgechain.domain.answer.model;

/**
 * States of the question-answering state machine, in traversal order.
 */
public enum PipelineState {
    START,
    RATIONALE_GENERATION,
    CONSENSUS_CHECK,
    EARLY_STOP,
    RETRIEVAL_LOOP,
    CONSOLIDATION,
    DONE
}
