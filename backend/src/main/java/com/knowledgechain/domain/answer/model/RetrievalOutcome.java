package com.knowledgechain.domain.answer.model;

/**
 * Result of one retrieval attempt for a (rationale, domain) pair.
 *
 * @param status   SUCCESS carries evidence, EMPTY and FAILURE do not
 * @param evidence newline-joined evidence text (SUCCESS only)
 * @param reason   failure description (FAILURE only)
 */
public record RetrievalOutcome(Status status, String evidence, String reason) {

    public enum Status {
        SUCCESS,
        EMPTY,
        FAILURE
    }

    public static RetrievalOutcome success(String evidence) {
        return new RetrievalOutcome(Status.SUCCESS, evidence, null);
    }

    public static RetrievalOutcome empty() {
        return new RetrievalOutcome(Status.EMPTY, null, null);
    }

    public static RetrievalOutcome failure(String reason) {
        return new RetrievalOutcome(Status.FAILURE, null, reason);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }
}
