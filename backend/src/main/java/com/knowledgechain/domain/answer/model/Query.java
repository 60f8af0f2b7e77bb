package com.knowledgechain.domain.answer.model;

/**
 * A retrieval query generated from one rationale for one domain.
 */
public record Query(String text, QueryType type, Domain domain) {}
