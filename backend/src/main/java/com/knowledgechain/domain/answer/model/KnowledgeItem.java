package com.knowledgechain.domain.answer.model;

/**
 * A retrieved snippet with its relevance to the query.
 *
 * @param content snippet text
 * @param score   relevance in [0, 1]
 * @param source  name of the knowledge source that produced it
 */
public record KnowledgeItem(String content, double score, String source) {

    public KnowledgeItem {
        score = Math.min(1.0, Math.max(0.0, score));
    }
}
