package com.knowledgechain.domain.answer.model;

import java.util.List;

/**
 * Knowledge domains a question can be routed to. Each domain steers query style and source priority.
 */
public enum Domain {
    FACTUAL("factual", List.of("factual", "wikipedia", "historical", "geographic", "political", "general knowledge")),
    MEDICAL("medical", List.of("medical", "health", "disease", "treatment", "medicine", "patient", "clinical", "diagnosis")),
    PHYSICS("physics", List.of("physics", "force", "energy", "motion", "quantum", "relativity", "mechanics", "electromagnetic")),
    BIOLOGY("biology", List.of("biology", "organism", "cell", "genetics", "evolution", "species", "molecular", "biochemical"));

    private final String label;
    private final List<String> keywords;

    Domain(String label, List<String> keywords) {
        this.label = label;
        this.keywords = keywords;
    }

    public String label() {
        return label;
    }

    /**
     * Keyword family used to recognise this domain in a free-text classification reply.
     */
    public List<String> keywords() {
        return keywords;
    }
}
