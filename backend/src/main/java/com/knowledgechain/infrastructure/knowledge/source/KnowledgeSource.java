package com.knowledgechain.infrastructure.knowledge.source;

import java.util.List;

/**
 * A searchable knowledge provider.
 * <p>
 * Implementations must never throw from {@link #search}: any transient failure yields an empty
 * list so callers can fall back to the next source.
 * </p>
 */
public interface KnowledgeSource {

    String WIKIDATA_SPARQL = "wikidata_sparql";
    String WIKIPEDIA = "wikipedia";
    String DUCKDUCKGO = "duckduckgo";

    String name();

    List<String> search(String query, int topK);

    /**
     * True for sources that take a structured graph query (SPARQL) rather than search text.
     */
    default boolean structuredGraph() {
        return false;
    }
}
