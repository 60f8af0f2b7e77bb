package com.knowledgechain.infrastructure.knowledge.ranking;

import com.knowledgechain.domain.answer.model.Domain;
import com.knowledgechain.domain.answer.model.QueryType;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.knowledgechain.infrastructure.knowledge.source.KnowledgeSource.DUCKDUCKGO;
import static com.knowledgechain.infrastructure.knowledge.source.KnowledgeSource.WIKIDATA_SPARQL;
import static com.knowledgechain.infrastructure.knowledge.source.KnowledgeSource.WIKIPEDIA;

/**
 * Orders knowledge sources for a query: query-type priority first, then domain priority,
 * then whatever else is available.
 */
@Component
public class SourceRanker {

    private static final List<String> TEXT_FIRST = List.of(WIKIPEDIA, DUCKDUCKGO, WIKIDATA_SPARQL);

    private static final Map<Domain, List<String>> DOMAIN_PRIORITY = Map.of(
            Domain.FACTUAL, List.of(WIKIDATA_SPARQL, WIKIPEDIA, DUCKDUCKGO),
            Domain.MEDICAL, TEXT_FIRST,
            Domain.PHYSICS, TEXT_FIRST,
            Domain.BIOLOGY, TEXT_FIRST
    );

    private static final Map<QueryType, List<String>> QUERY_TYPE_PRIORITY = Map.of(
            QueryType.SPARQL, List.of(WIKIDATA_SPARQL),
            QueryType.MEDICAL, List.of(WIKIPEDIA),
            QueryType.NATURAL_LANGUAGE, List.of(WIKIPEDIA, DUCKDUCKGO)
    );

    public List<String> rankSources(Domain domain, QueryType queryType, Collection<String> available) {
        Set<String> ranked = new LinkedHashSet<>();
        Set<String> availableSet = new LinkedHashSet<>(available);

        for (String name : QUERY_TYPE_PRIORITY.getOrDefault(queryType, List.of())) {
            if (availableSet.contains(name)) {
                ranked.add(name);
            }
        }
        for (String name : DOMAIN_PRIORITY.getOrDefault(domain, List.of())) {
            if (availableSet.contains(name)) {
                ranked.add(name);
            }
        }
        ranked.addAll(availableSet);
        return List.copyOf(ranked);
    }

    public Optional<String> selectBestSource(Domain domain, QueryType queryType, Collection<String> available) {
        return rankSources(domain, queryType, available).stream().findFirst();
    }

    public List<String> fallbackSources(Domain domain, QueryType queryType, Collection<String> available,
                                        String exclude) {
        return rankSources(domain, queryType, available).stream()
                .filter(name -> !name.equals(exclude))
                .toList();
    }
}
