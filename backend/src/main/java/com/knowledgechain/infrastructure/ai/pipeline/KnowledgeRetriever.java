package com.knowledgechain.infrastructure.ai.pipeline;

import com.knowledgechain.domain.answer.model.Domain;
import com.knowledgechain.domain.answer.model.KnowledgeItem;
import com.knowledgechain.domain.answer.model.Query;
import com.knowledgechain.domain.answer.model.QueryType;
import com.knowledgechain.domain.answer.model.RetrievalOutcome;
import com.knowledgechain.infrastructure.knowledge.ranking.RelevanceScorer;
import com.knowledgechain.infrastructure.knowledge.ranking.SourceRanker;
import com.knowledgechain.infrastructure.knowledge.source.KnowledgeSource;
import com.knowledgechain.infrastructure.knowledge.source.KnowledgeSourceRegistry;
import com.knowledgechain.infrastructure.knowledge.source.SparqlQueries;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Executes a generated query against the ranked knowledge sources and reduces the results to
 * a short evidence text.
 * <p>
 * SPARQL queries go to the structured graph source alone first; only if it returns nothing are the
 * text sources searched with the keywords of the query. Every other query type fans out to all
 * ranked sources concurrently, each bounded by the per-source timeout.
 * </p>
 */
@Slf4j
@Component
public class KnowledgeRetriever {

    public static final String NO_RESULTS = "No results found";

    static final double PRIMARY_GRAPH_THRESHOLD = 0.0;
    static final double PRIMARY_THRESHOLD = 0.10;
    static final double FALLBACK_THRESHOLD = 0.15;
    static final int MIN_EVIDENCE_LENGTH = 10;

    private final AdaptiveQueryGenerator queryGenerator;
    private final KnowledgeSourceRegistry registry;
    private final SourceRanker sourceRanker;
    private final RelevanceScorer relevanceScorer;
    private final Executor executor;
    private final int topK;
    private final long sourceTimeoutMs;

    public KnowledgeRetriever(AdaptiveQueryGenerator queryGenerator,
                              KnowledgeSourceRegistry registry,
                              SourceRanker sourceRanker,
                              RelevanceScorer relevanceScorer,
                              @Qualifier("knowledgeExecutor") Executor executor,
                              @Value("${knowledge.top-k:3}") int topK,
                              @Value("${knowledge.source-timeout-ms:10000}") long sourceTimeoutMs) {
        this.queryGenerator = queryGenerator;
        this.registry = registry;
        this.sourceRanker = sourceRanker;
        this.relevanceScorer = relevanceScorer;
        this.executor = executor;
        this.topK = topK;
        this.sourceTimeoutMs = sourceTimeoutMs;
    }

    /**
     * One retrieval attempt for a rationale in a domain. Never throws.
     */
    public RetrievalOutcome retrieve(String rationale, Domain domain) {
        try {
            Query query = queryGenerator.generateQuery(rationale, domain);
            String evidence = executeQuery(query.text(), query.type(), domain);
            if (isNonTrivial(evidence)) {
                return RetrievalOutcome.success(evidence);
            }
            return RetrievalOutcome.empty();
        } catch (Exception e) {
            log.warn("[Retrieval] attempt failed for domain {}: {}", domain, e.getMessage());
            return RetrievalOutcome.failure(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    /**
     * @return top-k evidence snippets joined by newlines, or {@link #NO_RESULTS}
     */
    public String executeQuery(String query, QueryType queryType, Domain domain) {
        if (query == null || query.isBlank()) {
            return NO_RESULTS;
        }
        try {
            List<String> candidates = sourceRanker.rankSources(domain, queryType, registry.names());
            if (candidates.isEmpty()) {
                return NO_RESULTS;
            }
            List<KnowledgeItem> items = queryType == QueryType.SPARQL && isStructured(candidates.get(0))
                    ? graphFirst(query, candidates)
                    : fanOut(query, candidates);

            if (items.isEmpty()) {
                log.info("[Retrieval] no relevant results ({} / {})", queryType, domain);
                return NO_RESULTS;
            }
            String evidence = relevanceScorer.topK(items, topK).stream()
                    .map(KnowledgeItem::content)
                    .collect(Collectors.joining("\n"));
            log.info("[Retrieval] {} items kept ({} / {}), {} chars", Math.min(items.size(), topK),
                    queryType, domain, evidence.length());
            return evidence;
        } catch (Exception e) {
            log.warn("[Retrieval] query execution failed: {}", e.getMessage());
            return NO_RESULTS;
        }
    }

    public static boolean isNonTrivial(String evidence) {
        return evidence != null
                && !NO_RESULTS.equals(evidence)
                && evidence.strip().length() > MIN_EVIDENCE_LENGTH;
    }

    private List<KnowledgeItem> graphFirst(String sparql, List<String> candidates) {
        String primary = candidates.get(0);
        String keywords = SparqlQueries.toKeywords(SparqlQueries.clean(sparql));

        List<String> primaryResults = searchAll(sparql, List.of(primary)).getOrDefault(primary, List.of());
        if (!primaryResults.isEmpty()) {
            return relevanceScorer.filterByThreshold(
                    relevanceScorer.score(keywords, primaryResults, primary), PRIMARY_GRAPH_THRESHOLD);
        }

        if (keywords.isBlank()) {
            return List.of();
        }
        List<String> fallbacks = candidates.subList(1, candidates.size());
        log.debug("[Retrieval] {} empty, falling back to {} with '{}'", primary, fallbacks, keywords);
        return scoreAndFilter(keywords, searchAll(keywords, fallbacks), FALLBACK_THRESHOLD);
    }

    private List<KnowledgeItem> fanOut(String query, List<String> candidates) {
        Map<String, List<String>> results = searchAll(query, candidates);
        boolean primaryHit = !results.getOrDefault(candidates.get(0), List.of()).isEmpty();
        return scoreAndFilter(query, results, primaryHit ? PRIMARY_THRESHOLD : FALLBACK_THRESHOLD);
    }

    private List<KnowledgeItem> scoreAndFilter(String query, Map<String, List<String>> results, double threshold) {
        List<KnowledgeItem> scored = new ArrayList<>();
        results.forEach((source, snippets) -> scored.addAll(relevanceScorer.score(query, snippets, source)));
        return relevanceScorer.filterByThreshold(relevanceScorer.sortByScore(scored), threshold);
    }

    /**
     * Queries the named sources concurrently. A source that fails or exceeds the timeout
     * contributes nothing.
     *
     * @return non-empty results per source, in the given source order
     */
    private Map<String, List<String>> searchAll(String query, List<String> sourceNames) {
        Map<String, CompletableFuture<List<String>>> futures = new LinkedHashMap<>();
        for (String name : sourceNames) {
            registry.get(name).ifPresent(source -> futures.put(name,
                    CompletableFuture.supplyAsync(() -> searchQuietly(source, query), executor)));
        }

        try {
            CompletableFuture.allOf(futures.values().toArray(CompletableFuture[]::new))
                    .get(sourceTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException te) {
            log.warn("[Retrieval] source query timed out after {} ms", sourceTimeoutMs);
            futures.values().forEach(f -> f.cancel(true));
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException ee) {
            log.debug("[Retrieval] source query failed: {}", ee.getMessage());
        }

        Map<String, List<String>> results = new LinkedHashMap<>();
        futures.forEach((name, future) -> {
            List<String> snippets = resultOf(future);
            if (!snippets.isEmpty()) {
                results.put(name, snippets);
            }
        });
        return results;
    }

    private List<String> searchQuietly(KnowledgeSource source, String query) {
        try {
            List<String> snippets = source.search(query, topK);
            return snippets == null ? List.of() : snippets;
        } catch (RuntimeException e) {
            log.warn("[Retrieval] {} failed: {}", source.name(), e.getMessage());
            return List.of();
        }
    }

    private static List<String> resultOf(CompletableFuture<List<String>> future) {
        if (!future.isDone() || future.isCompletedExceptionally() || future.isCancelled()) {
            return List.of();
        }
        return future.getNow(List.of());
    }

    private boolean isStructured(String sourceName) {
        return registry.get(sourceName).map(KnowledgeSource::structuredGraph).orElse(false);
    }
}
