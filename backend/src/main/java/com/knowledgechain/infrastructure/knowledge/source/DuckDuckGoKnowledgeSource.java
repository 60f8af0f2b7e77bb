package com.knowledgechain.infrastructure.knowledge.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * DuckDuckGo Instant Answer API: the abstract plus related-topic texts.
 * Stops issuing requests once the process-wide budget is spent.
 */
@Slf4j
@Component
@Order(3)
@ConditionalOnProperty(prefix = "knowledge.duckduckgo", name = "enabled", havingValue = "true", matchIfMissing = true)
public class DuckDuckGoKnowledgeSource implements KnowledgeSource {

    static final int MAX_SNIPPET_LENGTH = 200;

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final String endpoint;
    private final int requestBudget;
    private final AtomicInteger requestsMade = new AtomicInteger();

    public DuckDuckGoKnowledgeSource(RestClient knowledgeRestClient,
                                     ObjectMapper objectMapper,
                                     @Value("${knowledge.duckduckgo.endpoint:https://api.duckduckgo.com/}") String endpoint,
                                     @Value("${knowledge.duckduckgo.request-budget:100}") int requestBudget) {
        this.restClient = knowledgeRestClient;
        this.objectMapper = objectMapper;
        this.endpoint = endpoint;
        this.requestBudget = requestBudget;
    }

    @Override
    public String name() {
        return DUCKDUCKGO;
    }

    @Override
    public List<String> search(String query, int topK) {
        if (query == null || query.isBlank() || topK <= 0) {
            return List.of();
        }
        if (requestsMade.incrementAndGet() > requestBudget) {
            log.debug("[DuckDuckGo] request budget of {} exhausted", requestBudget);
            return List.of();
        }

        URI uri = UriComponentsBuilder.fromUriString(endpoint)
                .queryParam("q", "{q}")
                .queryParam("format", "json")
                .queryParam("no_html", 1)
                .queryParam("skip_disambig", 1)
                .encode()
                .buildAndExpand(query.strip())
                .toUri();

        try {
            String body = restClient.get().uri(uri).retrieve().body(String.class);
            List<String> results = parse(body, topK);
            log.debug("[DuckDuckGo] '{}' -> {} results", query, results.size());
            return results;
        } catch (Exception e) {
            log.warn("[DuckDuckGo] search failed for '{}': {}", query, e.getMessage());
            return List.of();
        }
    }

    int requestsMade() {
        return requestsMade.get();
    }

    private List<String> parse(String body, int topK) throws Exception {
        if (body == null || body.isBlank()) {
            return List.of();
        }
        JsonNode root = objectMapper.readTree(body);
        List<String> results = new ArrayList<>();

        String abstractText = root.path("AbstractText").asText("").strip();
        if (!abstractText.isEmpty()) {
            results.add(truncate(abstractText));
        }
        for (JsonNode topic : root.path("RelatedTopics")) {
            if (results.size() >= topK) {
                break;
            }
            String text = topic.path("Text").asText("").strip();
            if (!text.isEmpty()) {
                results.add(truncate(text));
            }
        }
        return results.size() > topK ? results.subList(0, topK) : results;
    }

    private static String truncate(String text) {
        return text.length() > MAX_SNIPPET_LENGTH ? text.substring(0, MAX_SNIPPET_LENGTH) : text;
    }
}
