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
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;

/**
 * MediaWiki search with plain-text intro extracts, fetched in a single request.
 */
@Slf4j
@Component
@Order(2)
@ConditionalOnProperty(prefix = "knowledge.wikipedia", name = "enabled", havingValue = "true", matchIfMissing = true)
public class WikipediaKnowledgeSource implements KnowledgeSource {

    static final int MAX_QUERY_LENGTH = 300;
    static final int MAX_SUMMARY_LENGTH = 300;

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final String endpoint;

    public WikipediaKnowledgeSource(RestClient knowledgeRestClient,
                                    ObjectMapper objectMapper,
                                    @Value("${knowledge.wikipedia.endpoint:https://en.wikipedia.org/w/api.php}") String endpoint) {
        this.restClient = knowledgeRestClient;
        this.objectMapper = objectMapper;
        this.endpoint = endpoint;
    }

    @Override
    public String name() {
        return WIKIPEDIA;
    }

    @Override
    public List<String> search(String query, int topK) {
        if (query == null || query.isBlank() || topK <= 0) {
            return List.of();
        }
        String searchText = query.strip();
        if (searchText.length() > MAX_QUERY_LENGTH) {
            searchText = searchText.substring(0, MAX_QUERY_LENGTH);
        }

        URI uri = UriComponentsBuilder.fromUriString(endpoint)
                .queryParam("action", "query")
                .queryParam("format", "json")
                .queryParam("generator", "search")
                .queryParam("gsrsearch", "{q}")
                .queryParam("gsrlimit", topK)
                .queryParam("prop", "extracts")
                .queryParam("exintro", 1)
                .queryParam("explaintext", 1)
                .queryParam("exlimit", "max")
                .encode()
                .buildAndExpand(searchText)
                .toUri();

        try {
            String body = restClient.get().uri(uri).retrieve().body(String.class);
            List<String> results = parse(body, topK);
            log.debug("[Wikipedia] '{}' -> {} results", searchText, results.size());
            return results;
        } catch (Exception e) {
            log.warn("[Wikipedia] search failed for '{}': {}", searchText, e.getMessage());
            return List.of();
        }
    }

    private List<String> parse(String body, int topK) throws Exception {
        if (body == null || body.isBlank()) {
            return List.of();
        }
        JsonNode pages = objectMapper.readTree(body).path("query").path("pages");
        List<JsonNode> ordered = new ArrayList<>();
        for (Iterator<JsonNode> it = pages.elements(); it.hasNext(); ) {
            ordered.add(it.next());
        }
        ordered.sort(Comparator.comparingInt(page -> page.path("index").asInt(Integer.MAX_VALUE)));

        List<String> results = new ArrayList<>();
        for (JsonNode page : ordered) {
            String title = page.path("title").asText("");
            String extract = page.path("extract").asText("").strip();
            if (extract.isEmpty()) {
                continue;
            }
            if (extract.length() > MAX_SUMMARY_LENGTH) {
                extract = extract.substring(0, MAX_SUMMARY_LENGTH);
            }
            results.add(title.isEmpty() ? extract : title + ": " + extract);
            if (results.size() >= topK) {
                break;
            }
        }
        return results;
    }
}
