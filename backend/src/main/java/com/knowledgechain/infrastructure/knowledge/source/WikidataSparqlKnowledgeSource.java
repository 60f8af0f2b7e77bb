package com.knowledgechain.infrastructure.knowledge.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * Wikidata Query Service. Takes SPARQL text, cleans and validates it locally, and skips the network
 * call entirely for malformed queries.
 */
@Slf4j
@Component
@Order(1)
@ConditionalOnProperty(prefix = "knowledge.wikidata", name = "enabled", havingValue = "true", matchIfMissing = true)
public class WikidataSparqlKnowledgeSource implements KnowledgeSource {

    static final MediaType SPARQL_RESULTS_JSON = MediaType.parseMediaType("application/sparql-results+json");
    private static final String ENTITY_PREFIX = "http://www.wikidata.org/entity/";

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final String endpoint;

    public WikidataSparqlKnowledgeSource(RestClient knowledgeRestClient,
                                         ObjectMapper objectMapper,
                                         @Value("${knowledge.wikidata.endpoint:https://query.wikidata.org/sparql}") String endpoint) {
        this.restClient = knowledgeRestClient;
        this.objectMapper = objectMapper;
        this.endpoint = endpoint;
    }

    @Override
    public String name() {
        return WIKIDATA_SPARQL;
    }

    @Override
    public boolean structuredGraph() {
        return true;
    }

    @Override
    public List<String> search(String query, int topK) {
        String sparql = SparqlQueries.clean(query);
        if (!SparqlQueries.isValid(sparql)) {
            log.debug("[Wikidata] skipping malformed query: {}", sparql);
            return List.of();
        }

        URI uri = UriComponentsBuilder.fromUriString(endpoint)
                .queryParam("query", "{q}")
                .queryParam("format", "json")
                .encode()
                .buildAndExpand(sparql)
                .toUri();

        try {
            String body = restClient.get()
                    .uri(uri)
                    .accept(SPARQL_RESULTS_JSON)
                    .retrieve()
                    .body(String.class);
            List<String> results = parse(body, topK);
            log.debug("[Wikidata] {} bindings", results.size());
            return results;
        } catch (Exception e) {
            log.warn("[Wikidata] query failed: {}", e.getMessage());
            return List.of();
        }
    }

    private List<String> parse(String body, int topK) throws Exception {
        if (body == null || body.isBlank()) {
            return List.of();
        }
        JsonNode root = objectMapper.readTree(body);
        JsonNode vars = root.path("head").path("vars");
        List<String> results = new ArrayList<>();
        for (JsonNode binding : root.path("results").path("bindings")) {
            if (results.size() >= topK) {
                break;
            }
            List<String> parts = new ArrayList<>();
            for (JsonNode var : vars) {
                JsonNode cell = binding.path(var.asText());
                if (!cell.isMissingNode()) {
                    parts.add(var.asText() + ": " + shorten(cell.path("value").asText("")));
                }
            }
            if (!parts.isEmpty()) {
                results.add(String.join(" | ", parts));
            }
        }
        return results;
    }

    static String shorten(String value) {
        return value.startsWith(ENTITY_PREFIX) ? value.substring(ENTITY_PREFIX.length()) : value;
    }
}
