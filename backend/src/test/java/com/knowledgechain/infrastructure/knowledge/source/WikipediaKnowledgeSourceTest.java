package com.knowledgechain.infrastructure.knowledge.source;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.allOf;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class WikipediaKnowledgeSourceTest {

    private static final String ENDPOINT = "https://en.wikipedia.org/w/api.php";

    private MockRestServiceServer server;
    private WikipediaKnowledgeSource source;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        source = new WikipediaKnowledgeSource(builder.build(), new ObjectMapper(), ENDPOINT);
    }

    @Test
    @DisplayName("search + extracts in one request, ordered by search rank")
    void search_returns_ranked_extracts() {
        String body = """
                {"query": {"pages": {
                  "22989": {"pageid": 22989, "title": "Paris", "index": 2, "extract": "Paris is the capital of France."},
                  "5843419": {"pageid": 5843419, "title": "France", "index": 1, "extract": "France is a country in Western Europe."}
                }}}""";
        server.expect(requestTo(allOf(
                        startsWith(ENDPOINT),
                        containsString("generator=search"),
                        containsString("gsrsearch=Paris"),
                        containsString("prop=extracts"))))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess(body, MediaType.APPLICATION_JSON));

        List<String> results = source.search("Paris", 3);

        assertThat(results).containsExactly(
                "France: France is a country in Western Europe.",
                "Paris: Paris is the capital of France.");
        server.verify();
    }

    @Test
    @DisplayName("summaries are truncated to 300 characters")
    void summary_truncated() {
        String longExtract = "a".repeat(1000);
        server.expect(requestTo(startsWith(ENDPOINT)))
                .andRespond(withSuccess("{\"query\":{\"pages\":{\"1\":{\"title\":\"T\",\"index\":1,\"extract\":\""
                        + longExtract + "\"}}}}", MediaType.APPLICATION_JSON));

        List<String> results = source.search("anything", 3);

        assertThat(results).hasSize(1);
        assertThat(results.get(0)).isEqualTo("T: " + "a".repeat(300));
    }

    @Test
    @DisplayName("server error → empty list, never an exception")
    void failure_returns_empty() {
        server.expect(requestTo(startsWith(ENDPOINT))).andRespond(withServerError());

        assertThat(source.search("Paris", 3)).isEmpty();
    }

    @Test
    @DisplayName("no search hits → empty list")
    void no_hits() {
        server.expect(requestTo(startsWith(ENDPOINT)))
                .andRespond(withSuccess("{\"batchcomplete\":\"\"}", MediaType.APPLICATION_JSON));

        assertThat(source.search("zzzzqqq", 3)).isEmpty();
    }

    @Test
    @DisplayName("blank query → empty list without a request")
    void blank_query() {
        assertThat(source.search(" ", 3)).isEmpty();
        server.verify();
    }
}
