package com.knowledgechain.infrastructure.ai.pipeline;

import com.knowledgechain.domain.answer.model.Domain;
import com.knowledgechain.domain.answer.model.Query;
import com.knowledgechain.domain.answer.model.QueryType;
import com.knowledgechain.infrastructure.ai.ModelGateway;
import com.knowledgechain.infrastructure.ai.PromptBuilder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Turns a rationale into a domain-specific retrieval query: SPARQL for factual questions,
 * medical key terms for medical ones, a short search phrase otherwise.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AdaptiveQueryGenerator {

    static final int MAX_SPARQL_LENGTH = 2000;
    static final int MAX_TEXT_QUERY_LENGTH = 300;

    private static final Pattern CODE_FENCE = Pattern.compile("```(?:sparql|SPARQL)?");
    private static final Pattern BULLET = Pattern.compile("(?m)^\\s*(?:[-*•]|\\d+[.)])\\s*");
    private static final Pattern LINE_BREAKS = Pattern.compile("\\s*\\n+\\s*");

    private final ModelGateway gateway;
    private final PromptBuilder promptBuilder;

    public Query generateQuery(String rationale, Domain domain) {
        QueryType type = queryTypeFor(domain);
        String text = switch (type) {
            case SPARQL -> cleanSparql(gateway.call(promptBuilder.buildSparqlPrompt(rationale), 0.0));
            case MEDICAL -> cleanTerms(gateway.call(promptBuilder.buildMedicalPrompt(rationale), 0.0));
            case NATURAL_LANGUAGE -> cleanPhrase(gateway.call(promptBuilder.buildNaturalLanguagePrompt(rationale), 0.0));
        };
        log.debug("[Query] {} query for {}: {}", type, domain, text);
        return new Query(text, type, domain);
    }

    public static QueryType queryTypeFor(Domain domain) {
        return switch (domain) {
            case FACTUAL -> QueryType.SPARQL;
            case MEDICAL -> QueryType.MEDICAL;
            case PHYSICS, BIOLOGY -> QueryType.NATURAL_LANGUAGE;
        };
    }

    static String cleanSparql(String raw) {
        String query = CODE_FENCE.matcher(raw == null ? "" : raw).replaceAll("").strip();
        return truncate(query, MAX_SPARQL_LENGTH);
    }

    static String cleanTerms(String raw) {
        String terms = BULLET.matcher(raw == null ? "" : raw).replaceAll("");
        terms = LINE_BREAKS.matcher(terms.strip()).replaceAll(", ");
        return truncate(terms, MAX_TEXT_QUERY_LENGTH);
    }

    static String cleanPhrase(String raw) {
        String phrase = LINE_BREAKS.matcher(raw == null ? "" : raw.strip()).replaceAll(" ");
        phrase = phrase.replaceAll("^[\"']+|[\"']+$", "");
        return truncate(phrase, MAX_TEXT_QUERY_LENGTH);
    }

    private static String truncate(String text, int max) {
        return text.length() > max ? text.substring(0, max) : text;
    }
}
