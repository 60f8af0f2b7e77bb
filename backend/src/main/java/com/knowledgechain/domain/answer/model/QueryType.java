package com.knowledgechain.domain.answer.model;

public enum QueryType {
    SPARQL,           // structured knowledge-graph query
    MEDICAL,          // extracted medical terms
    NATURAL_LANGUAGE  // plain search text
}
