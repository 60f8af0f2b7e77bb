package com.knowledgechain.infrastructure.knowledge.source;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SparqlQueriesTest {

    @Nested
    @DisplayName("isValid")
    class IsValid {

        @Test
        @DisplayName("minimal SELECT ... WHERE { ... } is accepted")
        void minimal_select() {
            assertThat(SparqlQueries.isValid("SELECT ?x WHERE { ?x wdt:P31 wd:Q5 . }")).isTrue();
        }

        @Test
        @DisplayName("ASK queries are accepted")
        void ask() {
            assertThat(SparqlQueries.isValid("ASK WHERE { wd:Q90 wdt:P17 wd:Q142 . }")).isTrue();
        }

        @Test
        @DisplayName("missing WHERE → rejected")
        void missing_where() {
            assertThat(SparqlQueries.isValid("SELECT ?x { ?x wdt:P31 wd:Q5 . }")).isFalse();
        }

        @Test
        @DisplayName("unbalanced braces → rejected")
        void unbalanced_braces() {
            assertThat(SparqlQueries.isValid("SELECT ?x WHERE { ?x wdt:P31 wd:Q5 . ")).isFalse();
            assertThat(SparqlQueries.isValid("SELECT ?x WHERE } ?x wdt:P31 wd:Q5 . {")).isFalse();
        }

        @Test
        @DisplayName("shorter than 20 characters → rejected")
        void too_short() {
            assertThat(SparqlQueries.isValid("SELECT ?x WHERE {}")).isFalse();
            assertThat(SparqlQueries.isValid(null)).isFalse();
        }

        @Test
        @DisplayName("neither SELECT nor ASK → rejected")
        void no_select() {
            assertThat(SparqlQueries.isValid("DESCRIBE ?x WHERE { ?x ?p ?o . }")).isFalse();
        }

        @Test
        @DisplayName("entity followed by a bare name → rejected")
        void malformed_entity_name() {
            assertThat(SparqlQueries.isValid("SELECT ?x WHERE { wd:Q664 New Zealand ?x . }")).isFalse();
            assertThat(SparqlQueries.isValid("SELECT ?x WHERE { ?x wdt:P31 Human . }")).isFalse();
        }

        @Test
        @DisplayName("a keyword on the next line after an entity is not a bare name")
        void keyword_on_next_line() {
            String query = """
                    SELECT ?x ?xLabel WHERE {
                      ?x wdt:P31 wd:Q5
                      SERVICE wikibase:label { bd:serviceParam wikibase:language "en". }
                    }""";
            assertThat(SparqlQueries.isValid(query)).isTrue();
        }
    }

    @Nested
    @DisplayName("clean")
    class Clean {

        @Test
        @DisplayName("code fence, language tag and trailing prose are removed")
        void fence_and_prose() {
            String raw = "```sparql\nSELECT ?x WHERE { ?x wdt:P31 wd:Q5 . }\n```\nThis query finds humans.";
            assertThat(SparqlQueries.clean(raw)).isEqualTo("SELECT ?x WHERE { ?x wdt:P31 wd:Q5 . }");
        }

        @Test
        @DisplayName("comment and blank lines are dropped, LIMIT after the last brace is kept")
        void comments_and_limit() {
            String raw = "# find humans\nSELECT ?x WHERE {\n\n  ?x wdt:P31 wd:Q5 .\n}\nLIMIT 5";
            assertThat(SparqlQueries.clean(raw)).isEqualTo("SELECT ?x WHERE {\n?x wdt:P31 wd:Q5 .\n}\nLIMIT 5");
        }

        @Test
        @DisplayName("prose on the line after a trailing LIMIT is cut, the LIMIT stays")
        void prose_after_limit() {
            String cleaned = SparqlQueries.clean("SELECT ?capital WHERE { wd:Q142 wdt:P36 ?capital . } LIMIT 5\n"
                    + "This query returns the capital of France.");

            assertThat(cleaned).isEqualTo("SELECT ?capital WHERE { wd:Q142 wdt:P36 ?capital . } LIMIT 5");
        }

        @Test
        @DisplayName("several modifier lines are kept until the first line of prose")
        void modifier_lines_then_prose() {
            String raw = "SELECT ?x ?pop WHERE { ?x wdt:P1082 ?pop . }\nORDER BY DESC(?pop)\nLIMIT 3\nNote: sorted by population.";

            assertThat(SparqlQueries.clean(raw))
                    .isEqualTo("SELECT ?x ?pop WHERE { ?x wdt:P1082 ?pop . }\nORDER BY DESC(?pop)\nLIMIT 3");
        }

        @Test
        @DisplayName("prose on the same line as a modifier drops the whole tail")
        void prose_on_modifier_line() {
            assertThat(SparqlQueries.clean("SELECT ?x WHERE { ?x wdt:P31 wd:Q5 . } LIMIT 5 returns humans"))
                    .isEqualTo("SELECT ?x WHERE { ?x wdt:P31 wd:Q5 . }");
        }

        @Test
        @DisplayName("prose after the closing brace on the same line is cut")
        void same_line_prose() {
            assertThat(SparqlQueries.clean("SELECT ?x WHERE { ?x wdt:P31 wd:Q5 . } This returns all humans."))
                    .isEqualTo("SELECT ?x WHERE { ?x wdt:P31 wd:Q5 . }");
        }

        @Test
        @DisplayName("null → empty string")
        void null_input() {
            assertThat(SparqlQueries.clean(null)).isEmpty();
        }
    }

    @Nested
    @DisplayName("toKeywords")
    class ToKeywords {

        @Test
        @DisplayName("string literals are the keywords, language tags are not")
        void literals() {
            String query = """
                    SELECT ?award WHERE {
                      ?person rdfs:label "Marie Curie"@en .
                      ?person wdt:P166 ?award .
                      SERVICE wikibase:label { bd:serviceParam wikibase:language "en". }
                    }""";
            assertThat(SparqlQueries.toKeywords(query)).isEqualTo("Marie Curie");
        }

        @Test
        @DisplayName("without literals, variable names give the keywords")
        void variables() {
            String query = "SELECT ?capital ?capitalLabel WHERE { wd:Q142 wdt:P36 ?capital . "
                    + "SERVICE wikibase:label { bd:serviceParam wikibase:language \"en\". } }";
            assertThat(SparqlQueries.toKeywords(query)).isEqualTo("capital");
        }

        @Test
        @DisplayName("blank → empty string")
        void blank() {
            assertThat(SparqlQueries.toKeywords(" ")).isEmpty();
        }
    }
}
