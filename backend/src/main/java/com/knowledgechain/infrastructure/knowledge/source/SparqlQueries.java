package com.knowledgechain.infrastructure.knowledge.source;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cleaning, syntactic validation and keyword extraction for LLM-written SPARQL.
 * Validation runs before any network call so malformed queries cost nothing.
 */
public final class SparqlQueries {

    static final int MIN_LENGTH = 20;

    private static final Pattern SELECT_OR_ASK = Pattern.compile("\\b(SELECT|ASK)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern WHERE = Pattern.compile("\\bWHERE\\b", Pattern.CASE_INSENSITIVE);

    // Entity or property followed by a bare capitalised name: "wd:Q664 New Zealand", "wdt:P39 Canada"
    private static final List<Pattern> MALFORMED_PATTERNS = List.of(
            Pattern.compile("\\bwd:\\w+[ \\t]+[A-Z][a-z]+"),
            Pattern.compile("\\bwdt:\\w+[ \\t]+[A-Z][a-z]+")
    );

    private static final Pattern LANGUAGE_TAG = Pattern.compile("^(?i:sparql)\\s*");
    private static final String MODIFIER_CLAUSE =
            "(?:(?:GROUP|ORDER)\\s+BY(?:\\s*(?:ASC|DESC)?\\s*\\(?\\s*[?$]\\w+\\s*\\)?)+"
                    + "|HAVING\\s*\\(.*\\)|LIMIT\\s+\\d+|OFFSET\\s+\\d+)";
    // one line of solution modifiers after the closing brace, e.g. "ORDER BY DESC(?pop) LIMIT 5"
    private static final Pattern MODIFIER_LINE = Pattern.compile(
            MODIFIER_CLAUSE + "(?:\\s+" + MODIFIER_CLAUSE + ")*", Pattern.CASE_INSENSITIVE);

    private static final Pattern STRING_LITERAL = Pattern.compile("\"([^\"]{2,})\"");
    // "en", "en,fr", "[AUTO_LANGUAGE],en": label-service language lists, not search terms
    private static final Pattern LANGUAGE_LIST = Pattern.compile(
            "(?:\\[AUTO_LANGUAGE\\],?)?[a-z]{2}(?:[,-][a-z]{2,3})*");
    private static final Pattern VARIABLE = Pattern.compile("[?$](\\w+)");
    private static final Pattern CAMEL_BOUNDARY = Pattern.compile("(?<=[a-z])(?=[A-Z])");
    private static final Pattern PLAIN_WORD = Pattern.compile("\\b[A-Za-z][A-Za-z\\-]{2,}\\b");
    private static final Pattern PREFIXED_NAME = Pattern.compile("\\S*:\\S*|<[^>]*>");
    private static final Set<String> SPARQL_WORDS = Set.of(
            "select", "distinct", "where", "ask", "filter", "optional", "service", "limit", "order", "group",
            "by", "having", "offset", "prefix", "union", "minus", "bind", "values", "lang", "contains",
            "lcase", "ucase", "str", "regex", "asc", "desc", "count", "as", "and", "not", "exists", "label",
            "wikibase", "bd", "serviceparam", "language", "true", "false",
            "item", "items", "entity", "value", "result", "answer", "thing", "object", "subject"
    );

    private SparqlQueries() {
    }

    /**
     * Strip code fences, language tags, comment and blank lines, and trailing prose.
     */
    public static String clean(String raw) {
        if (raw == null) {
            return "";
        }
        String query = raw;

        if (query.contains("```")) {
            for (String part : query.split("```")) {
                if (SELECT_OR_ASK.matcher(part).find()) {
                    query = part;
                    break;
                }
            }
        }

        query = LANGUAGE_TAG.matcher(query.strip()).replaceFirst("");

        List<String> lines = new ArrayList<>();
        for (String line : query.split("\\n")) {
            String trimmed = line.strip();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            lines.add(trimmed);
        }
        query = String.join("\n", lines);

        int lastBrace = query.lastIndexOf('}');
        if (lastBrace >= 0) {
            query = query.substring(0, lastBrace + 1 + modifierPrefixLength(query.substring(lastBrace + 1)));
        }
        return query.strip();
    }

    /**
     * Length of the leading run of solution-modifier lines in the text after the last brace.
     * Anything from the first other line on is dropped.
     */
    private static int modifierPrefixLength(String tail) {
        int kept = 0;
        int pos = 0;
        for (String line : tail.split("\\n", -1)) {
            if (!line.isBlank()) {
                if (!MODIFIER_LINE.matcher(line.strip()).matches()) {
                    break;
                }
                kept = pos + line.length();
            }
            pos += line.length() + 1;
        }
        return kept;
    }

    public static boolean isValid(String query) {
        if (query == null || query.strip().length() < MIN_LENGTH) {
            return false;
        }
        if (!SELECT_OR_ASK.matcher(query).find()) {
            return false;
        }
        if (!WHERE.matcher(query).find()) {
            return false;
        }
        if (!bracesBalanced(query)) {
            return false;
        }
        for (Pattern malformed : MALFORMED_PATTERNS) {
            if (malformed.matcher(query).find()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Search text for a SPARQL query: its string literals, or failing that its non-syntax words.
     */
    public static String toKeywords(String sparql) {
        if (sparql == null || sparql.isBlank()) {
            return "";
        }
        Set<String> keywords = new LinkedHashSet<>();
        Matcher literal = STRING_LITERAL.matcher(sparql);
        while (literal.find()) {
            String text = literal.group(1).strip();
            if (!LANGUAGE_LIST.matcher(text).matches()) {
                keywords.add(text);
            }
        }
        if (keywords.isEmpty()) {
            // ?capitalLabel -> "capital Label"
            Matcher variable = VARIABLE.matcher(STRING_LITERAL.matcher(sparql).replaceAll(" "));
            StringBuilder unwrapped = new StringBuilder();
            while (variable.find()) {
                variable.appendReplacement(unwrapped,
                        Matcher.quoteReplacement(" " + CAMEL_BOUNDARY.matcher(variable.group(1)).replaceAll(" ") + " "));
            }
            variable.appendTail(unwrapped);

            String stripped = PREFIXED_NAME.matcher(unwrapped.toString()).replaceAll(" ");
            Matcher word = PLAIN_WORD.matcher(stripped);
            while (word.find()) {
                String w = word.group();
                if (!SPARQL_WORDS.contains(w.toLowerCase(Locale.ROOT))) {
                    keywords.add(w);
                }
            }
        }
        return String.join(" ", keywords);
    }

    private static boolean bracesBalanced(String query) {
        int depth = 0;
        for (char c : query.toCharArray()) {
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth < 0) {
                    return false;
                }
            }
        }
        return depth == 0;
    }
}
