package com.knowledgechain.infrastructure.ai.extraction;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Post-processes the consolidation reply into a terse final answer.
 * <p>
 * markdown → connective prefixes → explicit marker (else last sentence) → quotes →
 * trailing punctuation → length bound
 * </p>
 */
@Component
public class FinalAnswerCleaner {

    static final int MAX_LENGTH = 200;

    private static final List<Pattern> ANSWER_MARKERS = List.of(
            Pattern.compile("Final Answer:", Pattern.CASE_INSENSITIVE),
            Pattern.compile("Answer:", Pattern.CASE_INSENSITIVE)
    );

    private static final Pattern CONNECTIVE_PREFIX = Pattern.compile(
            "(?:(?:therefore|thus|hence|so|in conclusion)\\b|based on[^,\\n]*,)[,:]?\\s*",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern SURROUNDING_QUOTES = Pattern.compile("^[\"'“”‘’]+|[\"'“”‘’]+$");

    private static final Pattern TRAILING_PUNCT = Pattern.compile("[.,;:!]+$");

    public String clean(String raw) {
        if (raw == null || raw.isBlank()) {
            return "";
        }

        String text = TextPatterns.stripMarkdown(raw);
        text = TextPatterns.stripLeading(CONNECTIVE_PREFIX, text);

        String answer = null;
        for (Pattern marker : ANSWER_MARKERS) {
            int end = TextPatterns.endOfLastMatch(marker, text);
            if (end >= 0) {
                answer = firstLine(text.substring(end));
                if (!answer.isEmpty()) {
                    break;
                }
            }
        }
        if (answer == null || answer.isEmpty()) {
            answer = TextPatterns.lastSentence(text);
        }

        answer = TextPatterns.stripLeading(CONNECTIVE_PREFIX, answer.strip());
        answer = SURROUNDING_QUOTES.matcher(answer).replaceAll("").strip();
        if (answer.length() > 1) {
            answer = TRAILING_PUNCT.matcher(answer).replaceAll("").strip();
        }
        return TextPatterns.truncate(answer, MAX_LENGTH);
    }

    private static String firstLine(String text) {
        for (String line : text.strip().split("\\n")) {
            if (!line.isBlank()) {
                return line.strip();
            }
        }
        return "";
    }
}
