package com.knowledgechain.infrastructure.ai.extraction;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives a short answer from a free-text rationale for consensus voting.
 * <p>
 * Order: explicit answer markers (first marker in list order that occurs, last occurrence of it)
 * → last non-empty sentence. Output is at most {@value #MAX_LENGTH} characters.
 * </p>
 */
@Component
public class AnswerExtractor {

    static final int MAX_LENGTH = 100;

    private static final List<Pattern> ANSWER_MARKERS = List.of(
            marker("Final Answer:"),
            marker("Answer:"),
            marker("Conclusion:"),
            marker("The answer is"),
            marker("Answer is")
    );

    private static final Pattern CONNECTIVE = Pattern.compile(
            "\\b(?:therefore|thus|hence)\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern LEADING_CONNECTIVE = Pattern.compile(
            "(?:so|thus|therefore|hence)\\b[,:]?\\s*", Pattern.CASE_INSENSITIVE);

    private static final Pattern LEADING_PUNCT = Pattern.compile("[:\\-–\\s]+");

    public String extract(String rationale) {
        if (rationale == null || rationale.isBlank()) {
            return "";
        }

        String cleaned = TextPatterns.stripMarkdown(rationale);

        // 1. Explicit markers
        for (Pattern marker : ANSWER_MARKERS) {
            int end = TextPatterns.endOfLastMatch(marker, cleaned);
            if (end < 0) {
                continue;
            }
            String answer = afterMarker(cleaned.substring(end));
            if (!answer.isEmpty()) {
                return TextPatterns.truncate(answer, MAX_LENGTH);
            }
        }

        // 2. Last sentence
        String last = TextPatterns.stripLeading(LEADING_CONNECTIVE, TextPatterns.lastSentence(cleaned));
        if (!last.isEmpty()) {
            return TextPatterns.truncate(last, MAX_LENGTH);
        }
        return TextPatterns.truncate(cleaned, MAX_LENGTH);
    }

    private String afterMarker(String tail) {
        String text = TextPatterns.stripLeading(LEADING_PUNCT, tail.strip());

        // First non-empty line only
        for (String line : text.split("\\n")) {
            if (!line.isBlank()) {
                text = line.strip();
                break;
            }
        }

        text = TextPatterns.stripLeading(LEADING_CONNECTIVE, text);
        Matcher connective = CONNECTIVE.matcher(text);
        if (connective.find()) {
            text = text.substring(0, connective.start());
        }
        text = TextPatterns.stripLeading(LEADING_PUNCT, text.strip());

        return TextPatterns.firstSentence(text).replaceAll("[,;:]+$", "").strip();
    }

    private static Pattern marker(String text) {
        return Pattern.compile(Pattern.quote(text), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }
}
