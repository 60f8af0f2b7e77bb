package com.knowledgechain.infrastructure.ai.extraction;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Shared string transforms for answer extraction. All functions are pure.
 */
final class TextPatterns {

    static final Pattern MARKDOWN_EMPHASIS = Pattern.compile("\\*+|__|`+");

    // Sentence boundary: terminal punctuation followed by whitespace, or a line break
    private static final Pattern SENTENCE_BOUNDARY = Pattern.compile("(?<=[.!?])\\s+|\\n+");

    private static final Pattern TRAILING_SENTENCE_PUNCT = Pattern.compile("[.!?]+$");

    private TextPatterns() {
    }

    static String stripMarkdown(String text) {
        return MARKDOWN_EMPHASIS.matcher(text).replaceAll("").strip();
    }

    static List<String> sentences(String text) {
        List<String> result = new ArrayList<>();
        for (String part : SENTENCE_BOUNDARY.split(text)) {
            String s = TRAILING_SENTENCE_PUNCT.matcher(part.strip()).replaceAll("").strip();
            if (!s.isEmpty()) {
                result.add(s);
            }
        }
        return result;
    }

    static String lastSentence(String text) {
        List<String> all = sentences(text);
        return all.isEmpty() ? "" : all.get(all.size() - 1);
    }

    static String firstSentence(String text) {
        List<String> all = sentences(text);
        return all.isEmpty() ? "" : all.get(0);
    }

    /**
     * Index just past the last case-insensitive occurrence of the pattern, or -1.
     */
    static int endOfLastMatch(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        int end = -1;
        while (m.find()) {
            end = m.end();
        }
        return end;
    }

    static String truncate(String text, int maxLength) {
        return text.length() <= maxLength ? text : text.substring(0, maxLength).strip();
    }

    /**
     * Apply the prefix pattern repeatedly until it no longer matches at the start.
     */
    static String stripLeading(Pattern prefix, String text) {
        String result = text;
        while (true) {
            Matcher m = prefix.matcher(result);
            if (!m.lookingAt() || m.end() == 0) {
                return result;
            }
            result = result.substring(m.end()).strip();
        }
    }
}
