package com.knowledgechain.infrastructure.ai.extraction;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical form of an extracted answer, used only to compare answers for consensus.
 */
@Component
public class AnswerNormalizer {

    static final int MAX_LENGTH = 100;

    // Whole-word prefixes only: "so" must not eat the start of "sofia"
    private static final Pattern COMMON_PREFIX = Pattern.compile(
            "(?:the answer is|answer:|therefore\\b|thus\\b|so\\b)[\\s,:]*");

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public String normalize(String answer) {
        if (answer == null) {
            return "";
        }
        String result = answer.toLowerCase(Locale.ROOT).strip();
        result = TextPatterns.stripLeading(COMMON_PREFIX, result);
        result = TextPatterns.truncate(result, MAX_LENGTH);
        result = WHITESPACE.matcher(result).replaceAll(" ").strip();
        return result.replaceAll("[.!?]+$", "");
    }
}
