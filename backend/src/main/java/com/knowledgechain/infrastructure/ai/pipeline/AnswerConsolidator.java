package com.knowledgechain.infrastructure.ai.pipeline;

import com.knowledgechain.domain.answer.service.QuestionAnsweringService;
import com.knowledgechain.infrastructure.ai.ModelGateway;
import com.knowledgechain.infrastructure.ai.PromptBuilder;
import com.knowledgechain.infrastructure.ai.extraction.FinalAnswerCleaner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Slf4j
@Component
@RequiredArgsConstructor
public class AnswerConsolidator {

    public static final String SUPPORTS = "SUPPORTS";
    public static final String REFUTES = "REFUTES";
    public static final String NOT_ENOUGH_INFO = "NOT ENOUGH INFO";

    private static final Pattern ANSWER_MARKER = Pattern.compile("(?i)answer:[ \\t]*([^\\n]*)");

    private final ModelGateway gateway;
    private final PromptBuilder promptBuilder;
    private final FinalAnswerCleaner answerCleaner;

    public String consolidate(String question, List<String> correctedRationales) {
        String prompt = promptBuilder.buildConsolidationPrompt(question, promptBuilder.numbered(correctedRationales));
        String raw = gateway.call(prompt, 0.0);

        String answer = answerCleaner.clean(raw);
        if (QuestionAnsweringService.isClaimStyle(question)) {
            answer = claimLabel(raw, answer);
        }
        log.info("[Consolidation] final answer: {}", answer);
        return answer;
    }

    /**
     * Verdict lookup order: the line after the last answer marker, the first line of the reply,
     * the cleaned answer, then the whole reply.
     */
    static String claimLabel(String raw, String cleaned) {
        return claimLabelIn(markedLine(raw))
                .or(() -> claimLabelIn(firstLine(raw)))
                .or(() -> claimLabelIn(cleaned))
                .or(() -> claimLabelIn(raw))
                .orElse(NOT_ENOUGH_INFO);
    }

    private static String markedLine(String raw) {
        if (raw == null) {
            return "";
        }
        Matcher m = ANSWER_MARKER.matcher(raw);
        String line = "";
        while (m.find()) {
            line = m.group(1);
        }
        return line;
    }

    private static String firstLine(String raw) {
        if (raw == null) {
            return "";
        }
        for (String line : raw.strip().split("\\n")) {
            if (!line.isBlank()) {
                return line;
            }
        }
        return "";
    }

    // "NOT ENOUGH" first: "not enough to support" must not read as SUPPORTS
    private static Optional<String> claimLabelIn(String text) {
        String upper = text == null ? "" : text.toUpperCase(Locale.ROOT);
        if (upper.contains("NOT ENOUGH")) {
            return Optional.of(NOT_ENOUGH_INFO);
        }
        if (upper.contains("REFUTE")) {
            return Optional.of(REFUTES);
        }
        if (upper.contains("SUPPORT")) {
            return Optional.of(SUPPORTS);
        }
        return Optional.empty();
    }
}
