package com.knowledgechain.infrastructure.ai.reasoning;

import com.knowledgechain.domain.answer.model.Domain;
import com.knowledgechain.domain.answer.model.Rationale;
import com.knowledgechain.domain.answer.service.QuestionAnsweringService;
import com.knowledgechain.infrastructure.ai.ModelGateway;
import com.knowledgechain.infrastructure.ai.PromptBuilder;
import com.knowledgechain.infrastructure.ai.extraction.AnswerExtractor;
import com.knowledgechain.infrastructure.ai.extraction.AnswerNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Stage 1: sample rationales, extract their answers, identify domains, and judge consensus.
 */
@Slf4j
@Component
public class ReasoningService {

    private final ModelGateway gateway;
    private final PromptBuilder promptBuilder;
    private final TemperatureSelector temperatureSelector;
    private final AnswerExtractor answerExtractor;
    private final AnswerNormalizer answerNormalizer;
    private final int numRationales;
    private final int numRationalesClaim;
    private final double consensusThreshold;

    public ReasoningService(ModelGateway gateway,
                            PromptBuilder promptBuilder,
                            TemperatureSelector temperatureSelector,
                            AnswerExtractor answerExtractor,
                            AnswerNormalizer answerNormalizer,
                            @Value("${reasoning.num-rationales:5}") int numRationales,
                            @Value("${reasoning.num-rationales-claim:3}") int numRationalesClaim,
                            @Value("${reasoning.consensus-threshold:0.5}") double consensusThreshold) {
        this.gateway = gateway;
        this.promptBuilder = promptBuilder;
        this.temperatureSelector = temperatureSelector;
        this.answerExtractor = answerExtractor;
        this.answerNormalizer = answerNormalizer;
        this.numRationales = Math.max(1, numRationales);
        this.numRationalesClaim = Math.max(1, Math.min(numRationalesClaim, this.numRationales));
        this.consensusThreshold = consensusThreshold;
    }

    /**
     * Number of rationales to sample; reduced for claim-style questions.
     */
    public int rationaleCount(String question) {
        return QuestionAnsweringService.isClaimStyle(question) ? numRationalesClaim : numRationales;
    }

    public List<Rationale> generateRationales(String question, String datasetHint) {
        int k = rationaleCount(question);
        double temperature = temperatureSelector.select(question);

        log.info("[Reasoning] generating {} rationales (temperature={}, hint={})", k, temperature, datasetHint);

        List<Rationale> rationales = new ArrayList<>(k);
        for (int i = 1; i <= k; i++) {
            String text = gateway.call(promptBuilder.buildReasoningPrompt(question, datasetHint, i, k), temperature);
            rationales.add(new Rationale(i, text, temperature));
            log.debug("[Reasoning] rationale {}/{} ({} chars)", i, k, text.length());
        }
        return rationales;
    }

    public String extractAnswer(Rationale rationale) {
        return answerExtractor.extract(rationale.text());
    }

    public List<String> extractAnswers(List<Rationale> rationales) {
        List<String> answers = rationales.stream().map(this::extractAnswer).toList();
        log.info("[Reasoning] extracted {} answers", answers.size());
        return answers;
    }

    public List<Domain> identifyDomains(String question) {
        String response = gateway.call(promptBuilder.buildDomainPrompt(question), 0.0);
        List<Domain> domains = parseDomains(response);
        log.info("[Reasoning] identified domains: {}", domains);
        return domains;
    }

    /**
     * Keyword-family match of a classification reply. Falls back to FACTUAL.
     */
    public List<Domain> parseDomains(String response) {
        if (response == null || response.isBlank()) {
            return List.of(Domain.FACTUAL);
        }
        String lower = response.toLowerCase(Locale.ROOT);
        List<Domain> found = new ArrayList<>();
        for (Domain domain : Domain.values()) {
            if (domain.keywords().stream().anyMatch(lower::contains)) {
                found.add(domain);
            }
        }
        return found.isEmpty() ? List.of(Domain.FACTUAL) : List.copyOf(found);
    }

    /**
     * Consensus at the nominal threshold.
     */
    public boolean hasConsensus(List<String> answers) {
        return hasConsensus(answers, consensusThreshold);
    }

    /**
     * True iff the modal normalized answer's share is strictly greater than the threshold.
     */
    public boolean hasConsensus(List<String> answers, double threshold) {
        if (answers == null || answers.isEmpty()) {
            return false;
        }
        double agreement = modalShare(answers);
        boolean consensus = agreement > threshold;
        log.info("[Reasoning] consensus check: {}% agreement (threshold {}%) -> {}",
                String.format("%.1f", agreement * 100), String.format("%.0f", threshold * 100), consensus);
        return consensus;
    }

    public double modalShare(List<String> answers) {
        if (answers.isEmpty()) {
            return 0.0;
        }
        int top = groupByNormalized(answers).values().stream()
                .mapToInt(List::size)
                .max()
                .orElse(0);
        return (double) top / answers.size();
    }

    /**
     * The first original answer of the largest normalized group. Ties go to the group seen first.
     */
    public String consensusAnswer(List<String> answers) {
        List<String> best = List.of();
        for (List<String> group : groupByNormalized(answers).values()) {
            if (group.size() > best.size()) {
                best = group;
            }
        }
        return best.isEmpty() ? "" : best.get(0);
    }

    public boolean validateConsensusAnswer(String question, String answer) {
        if (answer == null || answer.isBlank()) {
            return false;
        }
        String reply = gateway.call(promptBuilder.buildConsensusValidationPrompt(question, answer), 0.0);
        boolean valid = reply != null && reply.strip().toUpperCase(Locale.ROOT).startsWith("YES");
        log.info("[Reasoning] consensus answer validation: {}", valid ? "passed" : "failed");
        return valid;
    }

    private Map<String, List<String>> groupByNormalized(List<String> answers) {
        Map<String, List<String>> groups = new LinkedHashMap<>();
        for (String answer : answers) {
            groups.computeIfAbsent(answerNormalizer.normalize(answer), key -> new ArrayList<>()).add(answer);
        }
        return groups;
    }
}
