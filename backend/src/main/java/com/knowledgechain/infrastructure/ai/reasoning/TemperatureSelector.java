package com.knowledgechain.infrastructure.ai.reasoning;

import com.knowledgechain.domain.answer.service.QuestionAnsweringService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Picks a sampling temperature from a lightweight complexity reading of the question.
 * <p>
 * Checked in order: claim-style → multi-hop/relational → explanatory/comparative →
 * simple factual → default.
 * </p>
 */
@Slf4j
@Component
public class TemperatureSelector {

    static final double CLAIM_TEMPERATURE = 0.3;
    static final double SIMPLE_TEMPERATURE = 0.3;
    static final double EXPLANATORY_TEMPERATURE = 0.5;
    static final double MULTI_HOP_TEMPERATURE = 0.8;

    private static final Pattern MULTI_HOP = Pattern.compile(
            "\\b(both|same|also|relationship|related to|in common|which of the two|"
                    + "who was the .+ of the|the .+ of the .+ of)\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern EXPLANATORY = Pattern.compile(
            "\\b(why|how does|how do|how did|explain|describe|compare|difference|differ|versus|vs\\.?)\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern SIMPLE_FACTUAL = Pattern.compile(
            "^\\s*(what is|what was|who is|who was|when did|when was|where is|where was|how many|which)\\b",
            Pattern.CASE_INSENSITIVE);

    private final double defaultTemperature;

    public TemperatureSelector(@Value("${reasoning.default-temperature:0.7}") double defaultTemperature) {
        this.defaultTemperature = defaultTemperature;
    }

    public double select(String question) {
        if (QuestionAnsweringService.isClaimStyle(question)) {
            return CLAIM_TEMPERATURE;
        }
        if (question == null || question.isBlank()) {
            return defaultTemperature;
        }
        if (MULTI_HOP.matcher(question).find()) {
            return MULTI_HOP_TEMPERATURE;
        }
        if (EXPLANATORY.matcher(question).find()) {
            return EXPLANATORY_TEMPERATURE;
        }
        if (SIMPLE_FACTUAL.matcher(question).find()) {
            return SIMPLE_TEMPERATURE;
        }
        return defaultTemperature;
    }
}
