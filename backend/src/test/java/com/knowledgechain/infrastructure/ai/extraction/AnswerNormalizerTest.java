package com.knowledgechain.infrastructure.ai.extraction;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AnswerNormalizerTest {

    private final AnswerNormalizer normalizer = new AnswerNormalizer();

    @Test
    @DisplayName("answer prefix, case and trailing period are removed")
    void strips_prefix_and_case() {
        assertThat(normalizer.normalize("The answer is Paris.")).isEqualTo("paris");
        assertThat(normalizer.normalize("Therefore, Paris")).isEqualTo("paris");
        assertThat(normalizer.normalize("Answer: PARIS")).isEqualTo("paris");
    }

    @Test
    @DisplayName("'so' is only stripped as a whole word")
    void whole_word_prefix() {
        assertThat(normalizer.normalize("Sofia")).isEqualTo("sofia");
        assertThat(normalizer.normalize("So Sofia")).isEqualTo("sofia");
    }

    @Test
    @DisplayName("whitespace runs collapse to one space")
    void collapses_whitespace() {
        assertThat(normalizer.normalize("  New \n  York   City ")).isEqualTo("new york city");
    }

    @Test
    @DisplayName("null → empty string")
    void null_input() {
        assertThat(normalizer.normalize(null)).isEmpty();
    }
}
