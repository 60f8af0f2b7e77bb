package com.knowledgechain.infrastructure.ai.extraction;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FinalAnswerCleanerTest {

    private final FinalAnswerCleaner cleaner = new FinalAnswerCleaner();

    @Test
    @DisplayName("text after the last Final Answer: marker, first line only")
    void marker_first_line() {
        String raw = "The steps agree.\nFinal Answer: C\nExplanation: option C matches.";
        assertThat(cleaner.clean(raw)).isEqualTo("C");
    }

    @Test
    @DisplayName("markdown and trailing period removed")
    void markdown_and_punctuation() {
        assertThat(cleaner.clean("**Paris**.")).isEqualTo("Paris");
    }

    @Test
    @DisplayName("'Based on ...,' prefix and surrounding quotes removed")
    void based_on_prefix_and_quotes() {
        assertThat(cleaner.clean("Based on the reasoning steps, \"Albert Einstein\""))
                .isEqualTo("Albert Einstein");
    }

    @Test
    @DisplayName("connective prefix removed")
    void connective_prefix() {
        assertThat(cleaner.clean("Therefore, Marie Curie")).isEqualTo("Marie Curie");
        assertThat(cleaner.clean("In conclusion: Mount Everest.")).isEqualTo("Mount Everest");
    }

    @Test
    @DisplayName("single-character answers are kept as-is")
    void single_character() {
        assertThat(cleaner.clean("B")).isEqualTo("B");
        assertThat(cleaner.clean("Answer: A.")).isEqualTo("A");
    }

    @Test
    @DisplayName("no marker → last sentence")
    void last_sentence() {
        assertThat(cleaner.clean("Both steps point the same way. The capital is Paris."))
                .isEqualTo("The capital is Paris");
    }

    @Test
    @DisplayName("bounded to 200 characters")
    void bounded() {
        assertThat(cleaner.clean("y".repeat(500))).hasSize(200);
    }

    @Test
    @DisplayName("blank → empty string")
    void blank() {
        assertThat(cleaner.clean(" ")).isEmpty();
    }
}
