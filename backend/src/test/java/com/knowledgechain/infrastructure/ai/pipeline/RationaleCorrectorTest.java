package com.knowledgechain.infrastructure.ai.pipeline;

import com.knowledgechain.infrastructure.ai.ModelGateway;
import com.knowledgechain.infrastructure.ai.PromptBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RationaleCorrectorTest {

    @Mock
    private ModelGateway gateway;

    private RationaleCorrector corrector;

    @BeforeEach
    void setUp() {
        corrector = new RationaleCorrector(gateway, new PromptBuilder());
    }

    @Test
    @DisplayName("evidence present → one call at temperature 0, reply stripped")
    void corrects_with_evidence() {
        when(gateway.call(anyString(), eq(0.0))).thenReturn("  The capital of France is Paris.  \n");

        String corrected = corrector.correct("The capital of France is Lyon.", "Paris is the capital of France.", "");

        assertThat(corrected).isEqualTo("The capital of France is Paris.");
        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(gateway).call(prompt.capture(), eq(0.0));
        assertThat(prompt.getValue())
                .contains("Original Rationale: The capital of France is Lyon.")
                .contains("Paris is the capital of France.")
                .doesNotContain("Previous corrected reasoning steps");
    }

    @Test
    @DisplayName("prior corrected steps are included in the prompt")
    void includes_prior_context() {
        when(gateway.call(anyString(), eq(0.0))).thenReturn("Step two, corrected.");

        corrector.correct("Step two.", "Some evidence text.",
                "Previous corrected reasoning steps:\n1. Step one, corrected.");

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(gateway).call(prompt.capture(), eq(0.0));
        assertThat(prompt.getValue()).contains("Previous corrected reasoning steps:\n1. Step one, corrected.");
    }

    @Test
    @DisplayName("no results sentinel or blank evidence → original returned without a model call")
    void no_evidence_keeps_original() {
        assertThat(corrector.correct("original", KnowledgeRetriever.NO_RESULTS, "")).isEqualTo("original");
        assertThat(corrector.correct("original", "  ", "")).isEqualTo("original");
        assertThat(corrector.correct("original", null, "")).isEqualTo("original");
        verifyNoInteractions(gateway);
    }

    @Test
    @DisplayName("null reply → empty string")
    void null_reply() {
        when(gateway.call(anyString(), anyDouble())).thenReturn(null);

        assertThat(corrector.correct("original", "Some evidence text.", "")).isEmpty();
    }
}
