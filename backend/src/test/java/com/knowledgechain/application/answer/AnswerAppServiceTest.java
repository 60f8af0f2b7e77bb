package com.knowledgechain.application.answer;

import com.knowledgechain.application.answer.AnswerAppService.BatchItem;
import com.knowledgechain.application.answer.AnswerAppService.BatchPrediction;
import com.knowledgechain.domain.answer.model.Confidence;
import com.knowledgechain.domain.answer.model.PipelineResult;
import com.knowledgechain.domain.answer.model.PipelineStage;
import com.knowledgechain.domain.answer.service.QuestionAnsweringService;
import com.knowledgechain.infrastructure.ai.LlmProviderException;
import com.knowledgechain.infrastructure.ai.RateLimitExceededException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AnswerAppServiceTest {

    @Mock
    private QuestionAnsweringService questionAnsweringService;

    @InjectMocks
    private AnswerAppService service;

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(service, "maxQuestionLength", 50);
        ReflectionTestUtils.setField(service, "maxBatchSize", 3);
    }

    private static PipelineResult result(String answer) {
        return new PipelineResult(answer, PipelineStage.FULL_PIPELINE, Confidence.MEDIUM,
                List.of(), List.of(), List.of(), Map.of(), List.of());
    }

    @Nested
    @DisplayName("answer")
    class Answer {

        @Test
        @DisplayName("whitespace collapsed, blank hint passed as null")
        void normalizes_input() {
            when(questionAnsweringService.run("What is the capital of France?", null)).thenReturn(result("Paris"));

            PipelineResult result = service.answer("  What is   the capital\nof France?  ", "  ");

            assertThat(result.answer()).isEqualTo("Paris");
        }

        @Test
        @DisplayName("hint is trimmed and forwarded")
        void forwards_hint() {
            when(questionAnsweringService.run("Q?", "fever")).thenReturn(result("SUPPORTS"));

            service.answer("Q?", " fever ");

            verify(questionAnsweringService).run("Q?", "fever");
        }

        @Test
        @DisplayName("blank or oversized question rejected before the pipeline runs")
        void rejects_invalid() {
            assertThatThrownBy(() -> service.answer("   ", null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("blank");
            assertThatThrownBy(() -> service.answer("x".repeat(51), null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("50");
            verifyNoInteractions(questionAnsweringService);
        }
    }

    @Nested
    @DisplayName("answerBatch")
    class Batch {

        @Test
        @DisplayName("each failure kind maps to its own error code; the batch continues")
        void per_item_errors() {
            when(questionAnsweringService.run("ok?", null)).thenReturn(result("yes"));
            when(questionAnsweringService.run("limited?", null)).thenThrow(new RateLimitExceededException(3.0, null));
            when(questionAnsweringService.run("down?", null)).thenThrow(new LlmProviderException("down"));

            List<BatchPrediction> predictions = service.answerBatch(List.of(
                    new BatchItem("1", "ok?", null),
                    new BatchItem("2", "limited?", null),
                    new BatchItem("3", "down?", null)));

            assertThat(predictions).extracting(BatchPrediction::id).containsExactly("1", "2", "3");
            assertThat(predictions).extracting(BatchPrediction::answer).containsExactly("yes", "", "");
            assertThat(predictions).extracting(BatchPrediction::errorCode)
                    .containsExactly(null, "RATE_LIMIT_EXCEEDED", "LLM_PROVIDER_ERROR");
        }

        @Test
        @DisplayName("invalid and unexpected failures")
        void invalid_and_internal() {
            when(questionAnsweringService.run(any(), any())).thenThrow(new IllegalStateException("boom"));

            List<BatchPrediction> predictions = service.answerBatch(List.of(
                    new BatchItem("a", " ", null),
                    new BatchItem("b", "fine?", null)));

            assertThat(predictions).extracting(BatchPrediction::errorCode)
                    .containsExactly("INVALID_ARGUMENT", "INTERNAL_ERROR");
            assertThat(predictions).allMatch(BatchPrediction::failed);
        }

        @Test
        @DisplayName("empty or oversized batch rejected")
        void batch_size() {
            assertThatThrownBy(() -> service.answerBatch(List.of()))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> service.answerBatch(Collections.nCopies(4, new BatchItem("x", "q?", null))))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("exceeds");
        }
    }
}
