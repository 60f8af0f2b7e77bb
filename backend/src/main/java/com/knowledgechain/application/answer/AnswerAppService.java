package com.knowledgechain.application.answer;

import com.knowledgechain.domain.answer.model.PipelineResult;
import com.knowledgechain.domain.answer.service.QuestionAnsweringService;
import com.knowledgechain.infrastructure.ai.LlmProviderException;
import com.knowledgechain.infrastructure.ai.RateLimitExceededException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class AnswerAppService {

    private final QuestionAnsweringService questionAnsweringService;

    @Value("${pipeline.max-question-length:4000}")
    private int maxQuestionLength;

    @Value("${pipeline.max-batch-size:100}")
    private int maxBatchSize;

    public record BatchItem(String id, String question, String datasetHint) {}

    /**
     * @param answer    empty when the question failed
     * @param errorCode null on success
     */
    public record BatchPrediction(String id, String answer, PipelineResult result, String errorCode) {

        public boolean failed() {
            return errorCode != null;
        }
    }

    public PipelineResult answer(String question, String datasetHint) {
        String normalized = validateQuestion(question);
        return questionAnsweringService.run(normalized, blankToNull(datasetHint));
    }

    /**
     * Answer every item; a failing item yields an empty prediction instead of failing the batch.
     */
    public List<BatchPrediction> answerBatch(List<BatchItem> items) {
        if (items == null || items.isEmpty()) {
            throw new IllegalArgumentException("Batch must contain at least one item");
        }
        if (items.size() > maxBatchSize) {
            throw new IllegalArgumentException(
                    String.format("Batch size %d exceeds the maximum of %d", items.size(), maxBatchSize));
        }

        List<BatchPrediction> predictions = new ArrayList<>(items.size());
        for (BatchItem item : items) {
            predictions.add(answerQuietly(item));
        }
        long failures = predictions.stream().filter(BatchPrediction::failed).count();
        log.info("[Batch] {} items answered, {} failed", predictions.size(), failures);
        return predictions;
    }

    private BatchPrediction answerQuietly(BatchItem item) {
        try {
            PipelineResult result = answer(item.question(), item.datasetHint());
            return new BatchPrediction(item.id(), result.answer(), result, null);
        } catch (IllegalArgumentException e) {
            log.warn("[Batch] item {} rejected: {}", item.id(), e.getMessage());
            return new BatchPrediction(item.id(), "", null, "INVALID_ARGUMENT");
        } catch (RateLimitExceededException e) {
            log.warn("[Batch] item {} rate limited: {}", item.id(), e.getMessage());
            return new BatchPrediction(item.id(), "", null, "RATE_LIMIT_EXCEEDED");
        } catch (LlmProviderException e) {
            log.warn("[Batch] item {} provider error: {}", item.id(), e.getMessage());
            return new BatchPrediction(item.id(), "", null, "LLM_PROVIDER_ERROR");
        } catch (RuntimeException e) {
            log.error("[Batch] item {} failed unexpectedly", item.id(), e);
            return new BatchPrediction(item.id(), "", null, "INTERNAL_ERROR");
        }
    }

    String validateQuestion(String question) {
        if (question == null || question.isBlank()) {
            throw new IllegalArgumentException("Question must not be blank");
        }
        String normalized = question.strip().replaceAll("\\s+", " ");
        if (normalized.length() > maxQuestionLength) {
            throw new IllegalArgumentException(
                    String.format("Question must not exceed %d characters", maxQuestionLength));
        }
        return normalized;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.strip();
    }
}
