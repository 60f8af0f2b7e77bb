package com.knowledgechain.interfaces.api.answer;

import com.knowledgechain.application.answer.AnswerAppService;
import com.knowledgechain.application.answer.AnswerAppService.BatchItem;
import com.knowledgechain.domain.answer.model.PipelineResult;
import com.knowledgechain.infrastructure.ai.CacheMetricsTracker;
import com.knowledgechain.infrastructure.ai.ModelGateway;
import com.knowledgechain.interfaces.api.dto.AnswerRequest;
import com.knowledgechain.interfaces.api.dto.AnswerResponse;
import com.knowledgechain.interfaces.api.dto.BatchAnswerRequest;
import com.knowledgechain.interfaces.api.dto.BatchAnswerResponse;
import com.knowledgechain.interfaces.api.dto.CacheStatsResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/answers")
@RequiredArgsConstructor
public class AnswerController {

    private final AnswerAppService answerAppService;
    private final ModelGateway modelGateway;
    private final CacheMetricsTracker cacheMetricsTracker;

    @PostMapping
    public ResponseEntity<AnswerResponse> answer(@Valid @RequestBody AnswerRequest request) {
        PipelineResult result = answerAppService.answer(request.question(), request.datasetHint());
        return ResponseEntity.ok(AnswerResponse.from(result));
    }

    @PostMapping("/batch")
    public ResponseEntity<BatchAnswerResponse> answerBatch(@Valid @RequestBody BatchAnswerRequest request) {
        List<BatchItem> items = request.items().stream()
                .map(item -> new BatchItem(item.id(), item.question(), item.datasetHint()))
                .toList();
        return ResponseEntity.ok(BatchAnswerResponse.from(answerAppService.answerBatch(items)));
    }

    @GetMapping("/cache-stats")
    public ResponseEntity<CacheStatsResponse> cacheStats() {
        long hits = cacheMetricsTracker.getCacheHits();
        return ResponseEntity.ok(new CacheStatsResponse(
                modelGateway.cacheSize(),
                hits,
                cacheMetricsTracker.getTotalRequests() - hits,
                cacheMetricsTracker.getCacheHitRate(),
                cacheMetricsTracker.getProviderCalls(),
                cacheMetricsTracker.getRateLimitRetries()));
    }
}
