package com.knowledgechain.interfaces.api.answer;

import com.knowledgechain.application.answer.AnswerAppService;
import com.knowledgechain.application.answer.AnswerAppService.BatchPrediction;
import com.knowledgechain.domain.answer.model.Confidence;
import com.knowledgechain.domain.answer.model.Domain;
import com.knowledgechain.domain.answer.model.PipelineResult;
import com.knowledgechain.domain.answer.model.PipelineStage;
import com.knowledgechain.domain.answer.model.PipelineState;
import com.knowledgechain.domain.answer.model.Rationale;
import com.knowledgechain.infrastructure.ai.CacheMetricsTracker;
import com.knowledgechain.infrastructure.ai.LlmProviderException;
import com.knowledgechain.infrastructure.ai.ModelGateway;
import com.knowledgechain.infrastructure.ai.RateLimitExceededException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AnswerController.class)
class AnswerControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AnswerAppService answerAppService;
    @MockBean
    private ModelGateway modelGateway;
    @MockBean
    private CacheMetricsTracker cacheMetricsTracker;

    private static PipelineResult earlyStop() {
        return new PipelineResult("Paris", PipelineStage.CONSENSUS_VALIDATED, Confidence.HIGH,
                List.of(Domain.FACTUAL),
                List.of(new Rationale(1, "France's capital is Paris. Answer: Paris", 0.7)),
                List.of(),
                Map.of("reasoning", "gpt-4o-mini"),
                List.of(PipelineState.START, PipelineState.DONE));
    }

    @Test
    @DisplayName("POST /api/v1/answers → 200 with answer, stage, domain labels")
    void answer_ok() throws Exception {
        when(answerAppService.answer("What is the capital of France?", null)).thenReturn(earlyStop());

        mockMvc.perform(post("/api/v1/answers")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\":\"What is the capital of France?\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.answer").value("Paris"))
                .andExpect(jsonPath("$.stage").value("CONSENSUS_VALIDATED"))
                .andExpect(jsonPath("$.confidence").value("HIGH"))
                .andExpect(jsonPath("$.domains[0]").value("factual"))
                .andExpect(jsonPath("$.rationales[0]").value("France's capital is Paris. Answer: Paris"));
    }

    @Test
    @DisplayName("blank question → 400 VALIDATION_ERROR")
    void blank_question() throws Exception {
        mockMvc.perform(post("/api/v1/answers")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\":\" \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.message").value("Question is required"));
    }

    @Test
    @DisplayName("malformed body → 400 MALFORMED_REQUEST")
    void malformed_body() throws Exception {
        mockMvc.perform(post("/api/v1/answers")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("MALFORMED_REQUEST"));
    }

    @Test
    @DisplayName("rate limit exhausted → 429 with Retry-After rounded up")
    void rate_limited() throws Exception {
        when(answerAppService.answer(any(), isNull())).thenThrow(new RateLimitExceededException(84.08, null));

        mockMvc.perform(post("/api/v1/answers")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\":\"Q?\"}"))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string("Retry-After", "85"))
                .andExpect(jsonPath("$.code").value("RATE_LIMIT_EXCEEDED"));
    }

    @Test
    @DisplayName("provider failure → 503")
    void provider_error() throws Exception {
        when(answerAppService.answer(any(), isNull())).thenThrow(new LlmProviderException("invalid api key"));

        mockMvc.perform(post("/api/v1/answers")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\":\"Q?\"}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("LLM_PROVIDER_ERROR"));
    }

    @Test
    @DisplayName("POST /batch → predictions in order, error only on failed items")
    void batch() throws Exception {
        when(answerAppService.answerBatch(anyList())).thenReturn(List.of(
                new BatchPrediction("1", "Paris", earlyStop(), null),
                new BatchPrediction("2", "", null, "INVALID_ARGUMENT")));

        mockMvc.perform(post("/api/v1/answers/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"items\":[{\"id\":\"1\",\"question\":\"Q1?\"},{\"id\":\"2\",\"question\":\"\"}]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.predictions[0].answer").value("Paris"))
                .andExpect(jsonPath("$.predictions[0].stage").value("CONSENSUS_VALIDATED"))
                .andExpect(jsonPath("$.predictions[0].error").doesNotExist())
                .andExpect(jsonPath("$.predictions[1].answer").value(""))
                .andExpect(jsonPath("$.predictions[1].error").value("INVALID_ARGUMENT"));
    }

    @Test
    @DisplayName("GET /cache-stats → counters from the tracker")
    void cache_stats() throws Exception {
        when(modelGateway.cacheSize()).thenReturn(7);
        when(cacheMetricsTracker.getCacheHits()).thenReturn(3L);
        when(cacheMetricsTracker.getTotalRequests()).thenReturn(10L);
        when(cacheMetricsTracker.getCacheHitRate()).thenReturn(30.0);
        when(cacheMetricsTracker.getProviderCalls()).thenReturn(8L);
        when(cacheMetricsTracker.getRateLimitRetries()).thenReturn(1L);

        mockMvc.perform(get("/api/v1/answers/cache-stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cachedResponses").value(7))
                .andExpect(jsonPath("$.cacheHits").value(3))
                .andExpect(jsonPath("$.cacheMisses").value(7))
                .andExpect(jsonPath("$.cacheHitRatePercent").value(30.0))
                .andExpect(jsonPath("$.providerCalls").value(8))
                .andExpect(jsonPath("$.rateLimitRetries").value(1));
    }
}
