package com.knowledgechain.infrastructure.ai.pipeline;

import com.knowledgechain.domain.answer.model.*;
import com.knowledgechain.domain.answer.service.QuestionAnsweringService;
import com.knowledgechain.infrastructure.ai.ModelGateway;
import com.knowledgechain.infrastructure.ai.PromptBuilder;
import com.knowledgechain.infrastructure.ai.reasoning.ReasoningService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Orchestrates the chain-of-knowledge pipeline for one question:
 * <p>
 * rationales → consensus check → (early stop | retrieval + progressive correction) → consolidation
 * </p>
 * Claim-style questions skip the consensus check so their answer is always a verification label.
 */
@Slf4j
@Component
public class ChainOfKnowledgePipeline implements QuestionAnsweringService {

    static final String PRIOR_CONTEXT_HEADER = "Previous corrected reasoning steps:";
    static final String EARLY_STOP_MODEL = "none (early stop)";

    private final ReasoningService reasoningService;
    private final KnowledgeRetriever knowledgeRetriever;
    private final RationaleCorrector rationaleCorrector;
    private final AnswerConsolidator answerConsolidator;
    private final PromptBuilder promptBuilder;
    private final ModelGateway gateway;
    private final double earlyStopThreshold;

    public ChainOfKnowledgePipeline(ReasoningService reasoningService,
                                    KnowledgeRetriever knowledgeRetriever,
                                    RationaleCorrector rationaleCorrector,
                                    AnswerConsolidator answerConsolidator,
                                    PromptBuilder promptBuilder,
                                    ModelGateway gateway,
                                    @Value("${reasoning.early-stop-threshold:0.7}") double earlyStopThreshold) {
        this.reasoningService = reasoningService;
        this.knowledgeRetriever = knowledgeRetriever;
        this.rationaleCorrector = rationaleCorrector;
        this.answerConsolidator = answerConsolidator;
        this.promptBuilder = promptBuilder;
        this.gateway = gateway;
        this.earlyStopThreshold = earlyStopThreshold;
    }

    @Override
    public PipelineResult run(String question, String datasetHint) {
        PipelineContext ctx = new PipelineContext();
        ctx.setQuestion(question);
        ctx.setDatasetHint(datasetHint);
        ctx.enter(PipelineState.START);

        log.info("[Pipeline] question: {}", abbreviate(question));

        // 1. Rationales, answers, domains
        generateRationales(ctx);

        // 2. Consensus (non-claim questions only)
        if (!QuestionAnsweringService.isClaimStyle(question) && tryEarlyStop(ctx)) {
            return ctx.toPipelineResult();
        }

        // 3. Retrieval + progressive correction
        retrieveAndCorrect(ctx);

        // 4. Consolidation
        consolidate(ctx);

        return ctx.toPipelineResult();
    }

    // ===== Internal methods =====

    private void generateRationales(PipelineContext ctx) {
        ctx.enter(PipelineState.RATIONALE_GENERATION);
        List<Rationale> rationales = reasoningService.generateRationales(ctx.getQuestion(), ctx.getDatasetHint());
        ctx.setRationales(rationales);
        ctx.setExtractedAnswers(reasoningService.extractAnswers(rationales));
        ctx.setDomains(reasoningService.identifyDomains(ctx.getQuestion()));
        log.info("[Pipeline] {} rationales, domains {}", rationales.size(), ctx.getDomains());
    }

    private boolean tryEarlyStop(PipelineContext ctx) {
        ctx.enter(PipelineState.CONSENSUS_CHECK);
        List<String> answers = ctx.getExtractedAnswers();
        if (!reasoningService.hasConsensus(answers, earlyStopThreshold)) {
            if (reasoningService.hasConsensus(answers)) {
                log.info("[Pipeline] consensus below early-stop threshold {}, running full pipeline",
                        earlyStopThreshold);
            }
            return false;
        }

        String consensus = reasoningService.consensusAnswer(answers);
        if (!reasoningService.validateConsensusAnswer(ctx.getQuestion(), consensus)) {
            log.info("[Pipeline] consensus '{}' failed validation, running full pipeline", consensus);
            return false;
        }

        ctx.enter(PipelineState.EARLY_STOP);
        ctx.setAnswer(consensus);
        ctx.setStage(PipelineStage.CONSENSUS_VALIDATED);
        ctx.setConfidence(Confidence.HIGH);
        ctx.setModelsUsed(modelsUsed(true));
        ctx.enter(PipelineState.DONE);
        log.info("[Pipeline] early stop with validated consensus: {}", consensus);
        return true;
    }

    private void retrieveAndCorrect(PipelineContext ctx) {
        ctx.enter(PipelineState.RETRIEVAL_LOOP);
        List<String> corrected = new ArrayList<>();
        List<Rationale> rationales = ctx.getRationales();

        for (Rationale rationale : rationales) {
            String priorContext = corrected.isEmpty()
                    ? ""
                    : PRIOR_CONTEXT_HEADER + "\n" + promptBuilder.numbered(corrected);

            String accepted = null;
            for (Domain domain : ctx.getDomains()) {
                accepted = attemptCorrection(rationale, domain, priorContext);
                if (accepted != null) {
                    log.debug("[Pipeline] rationale {}/{} corrected with {} knowledge",
                            rationale.index(), rationales.size(), domain);
                    break;
                }
            }
            if (accepted == null) {
                log.debug("[Pipeline] rationale {}/{} kept unchanged (no knowledge found)",
                        rationale.index(), rationales.size());
                accepted = rationale.text();
            }
            corrected.add(accepted);
        }
        ctx.setCorrectedRationales(corrected);
    }

    /**
     * @return the corrected rationale, or null if this domain produced no usable evidence or correction
     */
    private String attemptCorrection(Rationale rationale, Domain domain, String priorContext) {
        try {
            RetrievalOutcome outcome = knowledgeRetriever.retrieve(rationale.text(), domain);
            if (!outcome.isSuccess()) {
                if (outcome.status() == RetrievalOutcome.Status.FAILURE) {
                    log.debug("[Pipeline] retrieval failed for {}: {}", domain, outcome.reason());
                }
                return null;
            }
            String corrected = rationaleCorrector.correct(rationale.text(), outcome.evidence(), priorContext);
            return corrected == null || corrected.isBlank() ? null : corrected;
        } catch (RuntimeException e) {
            log.warn("[Pipeline] correction failed for domain {}: {}", domain, e.getMessage());
            return null;
        }
    }

    private void consolidate(PipelineContext ctx) {
        ctx.enter(PipelineState.CONSOLIDATION);
        ctx.setAnswer(answerConsolidator.consolidate(ctx.getQuestion(), ctx.getCorrectedRationales()));
        ctx.setStage(PipelineStage.FULL_PIPELINE);
        ctx.setConfidence(Confidence.MEDIUM);
        ctx.setModelsUsed(modelsUsed(false));
        ctx.enter(PipelineState.DONE);
    }

    private Map<String, String> modelsUsed(boolean earlyStop) {
        String model = gateway.modelName();
        String later = earlyStop ? EARLY_STOP_MODEL : model;
        Map<String, String> models = new LinkedHashMap<>();
        models.put("reasoning", model);
        models.put("query_generation", later);
        models.put("correction", later);
        models.put("consolidation", later);
        return models;
    }

    private static String abbreviate(String text) {
        return text.length() > 100 ? text.substring(0, 100) + "..." : text;
    }
}
