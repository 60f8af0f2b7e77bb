package com.knowledgechain.infrastructure.ai.pipeline;

import com.knowledgechain.infrastructure.ai.ModelGateway;
import com.knowledgechain.infrastructure.ai.PromptBuilder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class RationaleCorrector {

    private final ModelGateway gateway;
    private final PromptBuilder promptBuilder;

    /**
     * Rewrite a rationale against retrieved evidence.
     *
     * @param priorContext transcript of the rationales corrected so far, may be empty
     * @return the corrected rationale, or the original when there is no usable evidence
     */
    public String correct(String original, String evidence, String priorContext) {
        if (evidence == null || evidence.isBlank() || KnowledgeRetriever.NO_RESULTS.equals(evidence)) {
            log.debug("[Correction] no supporting knowledge, keeping original rationale");
            return original;
        }
        String corrected = gateway.call(promptBuilder.buildCorrectionPrompt(original, evidence, priorContext), 0.0);
        return corrected == null ? "" : corrected.strip();
    }
}
