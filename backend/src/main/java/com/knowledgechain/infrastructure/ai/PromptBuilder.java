package com.knowledgechain.infrastructure.ai;

import com.knowledgechain.domain.answer.service.QuestionAnsweringService;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

@Component
public class PromptBuilder {

    // ===== Stage 1: reasoning =====

    private static final String REASONING_PROMPT = """
            You are a helpful assistant. Answer the following question step by step.

            Question: %s

            Think about what information is needed to answer this question. Break down the problem and provide your reasoning.
            End with a line of the form "Answer: <your answer>".

            Reasoning:""";

    private static final String MULTI_HOP_REASONING_PROMPT = """
            You are a helpful assistant. The following question may require combining several facts.

            Question: %s

            Identify each intermediate fact you need, resolve them one at a time, then combine them.
            End with a line of the form "Answer: <entity or short phrase>".

            Reasoning:""";

    private static final String MULTIPLE_CHOICE_REASONING_PROMPT = """
            You are a medical expert. Answer the following multiple-choice question step by step.

            Question: %s

            Consider each option in turn and explain why it is or is not correct.
            End with a line of the form "Answer: <option letter>".

            Reasoning:""";

    private static final String CLAIM_REASONING_PROMPT = """
            You are a fact-checking assistant. Decide whether the evidence you know supports the claim.

            %s

            Reason step by step about the facts the claim depends on.
            End with a line of the form "Answer: SUPPORTS", "Answer: REFUTES" or "Answer: NOT ENOUGH INFO".

            Reasoning:""";

    private static final String DOMAIN_IDENTIFICATION_PROMPT = """
            Identify the knowledge domains relevant to answer this question.

            Available domains: [factual, medical, physics, biology]

            Question: %s

            Relevant domains (select from the list):""";

    private static final String CONSENSUS_VALIDATION_PROMPT = """
            Question: %s

            Proposed answer: %s

            Does the proposed answer directly and plausibly answer the question (not a restatement, not off-topic)?
            Respond with only YES or NO.""";

    // ===== Stage 2: queries + correction =====

    private static final String SPARQL_GENERATION_PROMPT = """
            Convert this sentence to a SPARQL query for Wikidata. The query should retrieve relevant entities and facts.
            Use rdfs:label with language tags for names, include a WHERE clause and LIMIT 5. Output only the query.

            Sentence: %s

            SPARQL Query:""";

    private static final String MEDICAL_EXTRACTION_PROMPT = """
            Extract key medical information from this sentence:

            Sentence: %s

            Key medical terms and concepts (comma-separated, no explanation):""";

    private static final String NL_QUERY_EXTRACTION_PROMPT = """
            Extract the main search query from this sentence:

            Sentence: %s

            Search query (a few keywords, no explanation):""";

    private static final String RATIONALE_CORRECTION_PROMPT = """
            Given the supporting knowledge, correct or improve the following rationale to make it more accurate.
            %s
            Original Rationale: %s

            Supporting Knowledge:
            %s

            Corrected Rationale:""";

    // ===== Stage 3: consolidation =====

    private static final String ANSWER_CONSOLIDATION_PROMPT = """
            Based on the following reasoning steps, provide a concise final answer to the question.

            Question: %s

            Reasoning steps:
            %s

            IMPORTANT: Provide ONLY the answer, nothing else.
            - For multiple choice (A, B, C, D): Provide only the letter.
            - For factual questions: Provide only the specific fact or entity name.
            - Do NOT include explanations, reasoning, or additional text.

            Examples:
            - For multiple choice: "A" or "B" or "C" or "D"
            - For factual: "Paris" or "Einstein"

            Final Answer:""";

    private static final String CLAIM_CONSOLIDATION_PROMPT = """
            Based on the following reasoning steps, decide whether the claim is supported.

            %s

            Reasoning steps:
            %s

            Respond with exactly one label and nothing else:
            - SUPPORTS if the evidence confirms the claim
            - REFUTES if the evidence contradicts the claim
            - NOT ENOUGH INFO if the evidence is insufficient

            Final Answer:""";

    /**
     * Reasoning prompt for sample {@code index} of {@code total}. The sample line keeps each of the
     * k prompts distinct, so the prompt-keyed gateway cache never collapses them into one.
     */
    public String buildReasoningPrompt(String question, String datasetHint, int index, int total) {
        return "Independent reasoning attempt " + index + " of " + total + ".\n\n"
                + buildReasoningPrompt(question, datasetHint);
    }

    public String buildReasoningPrompt(String question, String datasetHint) {
        String hint = datasetHint == null ? "" : datasetHint.toLowerCase(Locale.ROOT);
        if (QuestionAnsweringService.isClaimStyle(question) || hint.contains("fever")) {
            return CLAIM_REASONING_PROMPT.formatted(question);
        }
        if (hint.contains("medmcqa")) {
            return MULTIPLE_CHOICE_REASONING_PROMPT.formatted(question);
        }
        if (hint.contains("hotpot")) {
            return MULTI_HOP_REASONING_PROMPT.formatted(question);
        }
        return REASONING_PROMPT.formatted(question);
    }

    public String buildDomainPrompt(String question) {
        return DOMAIN_IDENTIFICATION_PROMPT.formatted(question);
    }

    public String buildConsensusValidationPrompt(String question, String answer) {
        return CONSENSUS_VALIDATION_PROMPT.formatted(question, answer);
    }

    public String buildSparqlPrompt(String rationale) {
        return SPARQL_GENERATION_PROMPT.formatted(rationale);
    }

    public String buildMedicalPrompt(String rationale) {
        return MEDICAL_EXTRACTION_PROMPT.formatted(rationale);
    }

    public String buildNaturalLanguagePrompt(String rationale) {
        return NL_QUERY_EXTRACTION_PROMPT.formatted(rationale);
    }

    /**
     * @param priorContext transcript of already-corrected rationales, empty for the first one
     */
    public String buildCorrectionPrompt(String rationale, String evidence, String priorContext) {
        String context = priorContext == null || priorContext.isBlank()
                ? ""
                : "\n" + priorContext.strip() + "\n";
        return RATIONALE_CORRECTION_PROMPT.formatted(context, rationale, evidence);
    }

    public String buildConsolidationPrompt(String question, String reasoningSteps) {
        if (QuestionAnsweringService.isClaimStyle(question)) {
            return CLAIM_CONSOLIDATION_PROMPT.formatted(question, reasoningSteps);
        }
        return ANSWER_CONSOLIDATION_PROMPT.formatted(question, reasoningSteps);
    }

    /**
     * Numbered transcript, one entry per line: "1. ...", "2. ...".
     */
    public String numbered(List<String> entries) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < entries.size(); i++) {
            if (i > 0) {
                sb.append("\n");
            }
            sb.append(i + 1).append(". ").append(entries.get(i));
        }
        return sb.toString();
    }
}
