package com.knowledgechain.domain.answer.model;

/**
 * One sampled reasoning trace.
 *
 * @param index       generation index, 1..k
 * @param text        the raw LLM output
 * @param temperature sampling temperature used for this call
 */
public record Rationale(int index, String text, double temperature) {}
