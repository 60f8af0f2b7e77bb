package com.knowledgechain.infrastructure.ai;

/**
 * Raw completion call against a backing LLM. No caching, no retries.
 */
public interface LlmProvider {

    /**
     * @throws RateLimitedException    when the provider rate-limits the call
     * @throws ContentBlockedException when the provider rejects the prompt for safety reasons
     * @throws LlmProviderException    for any other provider failure
     */
    String complete(String prompt, double temperature);

    String modelName();
}
