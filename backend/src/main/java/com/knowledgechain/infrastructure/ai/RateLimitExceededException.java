package com.knowledgechain.infrastructure.ai;

import lombok.Getter;

/**
 * Raised by the gateway once all rate-limit retries are used up.
 */
@Getter
public class RateLimitExceededException extends LlmProviderException {

    /**
     * Suggested wait before the next call, parsed from the provider or estimated.
     */
    private final double waitSeconds;

    public RateLimitExceededException(double waitSeconds, Throwable cause) {
        super(String.format("Rate limit exceeded, retry after %.2fs", waitSeconds), cause);
        this.waitSeconds = waitSeconds;
    }
}
