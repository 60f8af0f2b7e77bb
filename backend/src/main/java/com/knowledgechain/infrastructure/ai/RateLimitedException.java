package com.knowledgechain.infrastructure.ai;

/**
 * A single rate-limit rejection from the provider. The message is kept verbatim so the gateway
 * can read a "try again in ..." hint from it.
 */
public class RateLimitedException extends LlmProviderException {

    public RateLimitedException(String message) {
        super(message);
    }

    public RateLimitedException(String message, Throwable cause) {
        super(message, cause);
    }
}
