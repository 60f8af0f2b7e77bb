package com.knowledgechain.infrastructure.ai;

/**
 * Fatal provider error. Not retried by the gateway.
 */
public class LlmProviderException extends RuntimeException {

    public LlmProviderException(String message) {
        super(message);
    }

    public LlmProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
