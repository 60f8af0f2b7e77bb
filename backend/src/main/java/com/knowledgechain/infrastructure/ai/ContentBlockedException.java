package com.knowledgechain.infrastructure.ai;

/**
 * The provider refused the prompt on content-safety grounds.
 */
public class ContentBlockedException extends LlmProviderException {

    public ContentBlockedException(String message) {
        super(message);
    }

    public ContentBlockedException(String message, Throwable cause) {
        super(message, cause);
    }
}
