package com.portLogistics.aiAssistant.llm.service;

/**
 * Thrown by {@link LlmCompletionClient} implementations when the provider call fails.
 */
public class LlmProviderException extends RuntimeException {

    public LlmProviderException(String message) {
        super(message);
    }

    public LlmProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
