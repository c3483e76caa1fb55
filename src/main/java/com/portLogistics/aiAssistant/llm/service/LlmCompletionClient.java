package com.portLogistics.aiAssistant.llm.service;

/**
 * Single request/response completion call to an LLM provider.
 *
 * Implementations block the calling thread and must give up promptly when that thread is
 * interrupted, so that a caller enforcing a timeout can abandon the call.
 */
public interface LlmCompletionClient {

    /**
     * @param prompt  Full prompt text
     * @param traceId Request trace id, for logging only
     * @return Raw completion text
     * @throws LlmProviderException when the provider cannot be reached or answers with an error
     */
    String complete(String prompt, String traceId);
}
