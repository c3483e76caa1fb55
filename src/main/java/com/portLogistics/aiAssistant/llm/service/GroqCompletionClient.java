package com.portLogistics.aiAssistant.llm.service;

import com.portLogistics.aiAssistant.config.ClassificationSettings;
import com.portLogistics.aiAssistant.llm.dto.ChatCompletionRequest;
import com.portLogistics.aiAssistant.llm.dto.ChatCompletionResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.List;

/**
 * Client for Groq's OpenAI-compatible chat completions endpoint.
 *
 * Uses the JDK HTTP client underneath so an interrupted caller thread abandons the exchange.
 * The read timeout is set to the classification timeout.
 */
@Slf4j
@Service
public class GroqCompletionClient implements LlmCompletionClient {

    private final RestClient restClient;
    private final ClassificationSettings settings;

    public GroqCompletionClient(ClassificationSettings settings,
                                @Value("${assistant.llm.base-url:https://api.groq.com/openai/v1/chat/completions}") String baseUrl) {
        this.settings = settings;

        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(3))
                .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(settings.llmTimeout());

        this.restClient = RestClient.builder()
                .baseUrl(baseUrl)
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    @Override
    public String complete(String prompt, String traceId) {
        if (!settings.hasApiKey()) {
            throw new LlmProviderException("LLM API key is not configured. Set assistant.llm.api-key");
        }

        ChatCompletionRequest request = ChatCompletionRequest.builder()
                .messages(List.of(
                        ChatCompletionRequest.Message.builder()
                                .role("user")
                                .content(prompt)
                                .build()))
                .model(settings.llmModel())
                .temperature(settings.llmTemperature())
                .maxCompletionTokens(settings.llmMaxTokens())
                .topP(1.0)
                .stream(false)
                .responseFormat(ChatCompletionRequest.ResponseFormat.jsonObject())
                .build();

        try {
            log.debug("Calling LLM provider - traceId: {}, model: {}, prompt length: {}",
                    traceId, settings.llmModel(), prompt.length());

            ChatCompletionResponse response = restClient.post()
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + settings.llmApiKey())
                    .body(request)
                    .retrieve()
                    .body(ChatCompletionResponse.class);

            if (response == null || response.getContent() == null) {
                throw new LlmProviderException("LLM provider returned an empty response");
            }

            log.debug("LLM response received - traceId: {}, model: {}, tokens used: {}",
                    traceId,
                    response.getModel(),
                    response.getUsage() != null ? response.getUsage().getTotalTokens() : "unknown");

            return response.getContent();

        } catch (LlmProviderException e) {
            throw e;
        } catch (Exception e) {
            log.warn("Error calling LLM provider - traceId: {}, error: {}", traceId, e.getMessage());
            throw new LlmProviderException("Failed to call LLM provider: " + e.getMessage(), e);
        }
    }
}
