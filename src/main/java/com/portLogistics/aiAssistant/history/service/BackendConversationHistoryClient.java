package com.portLogistics.aiAssistant.history.service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.portLogistics.aiAssistant.history.model.ConversationTurn;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * History client backed by the backend chat module.
 *
 * {@code GET /chat/conversations/{id}} returns the conversation with its messages;
 * {@code POST /chat/conversations/{id}/messages} appends one message.
 */
@Slf4j
@Service
public class BackendConversationHistoryClient implements ConversationHistoryClient {

    private static final String REQUEST_ID_HEADER = "x-request-id";

    private final RestClient restClient;

    public BackendConversationHistoryClient(
            @Value("${assistant.history.base-url:${assistant.backend.base-url:http://localhost:3000/api}}") String baseUrl,
            @Value("${assistant.history.timeout:3s}") Duration timeout) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(timeout);

        this.restClient = RestClient.builder()
                .baseUrl(baseUrl)
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    @Override
    public List<ConversationTurn> fetchHistory(String conversationId, String authToken, String traceId) {
        if (conversationId == null || conversationId.isBlank()) {
            return List.of();
        }
        try {
            ConversationPayload conversation = restClient.get()
                    .uri("/chat/conversations/{id}", conversationId)
                    .headers(headers -> applyHeaders(headers, authToken, traceId))
                    .retrieve()
                    .body(ConversationPayload.class);
            if (conversation == null || conversation.getMessages() == null) {
                return List.of();
            }
            log.debug("History fetched - traceId: {}, conversationId: {}, turns: {}",
                    traceId, conversationId, conversation.getMessages().size());
            return conversation.getMessages();
        } catch (RestClientException e) {
            log.warn("History fetch failed, continuing without history - traceId: {}, conversationId: {}, error: {}",
                    traceId, conversationId, e.getMessage());
            return List.of();
        }
    }

    @Override
    public void appendTurn(String conversationId, ConversationTurn turn, String authToken, String traceId) {
        if (conversationId == null || conversationId.isBlank() || turn == null) {
            return;
        }
        AppendMessageRequest request = AppendMessageRequest.builder()
                .role(turn.getRole() != null ? turn.getRole().toUpperCase(Locale.ROOT) : null)
                .content(turn.getContent())
                .intent(turn.getIntent())
                .metadata(turn.getMetadata())
                .build();
        try {
            restClient.post()
                    .uri("/chat/conversations/{id}/messages", conversationId)
                    .headers(headers -> applyHeaders(headers, authToken, traceId))
                    .body(request)
                    .retrieve()
                    .toBodilessEntity();
        } catch (RestClientException e) {
            log.warn("History append failed - traceId: {}, conversationId: {}, role: {}, error: {}",
                    traceId, conversationId, request.getRole(), e.getMessage());
        }
    }

    private static void applyHeaders(HttpHeaders headers, String authToken, String traceId) {
        if (authToken != null && !authToken.isBlank()) {
            headers.set(HttpHeaders.AUTHORIZATION, authToken);
        }
        if (traceId != null) {
            headers.set(REQUEST_ID_HEADER, traceId);
        }
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ConversationPayload {

        @JsonProperty("id")
        private String id;

        @JsonProperty("messages")
        private List<ConversationTurn> messages;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    static class AppendMessageRequest {

        @JsonProperty("role")
        private String role;

        @JsonProperty("content")
        private String content;

        @JsonProperty("intent")
        private String intent;

        @JsonProperty("metadata")
        private Map<String, Object> metadata;
    }
}
