package com.portLogistics.aiAssistant.gateway.service;

import com.portLogistics.aiAssistant.agent.model.AgentResponse;
import com.portLogistics.aiAssistant.config.ClassificationSettings;
import com.portLogistics.aiAssistant.gateway.dto.ChatRequest;
import com.portLogistics.aiAssistant.gateway.dto.ChatResponse;
import com.portLogistics.aiAssistant.gateway.dto.ClassifierConfigResponse;
import com.portLogistics.aiAssistant.gateway.exception.MissingMessageException;
import com.portLogistics.aiAssistant.gateway.model.RequestContext;
import com.portLogistics.aiAssistant.gateway.util.UserIdMasker;
import com.portLogistics.aiAssistant.history.model.ConversationTurn;
import com.portLogistics.aiAssistant.history.service.ConversationHistoryClient;
import com.portLogistics.aiAssistant.history.service.HistoryNormalizer;
import com.portLogistics.aiAssistant.orchestrator.model.OrchestrationRequest;
import com.portLogistics.aiAssistant.orchestrator.model.OrchestrationResult;
import com.portLogistics.aiAssistant.orchestrator.service.OrchestratorService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Gateway service - everything between the HTTP layer and the orchestrator.
 *
 * Responsibilities:
 * - Resolve caller identity (headers win over body fields)
 * - Generate the trace id
 * - Load history (inline, or fetched by conversation id) and normalize it
 * - Forward to the orchestrator
 * - Append the user and assistant turns to the conversation store
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GatewayService {

    private final TraceIdService traceIdService;
    private final ConversationHistoryClient historyClient;
    private final HistoryNormalizer historyNormalizer;
    private final OrchestratorService orchestratorService;
    private final ClassificationSettings settings;

    /**
     * Processes a chat request.
     *
     * @param request          Chat request body
     * @param authorization    Authorization header, may be null
     * @param roleHeader       X-User-Role header, may be null
     * @param userIdHeader     X-User-Id header, may be null
     * @return Chat response envelope
     * @throws MissingMessageException if the body has no message field
     */
    public ChatResponse processChatRequest(ChatRequest request, String authorization, String roleHeader, String userIdHeader) {
        if (request.getMessage() == null) {
            throw new MissingMessageException("message is required");
        }

        RequestContext context = createRequestContext(request, authorization, roleHeader, userIdHeader);
        String traceId = context.getTraceId();
        log.info("Chat request received - traceId: {}, userId: {}, role: {}, conversationId: {}, modality: {}",
                traceId, UserIdMasker.mask(context.getUserId()), context.getRole(),
                context.getConversationId(), request.getInputModality());

        List<ConversationTurn> history = historyNormalizer.normalize(loadHistory(request, context));

        OrchestrationResult result = orchestratorService.handleMessage(OrchestrationRequest.builder()
                .message(request.getMessage())
                .history(history)
                .role(context.getRole())
                .userId(context.getUserId())
                .traceId(traceId)
                .authToken(context.getAuthToken())
                .forceDeterministic(request.forceDeterministicRequested())
                .inputModality(request.getInputModality())
                .build());

        saveTurns(request, context, result);
        return toChatResponse(result);
    }

    public ClassifierConfigResponse getClassifierConfig() {
        return ClassifierConfigResponse.builder()
                .llmEnabled(settings.llmEnabled())
                .llmConfigured(settings.isLlmConfigured())
                .provider(settings.llmProvider())
                .model(settings.llmModel())
                .hasApiKey(settings.hasApiKey())
                .timeoutSeconds(settings.llmTimeout().toMillis() / 1000.0)
                .confidenceThreshold(settings.confidenceThreshold())
                .historyLimit(settings.historyLimit())
                .followUpWindow(settings.followUpWindow())
                .build();
    }

    private RequestContext createRequestContext(ChatRequest request, String authorization,
                                                String roleHeader, String userIdHeader) {
        return RequestContext.builder()
                .traceId(traceIdService.generateTraceId())
                .role(firstNonBlank(roleHeader, request.getUserRole()))
                .userId(firstNonBlank(userIdHeader, request.getUserId()))
                .authToken(isBlank(authorization) ? null : authorization.trim())
                .conversationId(isBlank(request.getConversationId()) ? null : request.getConversationId().trim())
                .receivedAt(Instant.now())
                .build();
    }

    private List<ConversationTurn> loadHistory(ChatRequest request, RequestContext context) {
        if (request.getHistory() != null) {
            return request.getHistory();
        }
        if (context.getConversationId() == null) {
            return List.of();
        }
        return historyClient.fetchHistory(context.getConversationId(), context.getAuthToken(), context.getTraceId());
    }

    private void saveTurns(ChatRequest request, RequestContext context, OrchestrationResult result) {
        if (context.getConversationId() == null) {
            return;
        }
        String intent = result.getIntent();
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(AgentResponse.PROOF_TRACE_ID, context.getTraceId());
        if (result.getClassification() != null) {
            metadata.put("confidence", result.getClassification().getConfidence());
        }

        historyClient.appendTurn(context.getConversationId(),
                ConversationTurn.user(request.getMessage(), intent), context.getAuthToken(), context.getTraceId());
        historyClient.appendTurn(context.getConversationId(),
                ConversationTurn.assistant(result.getResponse().getMessage(), intent, metadata),
                context.getAuthToken(), context.getTraceId());
    }

    private static ChatResponse toChatResponse(OrchestrationResult result) {
        AgentResponse response = result.getResponse();
        return ChatResponse.builder()
                .intent(result.getIntent())
                .message(response.getMessage())
                .data(response.getData())
                .proofs(response.getProofs())
                .build();
    }

    private static String firstNonBlank(String preferred, String fallback) {
        if (!isBlank(preferred)) {
            return preferred.trim();
        }
        return isBlank(fallback) ? null : fallback.trim();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
