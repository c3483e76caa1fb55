package com.portLogistics.aiAssistant.gateway.service;

import com.portLogistics.aiAssistant.agent.model.AgentResponse;
import com.portLogistics.aiAssistant.classification.model.Intent;
import com.portLogistics.aiAssistant.classification.model.IntentResult;
import com.portLogistics.aiAssistant.config.ClassificationSettings;
import com.portLogistics.aiAssistant.gateway.dto.ChatRequest;
import com.portLogistics.aiAssistant.gateway.dto.ChatResponse;
import com.portLogistics.aiAssistant.gateway.dto.ClassifierConfigResponse;
import com.portLogistics.aiAssistant.gateway.exception.MissingMessageException;
import com.portLogistics.aiAssistant.history.model.ConversationTurn;
import com.portLogistics.aiAssistant.history.service.ConversationHistoryClient;
import com.portLogistics.aiAssistant.history.service.HistoryNormalizer;
import com.portLogistics.aiAssistant.orchestrator.model.OrchestrationRequest;
import com.portLogistics.aiAssistant.orchestrator.model.OrchestrationResult;
import com.portLogistics.aiAssistant.orchestrator.service.OrchestratorService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GatewayServiceTest {

    private static final String TRACE_ID = "trace-gw";

    @Mock
    private TraceIdService traceIdService;

    @Mock
    private ConversationHistoryClient historyClient;

    @Mock
    private OrchestratorService orchestratorService;

    private GatewayService gatewayService;

    @BeforeEach
    void setUp() {
        ClassificationSettings settings = ClassificationSettings.builder()
                .llmEnabled(true)
                .llmProvider("groq")
                .llmModel("llama-3.1-8b-instant")
                .llmApiKey("")
                .llmTimeout(Duration.ofMillis(2500))
                .confidenceThreshold(0.45)
                .historyLimit(10)
                .followUpWindow(6)
                .build();
        gatewayService = new GatewayService(traceIdService, historyClient,
                new HistoryNormalizer(settings), orchestratorService, settings);
    }

    private void orchestratorAnswers(String intent, String message) {
        when(traceIdService.generateTraceId()).thenReturn(TRACE_ID);
        when(orchestratorService.handleMessage(any())).thenReturn(OrchestrationResult.builder()
                .intent(intent)
                .classification(IntentResult.builder().intent(Intent.HELP).confidence(0.8).build())
                .response(AgentResponse.builder()
                        .message(message)
                        .data(Map.of("error", false))
                        .proofs(Map.of("trace_id", TRACE_ID))
                        .build())
                .decisionPath(List.of("pattern_classifier"))
                .build());
    }

    @Test
    void headersOverrideBodyIdentity() {
        orchestratorAnswers("help", "Here is what I can do");
        ChatRequest request = ChatRequest.builder()
                .message("help")
                .userRole("CARRIER")
                .userId("body-user")
                .forceDeterministic(true)
                .build();

        ChatResponse response = gatewayService.processChatRequest(request, "Bearer t", "OPERATOR", "header-user");

        ArgumentCaptor<OrchestrationRequest> captor = ArgumentCaptor.forClass(OrchestrationRequest.class);
        verify(orchestratorService).handleMessage(captor.capture());
        OrchestrationRequest forwarded = captor.getValue();
        assertThat(forwarded.getRole()).isEqualTo("OPERATOR");
        assertThat(forwarded.getUserId()).isEqualTo("header-user");
        assertThat(forwarded.getAuthToken()).isEqualTo("Bearer t");
        assertThat(forwarded.getTraceId()).isEqualTo(TRACE_ID);
        assertThat(forwarded.isForceDeterministic()).isTrue();

        assertThat(response.getIntent()).isEqualTo("help");
        assertThat(response.getMessage()).isEqualTo("Here is what I can do");
        assertThat(response.getProofs()).containsEntry("trace_id", TRACE_ID);
    }

    @Test
    void bodyIdentityIsUsedWithoutHeaders() {
        orchestratorAnswers("help", "ok");

        gatewayService.processChatRequest(
                ChatRequest.builder().message("help").userRole("CARRIER").userId("c-1").build(), null, " ", null);

        ArgumentCaptor<OrchestrationRequest> captor = ArgumentCaptor.forClass(OrchestrationRequest.class);
        verify(orchestratorService).handleMessage(captor.capture());
        assertThat(captor.getValue().getRole()).isEqualTo("CARRIER");
        assertThat(captor.getValue().getUserId()).isEqualTo("c-1");
        assertThat(captor.getValue().getAuthToken()).isNull();
    }

    @Test
    void inlineHistoryIsNormalizedAndNotFetched() {
        orchestratorAnswers("slot_availability", "2 open slots");
        ChatRequest request = ChatRequest.builder()
                .message("et demain?")
                .conversationId("conv-1")
                .history(List.of(
                        ConversationTurn.builder().role("USER").content("slots at terminal A").build(),
                        ConversationTurn.builder().role("SYSTEM").content("ignored").build()))
                .build();

        gatewayService.processChatRequest(request, null, "CARRIER", null);

        ArgumentCaptor<OrchestrationRequest> captor = ArgumentCaptor.forClass(OrchestrationRequest.class);
        verify(orchestratorService).handleMessage(captor.capture());
        assertThat(captor.getValue().getHistory())
                .extracting(ConversationTurn::getRole)
                .containsExactly("user");
        verify(historyClient, never()).fetchHistory(anyString(), any(), anyString());
    }

    @Test
    void historyIsFetchedByConversationAndTurnsAreAppended() {
        orchestratorAnswers("help", "Here is what I can do");
        when(historyClient.fetchHistory("conv-7", "Bearer t", TRACE_ID)).thenReturn(List.of(
                ConversationTurn.builder().role("ASSISTANT").content("hello").build()));

        gatewayService.processChatRequest(
                ChatRequest.builder().message("help").conversationId(" conv-7 ").build(), "Bearer t", null, null);

        ArgumentCaptor<ConversationTurn> turns = ArgumentCaptor.forClass(ConversationTurn.class);
        verify(historyClient, times(2)).appendTurn(eq("conv-7"), turns.capture(), eq("Bearer t"), eq(TRACE_ID));
        List<ConversationTurn> saved = turns.getAllValues();
        assertThat(saved.get(0).getRole()).isEqualTo("user");
        assertThat(saved.get(0).getContent()).isEqualTo("help");
        assertThat(saved.get(1).getRole()).isEqualTo("assistant");
        assertThat(saved.get(1).getIntent()).isEqualTo("help");
        assertThat(saved.get(1).getMetadata())
                .containsEntry("trace_id", TRACE_ID)
                .containsEntry("confidence", 0.8);
    }

    @Test
    void nothingIsSavedWithoutConversation() {
        orchestratorAnswers("help", "ok");

        gatewayService.processChatRequest(ChatRequest.builder().message("help").build(), null, null, null);

        verifyNoInteractions(historyClient);
    }

    @Test
    void missingMessageIsRejected() {
        assertThatThrownBy(() -> gatewayService.processChatRequest(new ChatRequest(), null, null, null))
                .isInstanceOf(MissingMessageException.class);
        verifyNoInteractions(orchestratorService);
    }

    @Test
    void configReportsLlmNotConfiguredWithoutKey() {
        ClassifierConfigResponse config = gatewayService.getClassifierConfig();

        assertThat(config.isLlmEnabled()).isTrue();
        assertThat(config.isLlmConfigured()).isFalse();
        assertThat(config.isHasApiKey()).isFalse();
        assertThat(config.getTimeoutSeconds()).isEqualTo(2.5);
        assertThat(config.getHistoryLimit()).isEqualTo(10);
    }
}
