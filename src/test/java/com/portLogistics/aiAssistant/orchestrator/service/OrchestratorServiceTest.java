package com.portLogistics.aiAssistant.orchestrator.service;

import com.portLogistics.aiAssistant.access.service.AccessPolicy;
import com.portLogistics.aiAssistant.agent.model.AgentContext;
import com.portLogistics.aiAssistant.agent.model.AgentResponse;
import com.portLogistics.aiAssistant.agent.registry.AgentDispatcher;
import com.portLogistics.aiAssistant.agent.registry.AgentRegistry;
import com.portLogistics.aiAssistant.agent.service.BookingDateResolver;
import com.portLogistics.aiAssistant.classification.entity.EntityExtractor;
import com.portLogistics.aiAssistant.classification.followup.FollowUpResolver;
import com.portLogistics.aiAssistant.classification.model.ExtractedEntities;
import com.portLogistics.aiAssistant.classification.model.Intent;
import com.portLogistics.aiAssistant.classification.model.IntentResult;
import com.portLogistics.aiAssistant.classification.pattern.IntentRuleTable;
import com.portLogistics.aiAssistant.classification.pattern.PatternClassifier;
import com.portLogistics.aiAssistant.config.ClassificationSettings;
import com.portLogistics.aiAssistant.history.model.ConversationTurn;
import com.portLogistics.aiAssistant.llm.model.LlmClassificationOutcome;
import com.portLogistics.aiAssistant.llm.service.LlmIntentClassifier;
import com.portLogistics.aiAssistant.orchestrator.model.OrchestrationRequest;
import com.portLogistics.aiAssistant.orchestrator.model.OrchestrationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OrchestratorServiceTest {

    private static final String TRACE_ID = "trace-7";

    @Mock
    private LlmIntentClassifier llmIntentClassifier;

    @Mock
    private AgentDispatcher agentDispatcher;

    private final PatternClassifier patternClassifier = new PatternClassifier(new IntentRuleTable());

    private ClassificationSettings llmOn;
    private ClassificationSettings llmOff;

    @BeforeEach
    void setUp() {
        llmOff = ClassificationSettings.builder()
                .llmEnabled(false)
                .llmTimeout(Duration.ofSeconds(6))
                .confidenceThreshold(0.45)
                .historyLimit(10)
                .followUpWindow(6)
                .timezone(ZoneId.of("Africa/Algiers"))
                .build();
        llmOn = llmOff.toBuilder().llmEnabled(true).llmApiKey("key").build();
    }

    private OrchestratorService orchestrator(ClassificationSettings settings) {
        return new OrchestratorService(patternClassifier, llmIntentClassifier, new EntityExtractor(),
                new FollowUpResolver(settings), new AccessPolicy(), agentDispatcher, settings);
    }

    private static OrchestrationRequest.OrchestrationRequestBuilder request(String message, String role) {
        return OrchestrationRequest.builder()
                .message(message)
                .role(role)
                .userId("user-123")
                .traceId(TRACE_ID);
    }

    private void agentAnswers(String agentName) {
        when(agentDispatcher.dispatch(any(), any())).thenAnswer(invocation -> {
            AgentContext context = invocation.getArgument(1);
            AgentResponse response = AgentResponse.builder()
                    .message("ok")
                    .data(Map.of("error", false))
                    .proofs(Map.of("trace_id", context.getTraceId()))
                    .build();
            return new AgentDispatcher.DispatchResult(response, agentName, true);
        });
    }

    @Test
    void patternPathDispatchesAuthorizedIntent() {
        agentAnswers("BookingStatusAgent");

        OrchestrationResult result = orchestrator(llmOff).handleMessage(request("What's the status of REF123?", "CARRIER").build());

        assertThat(result.getIntent()).isEqualTo("booking_status");
        assertThat(result.getDecisionPath())
                .containsExactly("pattern_classifier", "access_granted", "agent:BookingStatusAgent");
        assertThat(result.getResponse().getProofs())
                .containsEntry("trace_id", TRACE_ID)
                .containsKey("decision_path");
        verifyNoInteractions(llmIntentClassifier);

        ArgumentCaptor<AgentContext> context = ArgumentCaptor.forClass(AgentContext.class);
        verify(agentDispatcher).dispatch(eq(Intent.BOOKING_STATUS), context.capture());
        assertThat(context.getValue().getEntities().getString("booking_ref")).isEqualTo("123");
        assertThat(context.getValue().getUserId()).isEqualTo("user-123");
    }

    @Test
    void llmTimeoutFallsBackToPatternResult() {
        String text = "book an available slot";
        when(llmIntentClassifier.classify(eq(text), anyList(), eq(TRACE_ID)))
                .thenReturn(LlmClassificationOutcome.timedOut("timed out"));
        agentAnswers("BookingCreateAgent");

        OrchestrationResult result = orchestrator(llmOn).handleMessage(request(text, "CARRIER").build());

        assertThat(result.getClassification().getIntent()).isEqualTo(patternClassifier.classify(text).getIntent());
        assertThat(result.getDecisionPath()).startsWith("llm_timeout_fallback", "pattern_classifier");
        verify(llmIntentClassifier, times(1)).classify(anyString(), anyList(), anyString());
    }

    @Test
    void llmErrorFallsBackToPatternResult() {
        String text = "Verify booking REF123 on blockchain";
        when(llmIntentClassifier.classify(eq(text), anyList(), eq(TRACE_ID)))
                .thenReturn(LlmClassificationOutcome.failed("HTTP 503"));
        agentAnswers("BlockchainAuditAgent");

        OrchestrationResult result = orchestrator(llmOn).handleMessage(request(text, "OPERATOR").build());

        assertThat(result.getIntent()).isEqualTo("blockchain_audit");
        assertThat(result.getDecisionPath()).startsWith("llm_error_fallback", "pattern_classifier");
    }

    @Test
    void llmSuccessIsUsedAndItsEntitiesFillGaps() {
        IntentResult llmResult = IntentResult.builder()
                .intent(Intent.SLOT_AVAILABILITY)
                .confidence(0.9)
                .reason("llm_classifier")
                .entity("terminal", "B")
                .entity("gate", "G4")
                .build();
        when(llmIntentClassifier.classify(anyString(), anyList(), eq(TRACE_ID)))
                .thenReturn(LlmClassificationOutcome.success(llmResult, false));
        agentAnswers("SlotAvailabilityAgent");

        OrchestrationResult result = orchestrator(llmOn)
                .handleMessage(request("any room at terminal A?", "CARRIER").build());

        assertThat(result.getIntent()).isEqualTo("slot_availability");
        assertThat(result.getDecisionPath()).startsWith("llm_classifier");
        assertThat(result.getDecisionPath()).doesNotContain("pattern_classifier");

        ArgumentCaptor<AgentContext> context = ArgumentCaptor.forClass(AgentContext.class);
        verify(agentDispatcher).dispatch(eq(Intent.SLOT_AVAILABILITY), context.capture());
        assertThat(context.getValue().getEntities().getString("terminal")).isEqualTo("A");
        assertThat(context.getValue().getEntities().getString("gate")).isEqualTo("G4");
    }

    @Test
    void llmEntitiesAreNormalizedBeforeReachingAgents() {
        IntentResult llmResult = IntentResult.builder()
                .intent(Intent.BOOKING_CREATE)
                .confidence(0.9)
                .reason("llm_classifier")
                .entity("slot_id", "slot-abc-1")
                .entity("booking_ref", "REF77")
                .entity("date", "2030-03-14")
                .entity("terminal", "a")
                .build();
        when(llmIntentClassifier.classify(anyString(), anyList(), eq(TRACE_ID)))
                .thenReturn(LlmClassificationOutcome.success(llmResult, false));
        agentAnswers("BookingCreateAgent");

        orchestrator(llmOn).handleMessage(
                request("please set me up with slot abc 1 for the morning", "CARRIER").build());

        ArgumentCaptor<AgentContext> context = ArgumentCaptor.forClass(AgentContext.class);
        verify(agentDispatcher).dispatch(eq(Intent.BOOKING_CREATE), context.capture());
        ExtractedEntities entities = context.getValue().getEntities();
        assertThat(entities.asMap()).containsOnlyKeys("slot_id", "booking_ref", "date_explicit", "terminal");
        assertThat(entities.getString("slot_id")).isEqualTo("SLOT-ABC-1");
        assertThat(entities.getString("booking_ref")).isEqualTo("77");
        assertThat(entities.getString("terminal")).isEqualTo("A");

        BookingDateResolver dateResolver = new BookingDateResolver(
                Clock.fixed(Instant.parse("2030-01-01T00:00:00Z"), ZoneOffset.UTC), llmOn);
        assertThat(dateResolver.resolve(entities)).contains("2030-03-14");
    }

    @Test
    void forceDeterministicSkipsLlm() {
        agentAnswers("HelpAgent");

        OrchestrationResult result = orchestrator(llmOn)
                .handleMessage(request("help", null).forceDeterministic(true).build());

        assertThat(result.getIntent()).isEqualTo("help");
        assertThat(result.getDecisionPath()).noneMatch(step -> step.startsWith("llm_"));
        verifyNoInteractions(llmIntentClassifier);
    }

    @Test
    void carrierRequestingAuditIsForbiddenWithoutDispatch() {
        OrchestrationResult result = orchestrator(llmOff)
                .handleMessage(request("Verify booking REF123 on blockchain", "CARRIER").build());

        assertThat(result.getIntent()).isEqualTo("forbidden");
        assertThat(result.getResponse().isError()).isTrue();
        assertThat(result.getResponse().getErrorType()).isEqualTo("Forbidden");
        assertThat(result.getResponse().getData())
                .containsEntry("requested_intent", "blockchain_audit")
                .containsEntry("role", "CARRIER");
        assertThat(result.getResponse().getMessage()).contains("carrier");
        assertThat(result.getDecisionPath()).containsExactly("pattern_classifier", "access_denied");
        verify(agentDispatcher, never()).dispatch(any(), any());
    }

    @Test
    void anonymousCallerIsAskedToSignIn() {
        OrchestrationResult result = orchestrator(llmOff)
                .handleMessage(request("Book terminal A tomorrow", null).build());

        assertThat(result.getIntent()).isEqualTo("forbidden");
        assertThat(result.getResponse().getMessage()).contains("sign in");
        assertThat(result.getResponse().getData()).containsEntry("role", "UNKNOWN");
    }

    @Test
    void shortFollowUpReusesIntentFromHistory() {
        agentAnswers("BookingStatusAgent");
        List<ConversationTurn> history = List.of(ConversationTurn.user("status REF123", "booking_status"));

        OrchestrationResult result = orchestrator(llmOff)
                .handleMessage(request("and terminal A?", "CARRIER").history(history).build());

        assertThat(result.getIntent()).isEqualTo("booking_status");
        assertThat(result.getDecisionPath())
                .containsExactly("pattern_classifier", "follow_up:booking_status", "access_granted", "agent:BookingStatusAgent");
        assertThat(result.getClassification().getReasoning()).contains("follow_up");
    }

    @Test
    void llmUnknownStillGetsFollowUp() {
        when(llmIntentClassifier.classify(anyString(), anyList(), eq(TRACE_ID)))
                .thenReturn(LlmClassificationOutcome.success(IntentResult.unknown(0.2, "llm_classifier"), false));
        agentAnswers("SlotAvailabilityAgent");
        List<ConversationTurn> history = List.of(ConversationTurn.user("slots at terminal A", "slot_availability"));

        OrchestrationResult result = orchestrator(llmOn)
                .handleMessage(request("et demain?", "OPERATOR").history(history).build());

        assertThat(result.getIntent()).isEqualTo("slot_availability");
        assertThat(result.getDecisionPath()).containsSubsequence("llm_classifier", "follow_up:slot_availability");
    }

    @Test
    void emptyMessageIsUnknownWithoutException() {
        agentAnswers("UnknownIntentAgent");

        OrchestrationResult result = orchestrator(llmOn).handleMessage(request("", "CARRIER").build());

        assertThat(result.getIntent()).isEqualTo("unknown");
        assertThat(result.getClassification().getConfidence()).isEqualTo(1.0);
        verifyNoInteractions(llmIntentClassifier);

        ArgumentCaptor<AgentContext> context = ArgumentCaptor.forClass(AgentContext.class);
        verify(agentDispatcher).dispatch(eq(Intent.UNKNOWN), context.capture());
        assertThat(context.getValue().getEntities().isEmpty()).isTrue();
    }

    @Test
    void unregisteredIntentIsReportedAsNotImplemented() {
        OrchestratorService service = new OrchestratorService(patternClassifier, llmIntentClassifier, new EntityExtractor(),
                new FollowUpResolver(llmOff), new AccessPolicy(),
                new AgentDispatcher(new AgentRegistry(List.of())), llmOff);

        OrchestrationResult result = service.handleMessage(request("Show yesterday's truck entries", "OPERATOR").build());

        assertThat(result.getIntent()).isEqualTo("not_implemented");
        assertThat(result.getResponse().getErrorType()).isEqualTo("NotImplemented");
        assertThat(result.getDecisionPath()).endsWith("agent:none");
    }

    @Test
    void unexpectedFailureStillYieldsEnvelope() {
        when(agentDispatcher.dispatch(any(), any())).thenThrow(new IllegalStateException("registry broken"));

        OrchestrationResult result = orchestrator(llmOff).handleMessage(request("help", "ADMIN").build());

        assertThat(result.getResponse().isError()).isTrue();
        assertThat(result.getResponse().getErrorType()).isEqualTo("IllegalStateException");
        assertThat(result.getResponse().getProofs()).containsEntry("trace_id", TRACE_ID);
    }
}
