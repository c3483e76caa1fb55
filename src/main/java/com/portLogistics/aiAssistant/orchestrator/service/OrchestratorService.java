package com.portLogistics.aiAssistant.orchestrator.service;

import com.portLogistics.aiAssistant.access.model.AccessDecision;
import com.portLogistics.aiAssistant.access.model.UserRole;
import com.portLogistics.aiAssistant.access.service.AccessPolicy;
import com.portLogistics.aiAssistant.agent.model.AgentContext;
import com.portLogistics.aiAssistant.agent.model.AgentResponse;
import com.portLogistics.aiAssistant.agent.registry.AgentDispatcher;
import com.portLogistics.aiAssistant.classification.entity.EntityExtractor;
import com.portLogistics.aiAssistant.classification.followup.FollowUpResolver;
import com.portLogistics.aiAssistant.classification.model.Intent;
import com.portLogistics.aiAssistant.classification.model.IntentResult;
import com.portLogistics.aiAssistant.classification.pattern.PatternClassifier;
import com.portLogistics.aiAssistant.config.ClassificationSettings;
import com.portLogistics.aiAssistant.history.model.ConversationTurn;
import com.portLogistics.aiAssistant.llm.model.LlmClassificationOutcome;
import com.portLogistics.aiAssistant.llm.service.LlmIntentClassifier;
import com.portLogistics.aiAssistant.orchestrator.model.OrchestrationRequest;
import com.portLogistics.aiAssistant.orchestrator.model.OrchestrationResult;
import com.portLogistics.aiAssistant.orchestrator.model.OrchestrationState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Orchestrator service - owns the lifecycle of one message.
 *
 * Workflow steps:
 * CLASSIFY (LLM when configured and not forced off, pattern classifier otherwise or on any LLM failure)
 * -> FOLLOWUP (only when the intent is unknown) -> AUTHORIZE (denial ends the request)
 * -> DISPATCH -> RESPOND
 *
 * Each step runs once; the LLM is never retried. Whatever happens, an envelope comes back.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrchestratorService {

    public static final String INTENT_FORBIDDEN = "forbidden";
    public static final String INTENT_NOT_IMPLEMENTED = "not_implemented";

    public static final String PROOF_DECISION_PATH = "decision_path";

    static final String CLASSIFIER_LLM = "llm";
    static final String CLASSIFIER_PATTERN = "pattern";

    private final PatternClassifier patternClassifier;
    private final LlmIntentClassifier llmIntentClassifier;
    private final EntityExtractor entityExtractor;
    private final FollowUpResolver followUpResolver;
    private final AccessPolicy accessPolicy;
    private final AgentDispatcher agentDispatcher;
    private final ClassificationSettings settings;

    /**
     * Processes one message through the complete workflow.
     *
     * @param request Message, normalized history, caller identity and trace id
     * @return Final intent label and envelope
     */
    public OrchestrationResult handleMessage(OrchestrationRequest request) {
        String traceId = request.getTraceId();
        log.info("Starting orchestration - traceId: {}", traceId);

        OrchestrationState state = OrchestrationState.builder()
                .request(request)
                .build();

        try {
            // Step 1: CLASSIFY
            classify(state);

            // Step 2: FOLLOWUP
            if (state.getClassification().isUnknown()) {
                resolveFollowUp(state);
            }

            // Step 3: AUTHORIZE
            if (!authorize(state)) {
                return respond(state);
            }

            // Step 4: DISPATCH
            dispatch(state);

            // Step 5: RESPOND
            return respond(state);
        } catch (Exception e) {
            log.error("Error in orchestration - traceId: {}", traceId, e);
            state.step("orchestration_error");
            state.setResponseIntent(state.getClassification() != null
                    ? state.getClassification().getIntent().getWireName()
                    : Intent.UNKNOWN.getWireName());
            state.setResponse(AgentResponse.error(
                    "I encountered an error processing your request. Please try again.",
                    e.getClass().getSimpleName(), traceId, Map.of()));
            return respond(state);
        }
    }

    private void classify(OrchestrationState state) {
        OrchestrationRequest request = state.getRequest();
        String message = request.getMessage();
        String traceId = request.getTraceId();
        boolean blank = message == null || message.isBlank();

        IntentResult result = null;
        if (settings.isLlmConfigured() && !request.isForceDeterministic() && !blank) {
            LlmClassificationOutcome outcome = llmIntentClassifier.classify(message, history(request), traceId);
            if (outcome.isSuccess()) {
                state.step("llm_classifier");
                state.setClassifier(CLASSIFIER_LLM);
                result = outcome.getResult();
            } else {
                state.step(outcome.getStatus() == LlmClassificationOutcome.Status.TIMED_OUT
                        ? "llm_timeout_fallback"
                        : "llm_error_fallback");
                log.info("Falling back to pattern classifier - traceId: {}, reason: {}", traceId, outcome.getErrorMessage());
            }
        }

        if (result == null) {
            state.step("pattern_classifier");
            state.setClassifier(CLASSIFIER_PATTERN);
            result = patternClassifier.classify(message);
        }

        state.setClassification(result);
        state.setEntities(entityExtractor.extract(message)
                .withDefaults(entityExtractor.normalize(result.getEntities()).asMap()));
        log.info("Step CLASSIFY - traceId: {}, classifier: {}, intent: {}, confidence: {}",
                traceId, state.getClassifier(), result.getIntent(), result.getConfidence());
    }

    private void resolveFollowUp(OrchestrationState state) {
        OrchestrationRequest request = state.getRequest();
        Optional<Intent> previous = followUpResolver.resolve(request.getMessage(), history(request));
        if (previous.isEmpty()) {
            return;
        }
        Intent intent = previous.get();
        state.setFollowUpApplied(true);
        state.step("follow_up:" + intent.getWireName());
        state.setClassification(state.getClassification().toBuilder()
                .intent(intent)
                .reason("follow_up")
                .build());
        log.info("Step FOLLOWUP - traceId: {}, reusing intent: {}", request.getTraceId(), intent);
    }

    private boolean authorize(OrchestrationState state) {
        OrchestrationRequest request = state.getRequest();
        Intent intent = state.getClassification().getIntent();
        AccessDecision decision = accessPolicy.decide(intent, request.getRole());
        state.setAccessDecision(decision);
        if (decision.isAllowed()) {
            state.step("access_granted");
            return true;
        }

        state.step("access_denied");
        state.setResponseIntent(INTENT_FORBIDDEN);
        Map<String, Object> extra = new LinkedHashMap<>();
        extra.put("requested_intent", intent.getWireName());
        extra.put("role", decision.getRole());
        state.setResponse(AgentResponse.error(
                forbiddenMessage(intent, request.getRole()), "Forbidden", request.getTraceId(), extra));
        return false;
    }

    private void dispatch(OrchestrationState state) {
        OrchestrationRequest request = state.getRequest();
        Intent intent = state.getClassification().getIntent();
        AgentContext context = AgentContext.builder()
                .message(request.getMessage())
                .intent(intent)
                .entities(state.getEntities())
                .history(history(request))
                .role(request.getRole())
                .userId(request.getUserId())
                .traceId(request.getTraceId())
                .authToken(request.getAuthToken())
                .build();

        AgentDispatcher.DispatchResult result = agentDispatcher.dispatch(intent, context);
        state.setResponse(result.response());
        if (result.handled()) {
            state.setAgentName(result.agentName());
            state.setResponseIntent(intent.getWireName());
            state.step("agent:" + result.agentName());
        } else {
            state.setResponseIntent(INTENT_NOT_IMPLEMENTED);
            state.step("agent:none");
        }
        log.debug("Step DISPATCH - traceId: {}, agent: {}, error: {}",
                request.getTraceId(), state.getAgentName(), result.response().isError());
    }

    private OrchestrationResult respond(OrchestrationState state) {
        AgentResponse response = state.getResponse();
        Map<String, Object> proofs = new LinkedHashMap<>();
        if (response.getProofs() != null) {
            proofs.putAll(response.getProofs());
        }
        proofs.putIfAbsent(AgentResponse.PROOF_TRACE_ID, state.getTraceId());
        proofs.put(PROOF_DECISION_PATH, List.copyOf(state.getDecisionPath()));
        if (state.getClassification() != null) {
            proofs.put("classifier", state.getClassifier());
            proofs.put("confidence", state.getClassification().getConfidence());
            proofs.put("reasoning", state.getClassification().getReasoning());
        }

        log.info("Orchestration completed - traceId: {}, intent: {}, path: {}",
                state.getTraceId(), state.getResponseIntent(), state.getDecisionPath());
        return OrchestrationResult.builder()
                .intent(state.getResponseIntent())
                .classification(state.getClassification())
                .response(response.toBuilder().proofs(proofs).build())
                .decisionPath(List.copyOf(state.getDecisionPath()))
                .build();
    }

    private static List<ConversationTurn> history(OrchestrationRequest request) {
        return request.getHistory() != null ? request.getHistory() : List.of();
    }

    private static String forbiddenMessage(Intent intent, String role) {
        String feature = intent.getWireName().replace('_', ' ');
        Optional<UserRole> userRole = UserRole.parse(role);
        if (userRole.isEmpty()) {
            return "Please sign in with an authorized account to use " + feature + ".";
        }
        return "Your " + userRole.get().name().toLowerCase(Locale.ROOT) + " account does not have access to " + feature
                + ". Type \"help\" to see what you can do.";
    }
}
